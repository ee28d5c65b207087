package com.edlsim;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EntryConfig loading and validation")
class EntryConfigTest {

    @Test
    @DisplayName("Classpath resource loads with the Mars values")
    void loadsClasspathDefaults() {
        final EntryConfig cfg = EntryConfig.load();
        assertAll(
            () -> assertEquals(3_389_500.0, cfg.getBodyRadius()),
            () -> assertEquals(899.0, cfg.getVehicleMass()),
            () -> assertEquals(0.1, cfg.getTimeStep()),
            () -> assertEquals(-4.5895, cfg.getLandingLatitudeDeg()),
            () -> assertEquals(3.7278, cfg.getSurfaceGravity(), 1e-3)
        );
    }

    @Test
    @DisplayName("Properties override single values and keep the rest")
    void propertiesOverride() {
        final Properties p = new Properties();
        p.setProperty("edlsim.vehicleMass", " 1025 ");
        p.setProperty("edlsim.fallbackDirection", "1, 0, 0");
        p.setProperty("edlsim.unrelated", "ignored");
        final EntryConfig cfg = EntryConfig.fromProperties(p);
        assertAll(
            () -> assertEquals(1025.0, cfg.getVehicleMass()),
            () -> assertEquals(Vector3D.PLUS_I, cfg.getFallbackDirection()),
            () -> assertEquals(15.9, cfg.getReferenceArea())
        );
    }

    @Test
    @DisplayName("Changing the body radius moves the default atmosphere ceiling")
    void ceilingFollowsRadius() {
        final Properties p = new Properties();
        p.setProperty("edlsim.bodyRadius", "6371000");
        assertEquals(637_100.0, EntryConfig.fromProperties(p).getAtmosphereCeiling(), 1e-6);
    }

    @Test
    @DisplayName("Unparseable values are rejected with the key name")
    void parseError() {
        final Properties p = new Properties();
        p.setProperty("edlsim.timeStep", "fast");
        final IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> EntryConfig.fromProperties(p));
        assertTrue(ex.getMessage().contains("edlsim.timeStep"));
        assertInstanceOf(NumberFormatException.class, ex.getCause());

        final Properties vec = new Properties();
        vec.setProperty("edlsim.fallbackDirection", "1,2");
        assertThrows(IllegalArgumentException.class, () -> EntryConfig.fromProperties(vec));
    }

    @Test
    @DisplayName("Validation rejects values that break the physics")
    void validation() {
        final EntryConfig negativeMass = EntryConfig.marsDefaults();
        negativeMass.setVehicleMass(-1.0);
        final EntryConfig zeroDirection = EntryConfig.marsDefaults();
        zeroDirection.setFallbackDirection(Vector3D.ZERO);
        final EntryConfig inverted = EntryConfig.marsDefaults();
        inverted.setStratopauseAltitude(5_000.0);
        assertAll(
            () -> assertThrows(IllegalArgumentException.class, negativeMass::validate),
            () -> assertThrows(IllegalArgumentException.class, zeroDirection::validate),
            () -> assertThrows(IllegalArgumentException.class, inverted::validate),
            () -> assertDoesNotThrow(() -> EntryConfig.marsDefaults().validate())
        );
    }

    @Test
    @DisplayName("Copies are independent of later setter calls")
    void copyIsIndependent() {
        final EntryConfig cfg = EntryConfig.marsDefaults();
        final EntryConfig copy = cfg.copy();
        cfg.setLiftToDragRatio(0.3);
        assertEquals(0.13, copy.getLiftToDragRatio());
        assertEquals(cfg.getLandingTarget(), copy.getLandingTarget());
    }

    @Test
    @DisplayName("Loads a properties file and wraps a missing file")
    void loadFromFile(@TempDir Path tmp) throws IOException {
        final Path file = tmp.resolve("edl.properties");
        Files.write(file, "edlsim.liftToDragRatio=0.24\nedlsim.maxGLoad=15\n".getBytes(StandardCharsets.UTF_8));
        final EntryConfig cfg = EntryConfig.load(file);
        assertEquals(0.24, cfg.getLiftToDragRatio());
        assertEquals(15.0, cfg.getMaxGLoad());

        final IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> EntryConfig.load(tmp.resolve("missing.properties")));
        assertInstanceOf(IOException.class, ex.getCause());
    }

    @Test
    @DisplayName("Landing target sits on the surface")
    void landingTarget() {
        final EntryConfig cfg = EntryConfig.marsDefaults();
        assertEquals(cfg.getBodyRadius(), cfg.getLandingTarget().getNorm(), 1e-6);
    }
}
