package com.edlsim;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ForwardIntegrator")
class ForwardIntegratorTest {

    private final EntryConfig cfg = EntryConfig.marsDefaults();
    private final ForwardIntegrator integrator = new ForwardIntegrator(cfg);

    private Vector3D entryPosition() { return new Vector3D(cfg.getBodyRadius() + 125_000.0, 0.0, 0.0); }
    private Vector3D entryVelocity() { return new Vector3D(-1_600.0, 5_850.0, 0.0); }

    @Test
    @DisplayName("Emits the initial sample plus one sample per step")
    void sampleCount() {
        final Trajectory t = integrator.integrate(entryPosition(), entryVelocity(), 10.0, 0.1, BankAngleProfile.constant(0));
        assertAll(
            () -> assertEquals(101, t.size()),
            () -> assertEquals(0.0, t.startTime()),
            () -> assertEquals(10.0, t.endTime(), 1e-9),
            () -> assertEquals(125_000.0, t.first().getAltitude(), 1e-6),
            () -> assertTrue(t.last().getAltitude() < t.first().getAltitude())
        );
    }

    @Test
    @DisplayName("Zero bank angle produces exactly zero lift")
    void zeroBankZeroLift() {
        final EntryAerodynamics aero = new EntryAerodynamics(cfg);
        final EntryAerodynamics.Loads l = aero.loads(new Vector3D(cfg.getBodyRadius() + 30_000.0, 0, 0),
                new Vector3D(-500.0, 4_000.0, 100.0), 0.0);
        assertAll(
            () -> assertTrue(l.drag() > 0.0),
            () -> assertEquals(0.0, l.lift()),
            () -> assertEquals(Vector3D.ZERO, l.liftAcceleration())
        );
    }

    @Test
    @DisplayName("Zero bank angle keeps the trajectory in the initial orbital plane")
    void zeroBankStaysPlanar() {
        final Trajectory t = integrator.integrate(entryPosition(), entryVelocity(), 200.0, 0.1, BankAngleProfile.constant(0));
        for (TrajectorySample s : t.samples()) {
            assertEquals(0.0, s.getPosition().getZ(), 0.0, "z drifted at t=" + s.getTime());
            assertEquals(0.0, s.getVelocity().getZ(), 0.0);
        }

        // general orientation: out-of-plane component stays at round-off level
        final Vector3D r0 = new Vector3D(2.0e6, -1.5e6, 2.2e6).normalize().scalarMultiply(cfg.getBodyRadius() + 125_000.0);
        final Vector3D v0 = new Vector3D(3_000.0, 4_000.0, 1_000.0);
        final Vector3D normal = r0.crossProduct(v0).normalize();
        final Trajectory skew = integrator.integrate(r0, v0, 100.0, 0.1, BankAngleProfile.constant(0));
        for (TrajectorySample s : skew.samples()) {
            assertEquals(0.0, s.getPosition().dotProduct(normal), 1e-3);
        }
    }

    @Test
    @DisplayName("Banking moves the vehicle out of the initial plane")
    void bankingLeavesPlane() {
        final Trajectory t = integrator.integrate(entryPosition(), entryVelocity(), 200.0, 0.1, BankAngleProfile.constant(60));
        assertTrue(Math.abs(t.last().getPosition().getZ()) > 1.0);
        assertEquals(60.0, t.last().getBankAngle());
    }

    @Test
    @DisplayName("Integration is deterministic")
    void deterministic() {
        final Trajectory a = integrator.integrate(entryPosition(), entryVelocity(), 50.0, 0.1, BankAngleProfile.constant(30));
        final Trajectory b = integrator.integrate(entryPosition(), entryVelocity(), 50.0, 0.1, BankAngleProfile.constant(30));
        assertEquals(a.size(), b.size());
        for (int i = 0; i < a.size(); i++) {
            assertEquals(a.get(i).getPosition(), b.get(i).getPosition());
            assertEquals(a.get(i).getVelocity(), b.get(i).getVelocity());
        }
    }

    @Test
    @DisplayName("Gravity follows the inverse-square law from the surface value")
    void gravity() {
        final double g0 = cfg.getGravitationalParameter() / (cfg.getBodyRadius() * cfg.getBodyRadius());
        final Vector3D atSurface = integrator.gravity(new Vector3D(cfg.getBodyRadius(), 0, 0));
        final Vector3D atTwoR = integrator.gravity(new Vector3D(0, 2 * cfg.getBodyRadius(), 0));
        assertAll(
            () -> assertEquals(-g0, atSurface.getX(), 1e-12),
            () -> assertEquals(3.727, g0, 0.01),
            () -> assertEquals(-g0 / 4.0, atTwoR.getY(), 1e-12),
            () -> assertEquals(Vector3D.ZERO, integrator.gravity(Vector3D.ZERO))
        );
    }

    @Test
    @DisplayName("Stops at the terminal altitude")
    void terminalAltitude() {
        final ForwardIntegrator fi = new ForwardIntegrator(cfg);
        fi.setTerminalAltitude(100_000.0);
        final Trajectory t = fi.integrate(entryPosition(), entryVelocity(), 500.0, 0.1, BankAngleProfile.constant(0));
        assertTrue(t.last().getAltitude() <= 100_000.0);
        assertTrue(t.get(t.size() - 2).getAltitude() > 100_000.0);
    }

    @Test
    @DisplayName("Spherical entry state integrates from the requested altitude and speed")
    void entryState() {
        final Trajectory t = integrator.integrate(EntryState.mars2020(), 5.0, BankAngleProfile.constant(30));
        assertAll(
            () -> assertEquals(124_999.0, t.first().getAltitude(), 1e-6),
            () -> assertEquals(6083.6, t.first().getVelocityMagnitude(), 1e-6),
            () -> assertEquals(51, t.size())
        );
    }

    @Test
    @DisplayName("continueFrom keeps the past and re-integrates the future")
    void continueFrom() {
        final Trajectory base = integrator.integrate(entryPosition(), entryVelocity(), 60.0, 0.1, BankAngleProfile.constant(0));
        final Trajectory replanned = integrator.continueFrom(base, 20.0, BankAngleProfile.constant(75));
        final int cut = base.indexAtOrBefore(20.0);

        for (int i = 0; i <= cut; i++) {
            assertSame(base.get(i), replanned.get(i));
        }
        for (int i = cut + 1; i < replanned.size(); i++) {
            assertTrue(replanned.get(i).getTime() > replanned.get(i - 1).getTime());
            assertEquals(75.0, replanned.get(i).getBankAngle());
        }
        assertTrue(replanned.endTime() <= base.endTime() + 1e-9);
        assertNotEquals(base.last().getPosition(), replanned.last().getPosition());
    }

    @Test
    @DisplayName("continueFrom at the last sample is a no-op")
    void continueFromEnd() {
        final Trajectory base = integrator.integrate(entryPosition(), entryVelocity(), 1.0, 0.1, BankAngleProfile.constant(0));
        assertSame(base, integrator.continueFrom(base, 99.0, BankAngleProfile.constant(45)));
    }

    @Test
    @DisplayName("Rejects non-positive step size")
    void rejectsBadStep() {
        assertThrows(IllegalArgumentException.class,
                () -> integrator.integrate(entryPosition(), entryVelocity(), 1.0, 0.0, BankAngleProfile.constant(0)));
    }
}
