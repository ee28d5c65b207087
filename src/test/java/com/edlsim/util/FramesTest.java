package com.edlsim.util;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Frames vector helpers")
class FramesTest {

    private static void assertVec(Vector3D expected, Vector3D actual, double tol) {
        assertAll(
            () -> assertEquals(expected.getX(), actual.getX(), tol, "x"),
            () -> assertEquals(expected.getY(), actual.getY(), tol, "y"),
            () -> assertEquals(expected.getZ(), actual.getZ(), tol, "z")
        );
    }

    @Test
    @DisplayName("Quarter turn about +z maps +x to +y")
    void rotateQuarterTurn() {
        assertVec(Vector3D.PLUS_J, Frames.rotate(Vector3D.PLUS_I, Vector3D.PLUS_K, Math.PI / 2), 1e-12);
    }

    @Test
    @DisplayName("Rotation about a vector leaves that vector unchanged")
    void rotateAboutSelf() {
        final Vector3D v = new Vector3D(1, 2, 3);
        assertVec(v, Frames.rotate(v, v, 1.234), 1e-12);
    }

    @Test
    @DisplayName("Zero angle or zero axis leaves the vector unchanged")
    void rotateDegenerate() {
        final Vector3D v = new Vector3D(1, 2, 3);
        assertSame(v, Frames.rotate(v, Vector3D.ZERO, 0.5));
        assertSame(v, Frames.rotate(v, Vector3D.PLUS_K, 0.0));
    }

    @Test
    @DisplayName("unit() returns ZERO instead of throwing for a zero or non-finite vector")
    void safeUnit() {
        assertAll(
            () -> assertEquals(Vector3D.ZERO, Frames.unit(Vector3D.ZERO)),
            () -> assertEquals(Vector3D.ZERO, Frames.unit(Vector3D.NaN)),
            () -> assertEquals(1.0, Frames.unit(new Vector3D(3, 4, 0)).getNorm(), 1e-15),
            () -> assertFalse(Frames.isFinite(new Vector3D(1, Double.POSITIVE_INFINITY, 0))),
            () -> assertTrue(Frames.isNearZero(new Vector3D(1e-9, 0, 0), 1e-8))
        );
    }

    @Test
    @DisplayName("orthogonalize returns unit vectors orthogonal to the reference")
    void orthogonality() {
        final Vector3D ref = new Vector3D(0.3, -4.0, 2.0);
        final Vector3D o = Frames.orthogonalize(Vector3D.ZERO, ref);
        final Vector3D g = Frames.orthogonalize(Vector3D.PLUS_J, ref);
        final Vector3D parallel = Frames.orthogonalize(ref.scalarMultiply(2.0), ref);
        assertAll(
            () -> assertEquals(0.0, o.dotProduct(ref), 1e-12),
            () -> assertEquals(1.0, o.getNorm(), 1e-12),
            () -> assertEquals(0.0, g.dotProduct(ref.normalize()), 1e-12),
            () -> assertEquals(1.0, g.getNorm(), 1e-12),
            () -> assertEquals(0.0, parallel.dotProduct(ref.normalize()), 1e-12, "parallel candidate falls back"),
            () -> assertEquals(1.0, parallel.getNorm(), 1e-12)
        );
    }

    @Test
    @DisplayName("Horizontal axis falls back when velocity is radial")
    void horizontalFallback() {
        final Vector3D pos = new Vector3D(0, 0, 3_400_000);
        final Vector3D h = Frames.horizontalAxis(pos, new Vector3D(0, 0, -10));
        assertAll(
            () -> assertEquals(1.0, h.getNorm(), 1e-12),
            () -> assertEquals(0.0, h.dotProduct(pos.normalize()), 1e-12)
        );
    }

    @Test
    @DisplayName("Spherical conversion and flight-path velocity agree with the ENU axes")
    void sphericalAndFlightPath() {
        final double lon = Math.toRadians(137.4417), lat = Math.toRadians(-4.5895);
        final Vector3D p = Frames.sphericalToCartesian(3_389_500.0, lon, lat);
        final Vector3D v = Frames.velocityFromFlightPath(6000.0, Math.toRadians(-15.5), Math.toRadians(30.0), lon, lat);
        assertAll(
            () -> assertEquals(3_389_500.0, p.getNorm(), 1e-6),
            () -> assertEquals(lon, Frames.longitudeOf(p), 1e-12),
            () -> assertEquals(lat, Frames.latitudeOf(p), 1e-12),
            () -> assertEquals(6000.0, v.getNorm(), 1e-9),
            () -> assertEquals(Math.toRadians(-15.5), Frames.flightPathAngle(p, v), 1e-12),
            () -> assertEquals(0.0, Frames.east(lon).dotProduct(Frames.north(lon, lat)), 1e-12),
            () -> assertEquals(0.0, Frames.up(lon, lat).dotProduct(Frames.north(lon, lat)), 1e-12)
        );
    }
}
