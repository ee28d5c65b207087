package com.edlsim.util;

import org.hipparchus.geometry.euclidean.threed.Rotation;
import org.hipparchus.geometry.euclidean.threed.RotationConvention;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Frame helpers on top of Hipparchus {@link Vector3D}: steering and lift bases,
 * bank rotation and planet-fixed spherical ↔ Cartesian conversion.
 *
 * Spherical convention: longitude θ measured in the x-y plane from +x,
 * latitude φ measured from the equator toward +z. Local ENU axes at (θ, φ):
 * <pre>
 *   E = (-sinθ,        cosθ,       0)
 *   N = (-cosθ·sinφ,  -sinθ·sinφ,  cosφ)
 *   U = ( cosθ·cosφ,   sinθ·cosφ,  sinφ)
 * </pre>
 * Heading ψ is measured from East toward North.
 */
public final class Frames {

    /** Squared-length floor below which a vector is treated as direction-less. */
    public static final double DEGENERATE_EPS = 1e-8;

    private Frames() {} // utility class

    /** Unit vector along {@code v}, or {@link Vector3D#ZERO} when {@code v} has no length. */
    public static Vector3D unit(Vector3D v) {
        final double n = v.getNorm();
        return n == 0.0 || !Double.isFinite(n) ? Vector3D.ZERO : v.scalarMultiply(1.0 / n);
    }

    public static boolean isFinite(Vector3D v) {
        return !v.isNaN() && !v.isInfinite();
    }

    public static boolean isNearZero(Vector3D v, double eps) {
        return v.getNormSq() < eps * eps;
    }

    /** Rotate {@code v} about {@code axis} by {@code angleRad}, right-hand rule. */
    public static Vector3D rotate(Vector3D v, Vector3D axis, double angleRad) {
        if (angleRad == 0.0 || axis.getNormSq() == 0.0) return v;
        return new Rotation(axis, angleRad, RotationConvention.VECTOR_OPERATOR).applyTo(v);
    }

    /**
     * Single Gram–Schmidt pass: the component of {@code candidate} orthogonal to
     * {@code reference}, normalized. Falls back to {@link Vector3D#orthogonal()}
     * when the remainder degenerates.
     */
    public static Vector3D orthogonalize(Vector3D candidate, Vector3D reference) {
        final Vector3D r = unit(reference);
        final Vector3D rest = candidate.subtract(candidate.dotProduct(r), r);
        if (rest.getNormSq() < DEGENERATE_EPS) {
            final Vector3D base = r.getNormSq() == 0.0 ? candidate : r;
            return base.getNormSq() == 0.0 ? Vector3D.PLUS_I : base.orthogonal();
        }
        return rest.normalize();
    }

    /**
     * Horizontal steering axis at a point: {@code normalize(velDir × up)}. When the
     * velocity is radial or missing, uses {@code (1,0,0) × up}; when that also
     * degenerates, any axis orthogonal to {@code up}.
     */
    public static Vector3D horizontalAxis(Vector3D position, Vector3D velocity) {
        final Vector3D up = unit(position);
        Vector3D h = unit(velocity).crossProduct(up);
        if (h.getNormSq() < DEGENERATE_EPS) {
            h = Vector3D.PLUS_I.crossProduct(up);
        }
        if (h.getNormSq() < DEGENERATE_EPS) {
            return up.getNormSq() == 0.0 ? Vector3D.PLUS_I : up.orthogonal();
        }
        return h.normalize();
    }

    // ── spherical / ENU ────────────────────────────────────────────────────

    public static Vector3D sphericalToCartesian(double radius, double longitudeRad, double latitudeRad) {
        final double cl = Math.cos(latitudeRad);
        return new Vector3D(
                radius * cl * Math.cos(longitudeRad),
                radius * cl * Math.sin(longitudeRad),
                radius * Math.sin(latitudeRad));
    }

    public static Vector3D east(double longitudeRad) {
        return new Vector3D(-Math.sin(longitudeRad), Math.cos(longitudeRad), 0.0);
    }

    public static Vector3D north(double longitudeRad, double latitudeRad) {
        final double sp = Math.sin(latitudeRad);
        return new Vector3D(-Math.cos(longitudeRad) * sp, -Math.sin(longitudeRad) * sp, Math.cos(latitudeRad));
    }

    public static Vector3D up(double longitudeRad, double latitudeRad) {
        return sphericalToCartesian(1.0, longitudeRad, latitudeRad);
    }

    /**
     * Inertial velocity from speed, flight-path angle γ (positive up) and
     * heading ψ (from East toward North) at the given location.
     */
    public static Vector3D velocityFromFlightPath(double speed, double flightPathRad, double headingRad,
                                                  double longitudeRad, double latitudeRad) {
        final double cg = Math.cos(flightPathRad);
        return new Vector3D(speed * cg * Math.cos(headingRad), east(longitudeRad),
                            speed * cg * Math.sin(headingRad), north(longitudeRad, latitudeRad),
                            speed * Math.sin(flightPathRad), up(longitudeRad, latitudeRad));
    }

    /** Longitude (rad) of a Cartesian point. */
    public static double longitudeOf(Vector3D p) { return Math.atan2(p.getY(), p.getX()); }

    /** Latitude (rad) of a Cartesian point; 0 at the origin. */
    public static double latitudeOf(Vector3D p) {
        final double r = p.getNorm();
        if (r == 0.0) return 0.0;
        return Math.asin(Math.max(-1.0, Math.min(1.0, p.getZ() / r)));
    }

    /** Flight-path angle (rad) of {@code velocity} relative to the local horizontal at {@code position}. */
    public static double flightPathAngle(Vector3D position, Vector3D velocity) {
        final double v = velocity.getNorm();
        if (v == 0.0) return 0.0;
        final double vr = velocity.dotProduct(unit(position));
        return Math.asin(Math.max(-1.0, Math.min(1.0, vr / v)));
    }
}
