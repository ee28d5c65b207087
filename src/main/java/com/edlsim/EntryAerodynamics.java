package com.edlsim;

import com.edlsim.util.AtmosphereModel;
import com.edlsim.util.Frames;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.util.Objects;

/**
 * Aerodynamic loads on the entry capsule.
 *
 * <ul>
 *   <li>q = ½ ρ |v|², drag = q · A (drag coefficient folded into A)</li>
 *   <li>lift = drag · (L/D) · sin|σ|, σ the bank angle</li>
 *   <li>lift direction: the in-plane normal to v̂, rotated about v̂ by σ</li>
 *   <li>stagnation heating, Sutton–Graves: k · sqrt(ρ / r_n) · v³</li>
 * </ul>
 */
public final class EntryAerodynamics {

    /** Standard gravity, used only to express g-load. */
    public static final double G0 = 9.80665;

    private static final double MIN_SPEED = 1e-3;
    private static final Vector3D DEFAULT_UP = Vector3D.PLUS_J;

    private final EntryConfig config;
    private final AtmosphereModel atmosphere;

    public EntryAerodynamics(EntryConfig config) {
        this(config, new AtmosphereModel(config));
    }

    public EntryAerodynamics(EntryConfig config, AtmosphereModel atmosphere) {
        this.config = Objects.requireNonNull(config, "config must not be null").copy();
        this.atmosphere = Objects.requireNonNull(atmosphere, "atmosphere must not be null");
    }

    public AtmosphereModel atmosphere() { return atmosphere; }

    public double dynamicPressure(double density, double speed) { return 0.5 * density * speed * speed; }

    public double dragForce(double dynamicPressure) { return dynamicPressure * config.getReferenceArea(); }

    public double liftForce(double dragForce, double bankAngleDeg) {
        return dragForce * config.getLiftToDragRatio() * Math.sin(Math.toRadians(Math.abs(bankAngleDeg)));
    }

    /**
     * Unit lift direction. With h = normalize(r × v), the base direction
     * normalize(h × v̂) lies in the trajectory plane, perpendicular to v̂; it is
     * then rotated about v̂ by the bank angle.
     * <p>
     * Below {@value #MIN_SPEED} m/s the base is a default up vector
     * orthogonalized against v̂; if r and v are parallel the base is any axis
     * orthogonal to v̂.
     * </p>
     */
    public Vector3D liftDirection(Vector3D position, Vector3D velocity, double bankAngleDeg) {
        final Vector3D vHat = Frames.unit(velocity);
        if (vHat.getNormSq() == 0.0) return DEFAULT_UP;
        Vector3D base;
        final Vector3D h = position.crossProduct(velocity);
        if (velocity.getNorm() < MIN_SPEED || h.getNormSq() < Frames.DEGENERATE_EPS) {
            base = Frames.orthogonalize(DEFAULT_UP, vHat);
        } else {
            base = h.normalize().crossProduct(vHat);
            base = base.getNormSq() < Frames.DEGENERATE_EPS ? vHat.orthogonal() : base.normalize();
        }
        return Frames.rotate(base, vHat, Math.toRadians(bankAngleDeg));
    }

    /** Drag and lift at a state. */
    public Loads loads(Vector3D position, Vector3D velocity, double bankAngleDeg) {
        final double altitude = position.getNorm() - config.getBodyRadius();
        final double rho = atmosphere.density(altitude);
        final double speed = velocity.getNorm();
        final double q = dynamicPressure(rho, speed);
        final double drag = dragForce(q);
        final double lift = liftForce(drag, bankAngleDeg);

        final double m = config.getVehicleMass();
        final Vector3D dragAccel = speed > 0.0 ? Frames.unit(velocity).scalarMultiply(-drag / m) : Vector3D.ZERO;
        final Vector3D liftDir = liftDirection(position, velocity, bankAngleDeg);
        final Vector3D liftAccel = lift == 0.0 ? Vector3D.ZERO : liftDir.scalarMultiply(lift / m);
        return new Loads(rho, q, drag, lift, dragAccel, liftDir, liftAccel);
    }

    /** Convective heating at the stagnation point (W/cm²). */
    public double heatingRate(double density, double speed) {
        if (!(density > 0.0)) return 0.0;
        final double wPerM2 = config.getHeatingCoefficient() * Math.sqrt(density / config.getNoseRadius())
                * speed * speed * speed;
        return wPerM2 / 1.0e4;
    }

    /** Snapshot used by the phase machine. */
    public VehicleState vehicleState(TrajectorySample s) {
        Objects.requireNonNull(s, "sample must not be null");
        final Loads l = loads(s.getPosition(), s.getVelocity(), s.getBankAngle());
        final double speed = s.getVelocityMagnitude();
        final double alt = s.getAltitude();
        final double gLoad = l.aerodynamicAcceleration().getNorm() / G0;
        return new VehicleState(s.getTime(), alt, speed,
                atmosphere.density(alt),
                atmosphere.dynamicPressure(speed, alt),
                atmosphere.machNumber(speed, alt),
                heatingRate(atmosphere.density(alt), speed),
                gLoad);
    }

    /** Forces and accelerations at one state. */
    public static final class Loads {
        private final double density;
        private final double dynamicPressure;
        private final double drag;
        private final double lift;
        private final Vector3D dragAcceleration;
        private final Vector3D liftDirection;
        private final Vector3D liftAcceleration;

        Loads(double density, double dynamicPressure, double drag, double lift,
              Vector3D dragAcceleration, Vector3D liftDirection, Vector3D liftAcceleration) {
            this.density = density;
            this.dynamicPressure = dynamicPressure;
            this.drag = drag;
            this.lift = lift;
            this.dragAcceleration = dragAcceleration;
            this.liftDirection = liftDirection;
            this.liftAcceleration = liftAcceleration;
        }

        public double density()              { return density; }
        public double dynamicPressure()      { return dynamicPressure; }
        public double drag()                 { return drag; }
        public double lift()                 { return lift; }
        public Vector3D dragAcceleration()    { return dragAcceleration; }
        public Vector3D liftDirection()       { return liftDirection; }
        public Vector3D liftAcceleration()    { return liftAcceleration; }

        public Vector3D aerodynamicAcceleration() { return dragAcceleration.add(liftAcceleration); }
    }
}
