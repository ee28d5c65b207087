package com.edlsim;

import com.edlsim.util.Frames;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Point-mass entry integrator.
 *
 * Per step, with σ from the bank profile:
 * <pre>
 *   a = −r̂ · g0 · (R/|r|)²  −  v̂ · D/m  +  l̂(σ) · L/m
 *   v += a · dt
 *   r += v · dt          (semi-implicit Euler)
 * </pre>
 * Deterministic: identical inputs give bit-identical samples.
 */
public final class ForwardIntegrator {

    private static final Logger LOG = LoggerFactory.getLogger(ForwardIntegrator.class);

    private final EntryConfig config;
    private final EntryAerodynamics aero;
    private final double bodyRadius;
    private final double surfaceGravity;
    private final Vector3D landingTarget;

    /** Stop once altitude reaches this value; null integrates the full duration. */
    private Double terminalAltitude = null;
    private boolean stopAtSurface = true;

    public ForwardIntegrator(EntryConfig config) {
        this(config, new EntryAerodynamics(config));
    }

    public ForwardIntegrator(EntryConfig config, EntryAerodynamics aero) {
        this.config = Objects.requireNonNull(config, "config must not be null").copy().validate();
        this.aero = Objects.requireNonNull(aero, "aerodynamics must not be null");
        this.bodyRadius = this.config.getBodyRadius();
        this.surfaceGravity = this.config.getSurfaceGravity();
        this.landingTarget = this.config.getLandingTarget();
    }

    public void setTerminalAltitude(Double altitude) { this.terminalAltitude = altitude; }
    public Double getTerminalAltitude()              { return terminalAltitude; }

    public void setStopAtSurface(boolean stop) { this.stopAtSurface = stop; }
    public boolean isStopAtSurface()           { return stopAtSurface; }

    /** Integrate with the configured step size. */
    public Trajectory integrate(Vector3D initialPosition, Vector3D initialVelocity,
                                double duration, BankAngleProfile profile) {
        return integrate(initialPosition, initialVelocity, duration, config.getTimeStep(), profile);
    }

    public Trajectory integrate(EntryState entry, double duration, BankAngleProfile profile) {
        Objects.requireNonNull(entry, "entry state must not be null");
        return integrate(entry.position(bodyRadius), entry.velocity(), duration, config.getTimeStep(), profile);
    }

    /**
     * Integrate from t = 0. The result holds the initial sample followed by one
     * sample per step, {@code floor(duration / stepSize)} steps, unless a stop
     * altitude is reached first.
     */
    public Trajectory integrate(Vector3D initialPosition, Vector3D initialVelocity,
                                double duration, double stepSize, BankAngleProfile profile) {
        Objects.requireNonNull(initialPosition, "initial position must not be null");
        Objects.requireNonNull(initialVelocity, "initial velocity must not be null");
        Objects.requireNonNull(profile, "bank angle profile must not be null");
        requireStep(stepSize);
        if (!Double.isFinite(duration) || duration < 0.0) {
            throw new IllegalArgumentException("duration must be finite and non-negative, got " + duration);
        }

        final double bank0 = profile.bankAngleDegrees(0.0);
        final List<TrajectorySample> out = new ArrayList<>();
        out.add(TrajectorySample.derive(0.0, initialPosition, initialVelocity, bank0, bodyRadius, landingTarget));
        run(out, 0.0, initialPosition, initialVelocity, stepCount(duration, stepSize), stepSize, profile);

        final Trajectory traj = new Trajectory(out);
        LOG.info("Integrated {} samples over {} s (dt={} s, final alt={} m)",
                traj.size(), fmt(traj.duration()), stepSize, fmt(traj.last().getAltitude()));
        return traj;
    }

    /**
     * Re-integrate the future of {@code trajectory} from the sample at or before
     * {@code cutTime} with a new bank profile, up to the trajectory's end time.
     * Samples up to and including the cut sample are kept as they are.
     */
    public Trajectory continueFrom(Trajectory trajectory, double cutTime, BankAngleProfile profile) {
        Objects.requireNonNull(trajectory, "trajectory must not be null");
        Objects.requireNonNull(profile, "bank angle profile must not be null");
        if (trajectory.size() < 2) return trajectory;

        final int cutIndex = Math.max(0, trajectory.indexAtOrBefore(cutTime));
        if (cutIndex >= trajectory.size() - 1) {
            LOG.debug("continueFrom: cut at last sample (t={}), nothing to re-integrate", fmt(cutTime));
            return trajectory;
        }
        final TrajectorySample cut = trajectory.get(cutIndex);
        final double remaining = trajectory.endTime() - cut.getTime();
        final double dt = config.getTimeStep();

        final List<TrajectorySample> future = new ArrayList<>();
        run(future, cut.getTime(), cut.getPosition(), cut.getVelocity(), stepCount(remaining, dt), dt, profile);

        LOG.info("Re-integrated future from t={} s: {} samples replaced by {}",
                fmt(cut.getTime()), trajectory.size() - cutIndex - 1, future.size());
        return trajectory.splice(cutIndex, future);
    }

    /** Gravity plus aerodynamic acceleration at a state. */
    public Vector3D acceleration(Vector3D position, Vector3D velocity, double bankAngleDeg) {
        return gravity(position).add(aero.loads(position, velocity, bankAngleDeg).aerodynamicAcceleration());
    }

    /** −r̂ · g0 · (R/|r|)²; zero at the origin. */
    public Vector3D gravity(Vector3D position) {
        final double r = position.getNorm();
        if (!(r > 0.0)) return Vector3D.ZERO;
        final double ratio = bodyRadius / r;
        return position.scalarMultiply(-surfaceGravity * ratio * ratio / r);
    }

    private void run(List<TrajectorySample> out, double t0, Vector3D r0, Vector3D v0,
                     long steps, double dt, BankAngleProfile profile) {
        Vector3D r = r0;
        Vector3D v = v0;
        for (long k = 1; k <= steps; k++) {
            final double tPrev = t0 + (k - 1) * dt;
            final double bank = profile.bankAngleDegrees(tPrev);
            final Vector3D a = acceleration(r, v, bank);

            v = v.add(dt, a);
            r = r.add(dt, v);

            final TrajectorySample s = TrajectorySample.derive(t0 + k * dt, r, v, bank, bodyRadius, landingTarget);
            out.add(s);
            if (LOG.isTraceEnabled()) {
                LOG.trace("t={} alt={} v={} bank={}", fmt(s.getTime()), fmt(s.getAltitude()),
                        fmt(s.getVelocityMagnitude()), fmt(bank));
            }
            if (!Frames.isFinite(r) || !Frames.isFinite(v)) {
                LOG.warn("Non-finite state at t={} s; stopping integration", fmt(s.getTime()));
                break;
            }
            if (terminalAltitude != null && s.getAltitude() <= terminalAltitude) {
                LOG.debug("Terminal altitude {} m reached at t={} s", fmt(terminalAltitude), fmt(s.getTime()));
                break;
            }
            if (stopAtSurface && s.getAltitude() <= 0.0) {
                LOG.debug("Surface reached at t={} s", fmt(s.getTime()));
                break;
            }
        }
    }

    private static long stepCount(double duration, double dt) {
        // tolerate round-off so that e.g. 1.0 / 0.1 gives 10 steps
        return (long) Math.floor(duration / dt + 1e-9);
    }

    private static void requireStep(double stepSize) {
        if (!Double.isFinite(stepSize) || stepSize <= 0.0) {
            throw new IllegalArgumentException("step size must be positive and finite, got " + stepSize);
        }
    }

    private static String fmt(double x) { return String.format(java.util.Locale.ROOT, "%.3f", x); }
}
