package com.edlsim;

import com.edlsim.util.Frames;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.util.List;
import java.util.Objects;

/**
 * Read-side view over a {@link Trajectory}: clamped, eased interpolation at
 * arbitrary times.
 *
 * Position and velocity use a cubic ease-in-out of the bracket fraction; the
 * scalar caches (altitude, speed, distance, bank) interpolate linearly.
 */
public final class KinematicSampleStore {

    private final Trajectory trajectory;
    private final double lookahead;
    private final Vector3D fallbackDirection;
    private final boolean explicitVelocity;

    public KinematicSampleStore(Trajectory trajectory, EntryConfig config) {
        this(trajectory, config.getVelocityLookahead(), config.getFallbackDirection());
    }

    public KinematicSampleStore(Trajectory trajectory, double lookahead, Vector3D fallbackDirection) {
        this.trajectory = Objects.requireNonNull(trajectory, "trajectory must not be null");
        this.lookahead = lookahead;
        this.fallbackDirection = Objects.requireNonNull(fallbackDirection, "fallbackDirection must not be null");
        this.explicitVelocity = trajectory.hasExplicitVelocity();
    }

    public Trajectory trajectory()           { return trajectory; }
    public int size()                        { return trajectory.size(); }
    public TrajectorySample sampleAt(int i)  { return trajectory.get(i); }
    public List<TrajectorySample> samples()  { return trajectory.samples(); }
    public double startTime()                { return trajectory.startTime(); }
    public double endTime()                  { return trajectory.endTime(); }

    /**
     * Interpolated state at {@code time}, clamped to the sampled range.
     *
     * @throws IllegalStateException if the trajectory has no samples
     */
    public TrajectorySample query(double time) {
        final int n = trajectory.size();
        if (n == 0) throw new IllegalStateException("Cannot query an empty trajectory");
        if (n == 1) return trajectory.get(0);

        final double t0 = trajectory.startTime();
        final double t1 = trajectory.endTime();
        final double t = Double.isNaN(time) ? t0 : clamp(time, t0, t1);

        int i = trajectory.indexAtOrBefore(t);
        if (i < 0) i = 0;
        final TrajectorySample a = trajectory.get(i);
        if (a.getTime() == t || i == n - 1) return a;
        final TrajectorySample b = trajectory.get(i + 1);

        final double span = b.getTime() - a.getTime();
        final double f = (span > 0.0) ? (t - a.getTime()) / span : 0.0;
        final double s = easeInOutCubic(f);

        return new TrajectorySample(t,
                new Vector3D(1.0 - s, a.getPosition(), s, b.getPosition()),
                new Vector3D(1.0 - s, a.getVelocity(), s, b.getVelocity()),
                lerp(a.getAltitude(), b.getAltitude(), f),
                lerp(a.getVelocityMagnitude(), b.getVelocityMagnitude(), f),
                lerp(a.getDistanceToTarget(), b.getDistanceToTarget(), f),
                lerp(a.getBankAngle(), b.getBankAngle(), f));
    }

    /**
     * Velocity direction and magnitude at {@code time}. Uses the interpolated
     * velocity when the samples carry one, otherwise a forward difference over
     * the configured lookahead (backward within one lookahead of the end).
     * Near-zero results return the fallback direction.
     */
    public Vector3D velocityVectorAt(double time) {
        final Vector3D v;
        if (explicitVelocity) {
            v = query(time).getVelocity();
        } else {
            final TrajectorySample here = query(time);
            final double t = here.getTime();
            final double from = t + lookahead > trajectory.endTime() ? t - lookahead : t;
            final Vector3D p0 = query(from).getPosition();
            final Vector3D p1 = query(from + lookahead).getPosition();
            v = p1.subtract(p0).scalarMultiply(1.0 / lookahead);
        }
        if (Frames.isNearZero(v, Frames.DEGENERATE_EPS) || !Frames.isFinite(v)) {
            return fallbackDirection;
        }
        return v;
    }

    /** Fraction of the sampled time span covered at {@code time}, in [0, 1]. */
    public double progress(double time) {
        if (trajectory.size() < 2) return trajectory.isEmpty() ? 0.0 : 1.0;
        final double span = trajectory.duration();
        return clamp((time - trajectory.startTime()) / span, 0.0, 1.0);
    }

    /** s = 4t³ below one half, 1 − (−2t + 2)³ / 2 above. */
    static double easeInOutCubic(double t) {
        if (t < 0.5) return 4.0 * t * t * t;
        final double u = -2.0 * t + 2.0;
        return 1.0 - (u * u * u) / 2.0;
    }

    private static double clamp(double v, double lo, double hi) { return (v < lo) ? lo : (v > hi ? hi : v); }
    private static double lerp(double a, double b, double t)    { return a + (b - a) * t; }
}
