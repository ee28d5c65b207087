package com.edlsim;

import com.edlsim.util.Frames;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bends the untraveled part of a trajectory in response to a steering input.
 *
 * <p>Algorithm, for a cut at sample c of N:</p>
 * <ol>
 *   <li>basis at c: up = r̂, horizontal = normalize(v̂ × up)</li>
 *   <li>offset direction d = normalize(horizontal · lateral + up · radial)</li>
 *   <li>for i &gt; c: r_i += d · |r_i − r_c| · finalPercent · (i − c)/(N − 1 − c)</li>
 *   <li>ascending over i &gt; c, once all positions moved: altitude, velocity by
 *       backward difference, speed and target distance recomputed</li>
 * </ol>
 * The input trajectory is never modified; samples 0..c of the result are the
 * same instances.
 */
public final class PerturbationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PerturbationEngine.class);

    private final double bodyRadius;
    private final Vector3D landingTarget;

    public PerturbationEngine(EntryConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.bodyRadius = config.getBodyRadius();
        this.landingTarget = config.getLandingTarget();
    }

    /**
     * @param lateral      signed weight of the horizontal (cross-track) axis
     * @param radial       signed weight of the local vertical
     * @param finalPercent displacement at the last sample, as a fraction of its
     *                     distance from the cut sample
     * @return the deflected trajectory, or {@code trajectory} itself when there is
     *         no future or the offset direction is degenerate
     */
    public Trajectory applyDeflection(Trajectory trajectory, double cutTime,
                                      double lateral, double radial, double finalPercent) {
        Objects.requireNonNull(trajectory, "trajectory must not be null");
        final int n = trajectory.size();
        if (n < 2) return trajectory;

        final int cutIndex = Math.max(0, trajectory.indexAtOrBefore(cutTime));
        if (cutIndex >= n - 1) {
            LOG.debug("Deflection at t={} ignored: no future samples", cutTime);
            return trajectory;
        }

        final TrajectorySample cut = trajectory.get(cutIndex);
        final Vector3D offsetDir = offsetDirection(cut, lateral, radial);
        if (offsetDir == null) {
            LOG.debug("Deflection ({}, {}) has no direction; trajectory unchanged", lateral, radial);
            return trajectory;
        }

        // displace every future position first
        final Vector3D cutPos = cut.getPosition();
        final int futureLen = n - 1 - cutIndex;
        final Vector3D[] moved = new Vector3D[futureLen];
        for (int k = 0; k < futureLen; k++) {
            final int i = cutIndex + 1 + k;
            final Vector3D p = trajectory.get(i).getPosition();
            final double percent = finalPercent * (double) (i - cutIndex) / (double) (n - 1 - cutIndex);
            moved[k] = p.add(p.distance(cutPos) * percent, offsetDir);
        }

        // then recompute in ascending order; each velocity differences against its recomputed predecessor
        final List<TrajectorySample> future = new ArrayList<>(futureLen);
        TrajectorySample prev = null;
        for (int k = 0; k < futureLen; k++) {
            final TrajectorySample old = trajectory.get(cutIndex + 1 + k);
            final Vector3D velocity;
            if (prev == null) {
                velocity = old.getVelocity();
            } else {
                final double dt = old.getTime() - prev.getTime();
                velocity = dt > 0.0 ? moved[k].subtract(prev.getPosition()).scalarMultiply(1.0 / dt) : prev.getVelocity();
            }
            final TrajectorySample s = old.withPositionAndVelocity(moved[k], velocity, bodyRadius, landingTarget);
            future.add(s);
            prev = s;
        }

        LOG.info("Applied deflection lateral={} radial={} at t={} s: {} samples rewritten (final {}%)",
                lateral, radial, cut.getTime(), futureLen, finalPercent * 100.0);
        return trajectory.splice(cutIndex, future);
    }

    /** Unit offset direction at {@code cut}, or null when it degenerates. */
    Vector3D offsetDirection(TrajectorySample cut, double lateral, double radial) {
        final Vector3D up = Frames.unit(cut.getPosition());
        final Vector3D horizontal = Frames.horizontalAxis(cut.getPosition(), cut.getVelocity());
        final Vector3D raw = horizontal.scalarMultiply(lateral).add(up.scalarMultiply(radial));
        if (Frames.isNearZero(raw, 1e-4) || !Frames.isFinite(raw)) return null;
        return raw.normalize();
    }
}
