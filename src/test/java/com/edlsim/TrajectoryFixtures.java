package com.edlsim;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.util.ArrayList;
import java.util.List;

/** Hand-built trajectories shared by the tests. */
public final class TrajectoryFixtures {

    private TrajectoryFixtures() {}

    /**
     * Samples on the +x axis at the given altitudes, zero velocity, so the
     * altitude cache is exact.
     */
    public static Trajectory radial(EntryConfig cfg, double[] times, double[] altitudes) {
        final List<TrajectorySample> out = new ArrayList<>();
        for (int i = 0; i < times.length; i++) {
            final Vector3D p = new Vector3D(cfg.getBodyRadius() + altitudes[i], 0.0, 0.0);
            out.add(TrajectorySample.derive(times[i], p, Vector3D.ZERO, 0.0, cfg.getBodyRadius(), cfg.getLandingTarget()));
        }
        return new Trajectory(out);
    }

    /** The three-sample descent used in the phase classification scenario. */
    public static Trajectory threeSampleDescent(EntryConfig cfg) {
        return radial(cfg, new double[]{0.0, 130.0, 260.65}, new double[]{132_000.0, 66_000.0, 13_462.9});
    }
}
