package com.edlsim.io;

import com.edlsim.EntryConfig;
import com.edlsim.Trajectory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Synthetic trajectories for demos and tests when no data file is available.
 */
public final class DemoTrajectories {

    /** Entry interface to parachute deploy of the reference Mars 2020 profile, s. */
    public static final double MARS2020_DURATION = 260.65;
    public static final double MARS2020_ENTRY_ALTITUDE = 132_000.0;

    private DemoTrajectories() {} // utility class

    /**
     * Mars 2020-shaped descent sampled every 0.5 s:
     * <pre>
     *   p   = t / 260.65
     *   alt = 132 km · exp(−3.5 · p^1.8)
     *   lon = 0.035 · p,  lat = −0.27 + 0.1 · p   (rad)
     * </pre>
     */
    public static Trajectory mars2020(EntryConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        final List<RawSample> raw = new ArrayList<>();
        final int n = (int) Math.floor(MARS2020_DURATION / 0.5);
        for (int i = 0; i <= n; i++) {
            raw.add(mars2020Row(i * 0.5, config.getBodyRadius()));
        }
        // the end time is off the 0.5 s grid
        raw.add(mars2020Row(MARS2020_DURATION, config.getBodyRadius()));
        return new TrajectoryCsvReader(config).toTrajectory(raw);
    }

    private static RawSample mars2020Row(double t, double bodyRadius) {
        final double p = t / MARS2020_DURATION;
        final double alt = MARS2020_ENTRY_ALTITUDE * Math.exp(-3.5 * Math.pow(p, 1.8));
        final double r = bodyRadius + alt;
        final double lon = p * 0.035;
        final double lat = -0.27 + p * 0.1;
        return new RawSample(t,
                r * Math.cos(lat) * Math.cos(lon),
                r * Math.cos(lat) * Math.sin(lon),
                r * Math.sin(lat));
    }
}
