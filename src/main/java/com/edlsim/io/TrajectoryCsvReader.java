package com.edlsim.io;

import com.edlsim.EntryConfig;
import com.edlsim.Trajectory;
import com.edlsim.TrajectorySample;
import com.edlsim.util.CsvTable;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Loads {@code time,x,y,z} trajectory tables.
 *
 * Columns (case/spacing/punct-insensitive; positional when there is no header):
 *  - time: time, t, times, seconds
 *  - x, y, z: x / posx / positionx, and so on
 *
 * Rows with missing or non-numeric cells, or outside the time window, are
 * skipped. Rows are sorted by time and repeated times dropped. Velocity comes
 * from a backward difference (forward for the first row).
 */
public final class TrajectoryCsvReader {

    private static final Logger LOG = LoggerFactory.getLogger(TrajectoryCsvReader.class);

    private final EntryConfig config;
    private double minTime = 0.0;
    private double maxTime = Double.POSITIVE_INFINITY;

    public TrajectoryCsvReader(EntryConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null").copy();
    }

    /** Only rows with {@code min <= time <= max} are kept. */
    public TrajectoryCsvReader timeWindow(double min, double max) {
        if (!(max >= min)) throw new IllegalArgumentException("Empty time window: [" + min + ", " + max + "]");
        this.minTime = min;
        this.maxTime = max;
        return this;
    }

    public Trajectory read(Path csvPath) throws IOException {
        final List<RawSample> raw = readRaw(csvPath);
        if (raw.isEmpty()) {
            throw new IllegalArgumentException("CSV has no valid trajectory rows: " + csvPath);
        }
        final Trajectory t = toTrajectory(raw);
        LOG.info("Loaded trajectory {}: {} samples, t=[{}, {}] s", csvPath, t.size(), t.startTime(), t.endTime());
        return t;
    }

    public List<RawSample> readRaw(Path csvPath) throws IOException {
        final CsvTable table = CsvTable.read(csvPath);
        final int iT = table.column(List.of("time", "t", "times", "seconds"), 0);
        final int iX = table.column(List.of("x", "posx", "positionx"), 1);
        final int iY = table.column(List.of("y", "posy", "positiony"), 2);
        final int iZ = table.column(List.of("z", "posz", "positionz"), 3);

        final List<RawSample> out = new ArrayList<>(table.rowCount());
        int skipped = 0;
        for (int r = 0; r < table.rowCount(); r++) {
            final RawSample s = new RawSample(table.number(r, iT), table.number(r, iX),
                    table.number(r, iY), table.number(r, iZ));
            if (!s.isFinite() || s.time < minTime || s.time > maxTime) {
                skipped++;
                continue;
            }
            out.add(s);
        }
        if (skipped > 0) LOG.warn("Skipped {} unusable rows in {}", skipped, csvPath);
        return out;
    }

    /**
     * Build a trajectory from raw rows.
     *
     * @throws IllegalArgumentException if {@code raw} has no finite rows
     */
    public Trajectory toTrajectory(List<RawSample> raw) {
        Objects.requireNonNull(raw, "raw samples must not be null");
        final List<RawSample> rows = new ArrayList<>();
        for (RawSample s : raw) if (s != null && s.isFinite()) rows.add(s);
        if (rows.isEmpty()) throw new IllegalArgumentException("No finite raw samples");
        rows.sort(Comparator.comparingDouble(s -> s.time));

        final List<RawSample> unique = new ArrayList<>(rows.size());
        for (RawSample s : rows) {
            if (!unique.isEmpty() && !(s.time > unique.get(unique.size() - 1).time)) continue;
            unique.add(s);
        }
        if (unique.size() < rows.size()) {
            LOG.warn("Dropped {} rows with repeated time stamps", rows.size() - unique.size());
        }

        final double radius = config.getBodyRadius();
        final Vector3D target = config.getLandingTarget();
        final List<TrajectorySample> samples = new ArrayList<>(unique.size());
        for (int i = 0; i < unique.size(); i++) {
            final Vector3D p = position(unique.get(i));
            final Vector3D v;
            if (unique.size() == 1) {
                v = Vector3D.ZERO;
            } else if (i == 0) {
                v = difference(unique.get(0), unique.get(1));
            } else {
                v = difference(unique.get(i - 1), unique.get(i));
            }
            samples.add(TrajectorySample.derive(unique.get(i).time, p, v, 0.0, radius, target));
        }
        return new Trajectory(samples);
    }

    private static Vector3D position(RawSample s) { return new Vector3D(s.x, s.y, s.z); }

    private static Vector3D difference(RawSample a, RawSample b) {
        return position(b).subtract(position(a)).scalarMultiply(1.0 / (b.time - a.time));
    }
}
