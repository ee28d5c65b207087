package com.edlsim.io;

import com.edlsim.Trajectory;
import com.edlsim.TrajectorySample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes a trajectory as {@value #HEADER}.
 */
public final class TrajectoryCsvWriter {

    private static final Logger LOG = LoggerFactory.getLogger(TrajectoryCsvWriter.class);

    public static final String HEADER = "time,x,y,z,vx,vy,vz,altitude,bankAngle";

    private TrajectoryCsvWriter() {} // utility class

    public static void write(Trajectory trajectory, Path out) throws IOException {
        Objects.requireNonNull(trajectory, "trajectory must not be null");
        Objects.requireNonNull(out, "output path must not be null");
        final Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (BufferedWriter w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            write(trajectory, w);
        }
        LOG.info("Exported {} samples to {}", trajectory.size(), out);
    }

    public static void write(Trajectory trajectory, Writer w) throws IOException {
        w.write(HEADER);
        w.write("\n");
        for (TrajectorySample s : trajectory.samples()) {
            w.write(line(s));
            w.write("\n");
        }
        w.flush();
    }

    static String line(TrajectorySample s) {
        return String.format(Locale.ROOT, "%.3f,%.3f,%.3f,%.3f,%.6f,%.6f,%.6f,%.3f,%.4f",
                s.getTime(),
                s.getPosition().getX(), s.getPosition().getY(), s.getPosition().getZ(),
                s.getVelocity().getX(), s.getVelocity().getY(), s.getVelocity().getZ(),
                s.getAltitude(), s.getBankAngle());
    }
}
