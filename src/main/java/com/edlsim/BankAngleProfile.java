package com.edlsim;

import com.edlsim.util.CsvTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Commanded bank angle (degrees) as a function of time since entry interface.
 */
@FunctionalInterface
public interface BankAngleProfile {

    double bankAngleDegrees(double time);

    static BankAngleProfile constant(double degrees) {
        return t -> degrees;
    }

    static BankAngleProfile of(DoubleUnaryOperator fn) {
        Objects.requireNonNull(fn, "bank angle function must not be null");
        return fn::applyAsDouble;
    }

    /**
     * Piecewise-linear profile through the keyframes (sorted here by time),
     * held at the first value before the first keyframe and at the last value
     * after the final one. An empty list means wings-level.
     */
    static BankAngleProfile keyframes(List<Keyframe> keyframes) {
        return new KeyframeProfile(keyframes);
    }

    /**
     * Keyframes from a CSV with time and bank-angle columns
     * ({@code time,bankAngle}; a header is optional).
     */
    static BankAngleProfile fromCsv(Path csvPath) throws IOException {
        final CsvTable table = CsvTable.read(csvPath);
        final int iT = table.column(List.of("time", "t", "times"), 0);
        final int iB = table.column(List.of("bankangle", "bank", "bankangledeg", "sigma"), 1);
        final List<Keyframe> frames = new ArrayList<>();
        for (int r = 0; r < table.rowCount(); r++) {
            final double t = table.number(r, iT);
            final double b = table.number(r, iB);
            if (Double.isFinite(t) && Double.isFinite(b)) frames.add(new Keyframe(t, b));
        }
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("CSV has no valid bank-angle keyframes: " + csvPath);
        }
        KeyframeProfile.LOG.info("Loaded {} bank-angle keyframes from {}", frames.size(), csvPath);
        return keyframes(frames);
    }

    /** {time, bankAngleDegrees} */
    final class Keyframe {
        private final double time;
        private final double bankAngle;

        public Keyframe(double time, double bankAngle) {
            if (!Double.isFinite(time) || !Double.isFinite(bankAngle)) {
                throw new IllegalArgumentException("Keyframe values must be finite: t=" + time + " bank=" + bankAngle);
            }
            this.time = time;
            this.bankAngle = bankAngle;
        }

        public double getTime()      { return time; }
        public double getBankAngle() { return bankAngle; }

        @Override
        public String toString() { return "Keyframe{t=" + time + ", bank=" + bankAngle + "}"; }
    }

    final class KeyframeProfile implements BankAngleProfile {

        private static final Logger LOG = LoggerFactory.getLogger(BankAngleProfile.class);

        private final double[] times;
        private final double[] values;

        private KeyframeProfile(List<Keyframe> keyframes) {
            Objects.requireNonNull(keyframes, "keyframes must not be null");
            final List<Keyframe> sorted = new ArrayList<>(keyframes);
            sorted.sort(Comparator.comparingDouble(Keyframe::getTime));
            this.times = new double[sorted.size()];
            this.values = new double[sorted.size()];
            for (int i = 0; i < sorted.size(); i++) {
                times[i] = sorted.get(i).getTime();
                values[i] = sorted.get(i).getBankAngle();
            }
        }

        @Override
        public double bankAngleDegrees(double time) {
            final int n = times.length;
            if (n == 0) return 0.0;
            if (time <= times[0]) return values[0];
            if (time >= times[n - 1]) return values[n - 1];
            for (int i = 0; i < n - 1; i++) {
                if (time >= times[i] && time <= times[i + 1]) {
                    final double span = times[i + 1] - times[i];
                    if (span <= 0.0) return values[i + 1];
                    final double f = (time - times[i]) / span;
                    return values[i] + (values[i + 1] - values[i]) * f;
                }
            }
            return values[n - 1];
        }

        public int size() { return times.length; }
    }
}
