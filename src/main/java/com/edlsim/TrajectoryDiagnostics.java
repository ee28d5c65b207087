package com.edlsim;

import com.edlsim.phase.MissionProfile;
import com.edlsim.phase.PhaseDefinition;
import com.edlsim.phase.PhaseStateMachine;
import com.edlsim.util.Frames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Sanity checks and summary statistics for a loaded or generated trajectory.
 */
public final class TrajectoryDiagnostics {

    private static final Logger LOG = LoggerFactory.getLogger(TrajectoryDiagnostics.class);

    public static final double MIN_PLAUSIBLE_ALTITUDE = -10_000.0;  // m
    public static final double MAX_PLAUSIBLE_SPEED = 10_000.0;      // m/s

    private TrajectoryDiagnostics() {} // utility class

    public static ValidationReport validate(Trajectory trajectory) {
        Objects.requireNonNull(trajectory, "trajectory must not be null");
        final List<String> errors = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();
        if (trajectory.isEmpty()) {
            errors.add("trajectory has no samples");
        }
        for (int i = 0; i < trajectory.size(); i++) {
            final TrajectorySample s = trajectory.get(i);
            if (!Frames.isFinite(s.getPosition()) || !Frames.isFinite(s.getVelocity()) || !Double.isFinite(s.getTime())) {
                errors.add("sample " + i + " has non-finite values");
                continue;
            }
            if (s.getAltitude() < MIN_PLAUSIBLE_ALTITUDE) {
                warnings.add("sample " + i + " (t=" + s.getTime() + ") below surface: altitude " + s.getAltitude() + " m");
            }
            if (s.getVelocityMagnitude() > MAX_PLAUSIBLE_SPEED) {
                warnings.add("sample " + i + " (t=" + s.getTime() + ") implausible speed " + s.getVelocityMagnitude() + " m/s");
            }
        }
        final ValidationReport report = new ValidationReport(errors, warnings);
        if (!report.isValid()) {
            LOG.warn("Trajectory validation failed: {}", errors);
        } else if (!warnings.isEmpty()) {
            LOG.debug("Trajectory validation: {} warnings", warnings.size());
        }
        return report;
    }

    /**
     * Duration, altitude range, peak speed, path length and the span of each
     * phase as classified by {@code mission}.
     */
    public static MissionStatistics statistics(Trajectory trajectory, MissionProfile mission) {
        Objects.requireNonNull(trajectory, "trajectory must not be null");
        Objects.requireNonNull(mission, "mission must not be null");
        if (trajectory.isEmpty()) throw new IllegalArgumentException("Cannot summarise an empty trajectory");

        final PhaseStateMachine classifier = new PhaseStateMachine(mission);
        double minAlt = Double.POSITIVE_INFINITY, maxAlt = Double.NEGATIVE_INFINITY;
        double maxSpeed = 0.0, path = 0.0;
        final List<MissionStatistics.PhaseSpan> spans = new ArrayList<>();
        int currentPhase = -1;
        TrajectorySample spanStart = null, prev = null;

        for (TrajectorySample s : trajectory.samples()) {
            minAlt = Math.min(minAlt, s.getAltitude());
            maxAlt = Math.max(maxAlt, s.getAltitude());
            maxSpeed = Math.max(maxSpeed, s.getVelocityMagnitude());
            if (prev != null) path += s.getPosition().distance(prev.getPosition());

            // phases only advance, as in playback
            final int phase = Math.max(currentPhase,
                    classifier.classify(VehicleState.of(s.getTime(), s.getAltitude(), s.getVelocityMagnitude())));
            if (phase != currentPhase) {
                if (currentPhase >= 0) {
                    spans.add(span(mission.phase(currentPhase), spanStart, s));
                }
                currentPhase = phase;
                spanStart = s;
            }
            prev = s;
        }
        spans.add(span(mission.phase(currentPhase), spanStart, trajectory.last()));

        return new MissionStatistics(trajectory.duration(),
                trajectory.first().getAltitude(), trajectory.last().getAltitude(),
                minAlt, maxAlt, maxSpeed, path, spans);
    }

    private static MissionStatistics.PhaseSpan span(PhaseDefinition phase, TrajectorySample start, TrajectorySample end) {
        return new MissionStatistics.PhaseSpan(phase.getName(),
                start.getTime(), end.getTime(), start.getAltitude(), end.getAltitude());
    }

    /** Errors make a trajectory unusable; warnings flag implausible values. */
    public static final class ValidationReport {
        private final List<String> errors;
        private final List<String> warnings;

        ValidationReport(List<String> errors, List<String> warnings) {
            this.errors = List.copyOf(errors);
            this.warnings = List.copyOf(warnings);
        }

        public boolean isValid()        { return errors.isEmpty(); }
        public List<String> getErrors() { return errors; }
        public List<String> getWarnings() { return warnings; }

        @Override
        public String toString() {
            return "ValidationReport{valid=" + isValid() + ", errors=" + errors.size() + ", warnings=" + warnings.size() + "}";
        }
    }

    public static final class MissionStatistics {
        private final double duration;
        private final double startAltitude, endAltitude, minAltitude, maxAltitude;
        private final double maxSpeed;
        private final double pathLength;
        private final List<PhaseSpan> phases;

        MissionStatistics(double duration, double startAltitude, double endAltitude,
                          double minAltitude, double maxAltitude, double maxSpeed,
                          double pathLength, List<PhaseSpan> phases) {
            this.duration = duration;
            this.startAltitude = startAltitude;
            this.endAltitude = endAltitude;
            this.minAltitude = minAltitude;
            this.maxAltitude = maxAltitude;
            this.maxSpeed = maxSpeed;
            this.pathLength = pathLength;
            this.phases = List.copyOf(phases);
        }

        public double getDuration()      { return duration; }
        public double getStartAltitude() { return startAltitude; }
        public double getEndAltitude()   { return endAltitude; }
        public double getMinAltitude()   { return minAltitude; }
        public double getMaxAltitude()   { return maxAltitude; }
        public double getMaxSpeed()      { return maxSpeed; }
        public double getPathLength()    { return pathLength; }
        public List<PhaseSpan> getPhases() { return phases; }

        @Override
        public String toString() {
            return "MissionStatistics{duration=" + duration + ", alt=[" + minAltitude + ", " + maxAltitude
                    + "], maxSpeed=" + maxSpeed + ", path=" + pathLength + ", phases=" + phases + "}";
        }

        /** Contiguous stretch of samples classified into one phase. */
        public static final class PhaseSpan {
            private final String name;
            private final double startTime, endTime, startAltitude, endAltitude;

            PhaseSpan(String name, double startTime, double endTime, double startAltitude, double endAltitude) {
                this.name = name;
                this.startTime = startTime;
                this.endTime = endTime;
                this.startAltitude = startAltitude;
                this.endAltitude = endAltitude;
            }

            public String getName()          { return name; }
            public double getStartTime()     { return startTime; }
            public double getEndTime()       { return endTime; }
            public double getStartAltitude() { return startAltitude; }
            public double getEndAltitude()   { return endAltitude; }

            @Override
            public String toString() { return name + "[" + startTime + ", " + endTime + "]"; }
        }
    }
}
