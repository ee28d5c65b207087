package com.edlsim;

import com.edlsim.io.DemoTrajectories;
import com.edlsim.phase.MissionProfiles;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TrajectoryDiagnostics")
class TrajectoryDiagnosticsTest {

    private final EntryConfig cfg = EntryConfig.marsDefaults();

    @Test
    @DisplayName("Demo trajectory validates cleanly")
    void demoIsValid() {
        final TrajectoryDiagnostics.ValidationReport r = TrajectoryDiagnostics.validate(DemoTrajectories.mars2020(cfg));
        assertTrue(r.isValid(), r.toString());
        assertTrue(r.getWarnings().isEmpty(), r.toString());
    }

    @Test
    @DisplayName("Empty and non-finite trajectories are errors, implausible values warnings")
    void errorsAndWarnings() {
        assertFalse(TrajectoryDiagnostics.validate(Trajectory.empty()).isValid());

        final double r = cfg.getBodyRadius();
        final Vector3D target = cfg.getLandingTarget();
        final Trajectory bad = new Trajectory(List.of(
                TrajectorySample.derive(0, new Vector3D(r + 100, 0, 0), new Vector3D(0, 20_000, 0), 0, r, target),
                TrajectorySample.derive(1, new Vector3D(r - 50_000, 0, 0), Vector3D.ZERO, 0, r, target),
                TrajectorySample.derive(2, new Vector3D(Double.NaN, 0, 0), Vector3D.ZERO, 0, r, target)));
        final TrajectoryDiagnostics.ValidationReport report = TrajectoryDiagnostics.validate(bad);
        assertAll(
            () -> assertFalse(report.isValid()),
            () -> assertEquals(1, report.getErrors().size()),
            () -> assertEquals(2, report.getWarnings().size())
        );
    }

    @Test
    @DisplayName("Statistics summarise extent and phase spans")
    void statistics() {
        final Trajectory t = TrajectoryFixtures.radial(cfg,
                new double[]{0.0, 130.0, 200.0, 260.65},
                new double[]{132_000.0, 66_000.0, 37_852.0, 13_462.9});
        final TrajectoryDiagnostics.MissionStatistics s = TrajectoryDiagnostics.statistics(t, MissionProfiles.coarse());
        assertAll(
            () -> assertEquals(260.65, s.getDuration(), 1e-12),
            () -> assertEquals(132_000.0, s.getMaxAltitude(), 1e-6),
            () -> assertEquals(13_462.9, s.getMinAltitude(), 1e-6),
            () -> assertEquals(132_000.0 - 13_462.9, s.getPathLength(), 1e-6),
            () -> assertEquals(0.0, s.getMaxSpeed()),
            () -> assertEquals(3, s.getPhases().size()),
            () -> assertEquals("EntryInterface", s.getPhases().get(0).getName()),
            () -> assertEquals(200.0, s.getPhases().get(0).getEndTime()),
            () -> assertEquals("PeakHeating", s.getPhases().get(1).getName()),
            () -> assertEquals(260.65, s.getPhases().get(2).getStartTime())
        );
        assertThrows(IllegalArgumentException.class,
                () -> TrajectoryDiagnostics.statistics(Trajectory.empty(), MissionProfiles.coarse()));
    }
}
