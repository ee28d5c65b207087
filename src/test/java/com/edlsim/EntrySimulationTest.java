package com.edlsim;

import com.edlsim.phase.MissionProfiles;
import com.edlsim.phase.MissionStatus;
import com.edlsim.phase.PhaseUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EntrySimulation session")
class EntrySimulationTest {

    private EntryConfig cfg;
    private EntrySimulation sim;

    @BeforeEach
    void setUp() {
        cfg = EntryConfig.marsDefaults();
        sim = EntrySimulation.demo(cfg);
    }

    @Test
    @DisplayName("Starts at the first sample in the first phase")
    void initialState() {
        assertAll(
            () -> assertEquals(0.0, sim.currentTime()),
            () -> assertEquals(0.0, sim.progress()),
            () -> assertFalse(sim.isFinished()),
            () -> assertEquals(MissionProfiles.ENTRY_INTERFACE, sim.currentPhase().getName()),
            () -> assertEquals(MissionStatus.ACTIVE, sim.missionStatus()),
            () -> assertSame(sim.originalTrajectory(), sim.trajectory())
        );
    }

    @Test
    @DisplayName("Advancing moves the clock, fires entry events and clamps at the end")
    void advance() {
        final PhaseUpdate u = sim.advance(10.0);
        assertEquals(10.0, sim.currentTime());
        assertTrue(u.getNewlyFiredEvents().contains("atmospheric interface"));
        assertEquals(MissionStatus.ACTIVE, u.getMissionStatus());

        sim.advance(1_000.0);
        assertTrue(sim.isFinished());
        assertEquals(1.0, sim.progress());
        assertEquals(MissionProfiles.PARACHUTE_DEPLOY, sim.currentPhase().getName());

        assertThrows(IllegalArgumentException.class, () -> sim.advance(-1.0));
        assertThrows(IllegalArgumentException.class, () -> sim.advance(Double.NaN));
    }

    @Test
    @DisplayName("Seek re-derives the phase and clamps the time")
    void seek() {
        assertEquals(MissionProfiles.HEADING_ALIGNMENT, sim.seek(100.0).getName());
        assertEquals(100.0, sim.currentTime());
        assertEquals(MissionProfiles.ENTRY_INTERFACE, sim.seek(-5.0).getName());
        assertEquals(0.0, sim.currentTime());
        sim.seek(sim.trajectory().endTime() / 2.0);
        assertEquals(0.5, sim.progress(), 1e-12);
    }

    @Test
    @DisplayName("Steering rewrites only the future")
    void steeringKeepsPast() {
        sim.seek(100.0);
        final List<TrajectorySample> pastBefore = sim.pastSamples();
        final TrajectorySample lastBefore = sim.trajectory().last();

        final Trajectory bent = sim.applySteering(1.0, 0.0);
        final List<TrajectorySample> pastAfter = sim.pastSamples();

        assertEquals(pastBefore.size(), pastAfter.size());
        for (int i = 0; i < pastBefore.size(); i++) {
            assertSame(pastBefore.get(i), pastAfter.get(i));
        }
        assertSame(bent, sim.trajectory());
        assertNotEquals(lastBefore.getPosition(), bent.last().getPosition());
        assertEquals(bent.size() - pastAfter.size(), sim.futureSamples().size());
    }

    @Test
    @DisplayName("Re-planning integrates a new future under the given bank profile")
    void replan() {
        sim.seek(100.0);
        final int cut = sim.trajectory().indexAtOrBefore(100.0);
        final Trajectory replanned = sim.replan(BankAngleProfile.constant(45.0));
        assertSame(sim.originalTrajectory().get(cut), replanned.get(cut));
        assertTrue(replanned.size() > cut + 1);
        assertEquals(45.0, replanned.get(cut + 1).getBankAngle());
    }

    @Test
    @DisplayName("A re-planned future that ends before the clock never moves playback backwards")
    void replanShorterThanClock() {
        final Trajectory lowHover = TrajectoryFixtures.radial(cfg, new double[]{0.0, 3.0}, new double[]{1.0, 1.0});
        final EntrySimulation s = new EntrySimulation(lowHover, cfg, MissionProfiles.mars2020(cfg));
        s.seek(2.0);

        final Trajectory replanned = s.replan(BankAngleProfile.constant(0.0));
        assertTrue(replanned.endTime() < 2.0, "falls to the surface well before t=2 s");
        final double afterReplan = s.currentTime();
        assertEquals(replanned.endTime(), afterReplan, 1e-12);

        s.advance(0.1);
        assertAll(
            () -> assertTrue(s.currentTime() >= afterReplan, "clock went backwards"),
            () -> assertTrue(s.currentTime() <= s.trajectory().endTime()),
            () -> assertTrue(s.isFinished()),
            () -> assertEquals(1.0, s.progress()),
            () -> assertEquals(s.trajectory().size(), s.pastSamples().size())
        );
    }

    @Test
    @DisplayName("Reset restores the original trajectory and clears the mission state")
    void reset() {
        cfg.setHeatShieldLimit(0.0);
        final EntrySimulation failing = EntrySimulation.demo(cfg);
        failing.advance(1.0);
        failing.applySteering(0.0, 1.0);
        assertEquals(MissionStatus.FAILURE, failing.missionStatus());

        failing.reset();
        assertAll(
            () -> assertEquals(0.0, failing.currentTime()),
            () -> assertSame(failing.originalTrajectory(), failing.trajectory()),
            () -> assertEquals(MissionStatus.ACTIVE, failing.missionStatus()),
            () -> assertNull(failing.failureReason())
        );
    }

    @Test
    @DisplayName("Exceeding the heat shield limit fails the mission in the entry phase")
    void heatShieldFailure() {
        cfg.setHeatShieldLimit(0.0);
        final EntrySimulation failing = EntrySimulation.demo(cfg);
        final PhaseUpdate u = failing.advance(1.0);
        assertAll(
            () -> assertEquals(MissionStatus.FAILURE, u.getMissionStatus()),
            () -> assertTrue(u.isStatusChanged()),
            () -> assertEquals("Entry Interface: heat shield failure", failing.failureReason())
        );
        assertEquals(MissionStatus.FAILURE, failing.advance(50.0).getMissionStatus());
    }

    @Test
    @DisplayName("Session config is a snapshot")
    void configSnapshot() {
        cfg.setHeatShieldLimit(0.0);
        assertEquals(250.0, sim.config().getHeatShieldLimit());
        assertEquals(MissionStatus.ACTIVE, sim.advance(1.0).getMissionStatus());
    }

    @Test
    @DisplayName("Physical session built from entry conditions")
    void fromEntryState() {
        final EntrySimulation physical = EntrySimulation.fromEntryState(cfg, EntryState.mars2020(), 30.0,
                BankAngleProfile.constant(0.0));
        assertEquals(301, physical.trajectory().size());
        assertEquals(124_999.0, physical.currentSample().getAltitude(), 1e-6);
        assertEquals(6083.6, physical.velocityVector().getNorm(), 1e-6);
        assertEquals(physical.currentSample().getAltitude(), physical.currentVehicleState().getAltitude());
    }

    @Test
    @DisplayName("Concurrent steering and playback never expose a changed past")
    void concurrentAccess() throws Exception {
        sim.seek(50.0);
        final List<TrajectorySample> past = sim.pastSamples();
        final ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            final Future<?> steer = pool.submit(() -> {
                for (int i = 0; i < 20; i++) sim.applySteering(i % 2 == 0 ? 1.0 : -1.0, 0.2);
            });
            final Future<?> read = pool.submit(() -> {
                for (int i = 0; i < 200; i++) {
                    final TrajectorySample s = sim.sampleAt(25.0);
                    assertTrue(Double.isFinite(s.getAltitude()));
                }
            });
            steer.get(30, TimeUnit.SECONDS);
            read.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        final List<TrajectorySample> after = sim.pastSamples();
        for (int i = 0; i < past.size(); i++) {
            assertSame(past.get(i), after.get(i));
        }
    }
}
