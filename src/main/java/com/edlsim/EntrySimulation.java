package com.edlsim;

import com.edlsim.io.DemoTrajectories;
import com.edlsim.phase.MissionProfile;
import com.edlsim.phase.MissionProfiles;
import com.edlsim.phase.MissionStatus;
import com.edlsim.phase.PhaseDefinition;
import com.edlsim.phase.PhaseStateMachine;
import com.edlsim.phase.PhaseUpdate;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One entry session: owns the trajectory, the playback clock and the phase
 * state machine.
 * <p>
 *   Steering and re-planning build a new {@link Trajectory} and swap it in
 *   under the session lock; queries take the same lock, so no caller ever sees
 *   a partly recomputed future. Samples at or before the playback time are
 *   never changed.
 * </p>
 */
public final class EntrySimulation {

    private static final Logger log = LoggerFactory.getLogger(EntrySimulation.class);

    // Collaborators
    private final EntryConfig config;
    private final EntryAerodynamics aero;
    private final ForwardIntegrator integrator;
    private final PerturbationEngine perturbation;
    private final PhaseStateMachine phases;

    // State
    private final ReentrantLock lock = new ReentrantLock();
    private final Trajectory original;
    private Trajectory trajectory;
    private KinematicSampleStore store;
    private double time;

    public EntrySimulation(Trajectory trajectory, EntryConfig config, MissionProfile mission) {
        Objects.requireNonNull(trajectory, "trajectory must not be null");
        Objects.requireNonNull(mission, "mission must not be null");
        if (trajectory.isEmpty()) throw new IllegalArgumentException("Cannot simulate an empty trajectory");
        this.config = Objects.requireNonNull(config, "config must not be null").copy().validate();
        this.aero = new EntryAerodynamics(this.config);
        this.integrator = new ForwardIntegrator(this.config, aero);
        this.perturbation = new PerturbationEngine(this.config);
        this.phases = new PhaseStateMachine(mission);
        this.original = trajectory;
        install(trajectory);
        this.time = trajectory.startTime();
        log.info("Session started: {} with {} ({})", mission.getName(), trajectory, this.config);
    }

    /** Demo Mars 2020 descent with the Mars 2020 phase table. */
    public static EntrySimulation demo(EntryConfig config) {
        return new EntrySimulation(DemoTrajectories.mars2020(config), config, MissionProfiles.mars2020(config));
    }

    /** Integrate from entry-interface conditions, then start a session on the result. */
    public static EntrySimulation fromEntryState(EntryConfig config, EntryState entry, double duration,
                                                 BankAngleProfile profile) {
        final ForwardIntegrator fi = new ForwardIntegrator(config);
        return new EntrySimulation(fi.integrate(entry, duration, profile), config, MissionProfiles.mars2020(config));
    }

    /** A recomputed future may end before the clock; playback then stays at its end. */
    private void clampClockToEnd() {
        if (time > store.endTime()) {
            log.info("New trajectory ends at t={} s, before the clock at t={} s; clock moved to the end",
                    store.endTime(), time);
            time = store.endTime();
        }
    }

    private void install(Trajectory t) {
        this.trajectory = t;
        this.store = new KinematicSampleStore(t, config);
    }

    // ── playback ──────────────────────────────────────────────────────────

    /**
     * Move the clock forward by {@code dt} (clamped at the trajectory end) and
     * run one phase update.
     */
    public PhaseUpdate advance(double dt) {
        if (!Double.isFinite(dt) || dt < 0.0) {
            throw new IllegalArgumentException("dt must be finite and non-negative, got " + dt);
        }
        lock.lock();
        try {
            time = Math.min(store.endTime(), time + dt);
            final PhaseUpdate u = phases.update(aero.vehicleState(store.query(time)));
            if (u.isStatusChanged() && u.getMissionStatus() == MissionStatus.FAILURE) {
                log.warn("Mission failure at t={} s: {}", time, u.getFailureReason());
            }
            return u;
        } finally {
            lock.unlock();
        }
    }

    /** Jump the clock (clamped) and re-derive the phase without firing events. */
    public PhaseDefinition seek(double t) {
        lock.lock();
        try {
            time = clamp(t, store.startTime(), store.endTime());
            return phases.seek(aero.vehicleState(store.query(time)));
        } finally {
            lock.unlock();
        }
    }

    /** Original trajectory, clock at start, phase state cleared. */
    public void reset() {
        lock.lock();
        try {
            install(original);
            time = original.startTime();
            phases.reset();
            log.info("Session reset to original trajectory");
        } finally {
            lock.unlock();
        }
    }

    // ── steering ──────────────────────────────────────────────────────────

    /**
     * Deflect the future from the current time. {@code lateral} steers across
     * track, {@code radial} up (positive) or down.
     */
    public Trajectory applySteering(double lateral, double radial) {
        lock.lock();
        try {
            final Trajectory next = perturbation.applyDeflection(trajectory, time, lateral, radial,
                    config.getDeflectionFinalPercent());
            install(next);
            clampClockToEnd();
            return next;
        } finally {
            lock.unlock();
        }
    }

    /** Re-integrate the future from the current time under a new bank profile. */
    public Trajectory replan(BankAngleProfile profile) {
        Objects.requireNonNull(profile, "bank angle profile must not be null");
        lock.lock();
        try {
            final Trajectory next = integrator.continueFrom(trajectory, time, profile);
            install(next);
            clampClockToEnd();
            return next;
        } finally {
            lock.unlock();
        }
    }

    // ── queries ───────────────────────────────────────────────────────────

    public double currentTime() {
        lock.lock();
        try { return time; } finally { lock.unlock(); }
    }

    public TrajectorySample currentSample() {
        lock.lock();
        try { return store.query(time); } finally { lock.unlock(); }
    }

    public TrajectorySample sampleAt(double t) {
        lock.lock();
        try { return store.query(t); } finally { lock.unlock(); }
    }

    public VehicleState currentVehicleState() {
        lock.lock();
        try { return aero.vehicleState(store.query(time)); } finally { lock.unlock(); }
    }

    public Vector3D velocityVector() {
        lock.lock();
        try { return store.velocityVectorAt(time); } finally { lock.unlock(); }
    }

    /** Fraction of the trajectory's time span already played, in [0, 1]. */
    public double progress() {
        lock.lock();
        try { return store.progress(time); } finally { lock.unlock(); }
    }

    public boolean isFinished() {
        lock.lock();
        try { return time >= store.endTime(); } finally { lock.unlock(); }
    }

    public PhaseDefinition currentPhase() {
        lock.lock();
        try { return phases.currentPhase(); } finally { lock.unlock(); }
    }

    public MissionStatus missionStatus() {
        lock.lock();
        try { return phases.getState().getMissionStatus(); } finally { lock.unlock(); }
    }

    public String failureReason() {
        lock.lock();
        try { return phases.getState().getFailureReason(); } finally { lock.unlock(); }
    }

    /** Samples at or before the current time (copy). */
    public List<TrajectorySample> pastSamples() {
        lock.lock();
        try { return new ArrayList<>(trajectory.past(trajectory.indexAtOrBefore(time))); } finally { lock.unlock(); }
    }

    /** Samples after the current time (copy). */
    public List<TrajectorySample> futureSamples() {
        lock.lock();
        try { return new ArrayList<>(trajectory.future(trajectory.indexAtOrBefore(time))); } finally { lock.unlock(); }
    }

    public Trajectory trajectory() {
        lock.lock();
        try { return trajectory; } finally { lock.unlock(); }
    }

    public Trajectory originalTrajectory() { return original; }

    public EntryConfig config() { return config.copy(); }

    private static double clamp(double v, double lo, double hi) {
        if (Double.isNaN(v)) return lo;
        return (v < lo) ? lo : (v > hi ? hi : v);
    }
}
