package com.edlsim.phase;

import com.edlsim.VehicleState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Mission phase tracker:
 *   classify(state)  -> last phase whose entry thresholds hold
 *   update(state)    -> advance to the classified phase (never back), fire events
 *                       once per visit, check failures, then success
 *   seek(state)      -> re-derive the phase after a scrub, in either direction,
 *                       without firing events
 *
 * SUCCESS and FAILURE are sticky until {@link #reset()}.
 */
public final class PhaseStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PhaseStateMachine.class);

    private final MissionProfile profile;
    private final PhaseState state = new PhaseState();

    public PhaseStateMachine(MissionProfile profile) {
        this.profile = Objects.requireNonNull(profile, "mission profile must not be null");
    }

    public MissionProfile getProfile()   { return profile; }
    public PhaseState getState()         { return state; }
    public PhaseDefinition currentPhase(){ return profile.phase(state.getCurrentPhaseIndex()); }

    /**
     * Index of the last phase whose entry thresholds are satisfied; 0 when none is.
     * Pure function of {@code vs}.
     */
    public int classify(VehicleState vs) {
        Objects.requireNonNull(vs, "vehicle state must not be null");
        final List<PhaseDefinition> phases = profile.getPhases();
        for (int i = phases.size() - 1; i >= 0; i--) {
            if (phases.get(i).isEntered(vs)) return i;
        }
        return 0;
    }

    /**
     * Valid when every end condition of {@code from} and every start condition
     * of {@code to} holds for {@code vs}.
     */
    public TransitionCheck validateTransition(int from, int to, VehicleState vs) {
        final PhaseDefinition a = profile.phase(from);
        final PhaseDefinition b = profile.phase(to);
        final List<String> unmet = new ArrayList<>();
        for (StatePredicate p : a.getEndConditions()) {
            if (!p.test(vs)) unmet.add(a.getName() + " end: " + p.name());
        }
        for (StatePredicate p : b.getStartConditions()) {
            if (!p.test(vs)) unmet.add(b.getName() + " start: " + p.name());
        }
        if (unmet.isEmpty()) return TransitionCheck.ok();
        return TransitionCheck.invalid(a.getName() + " -> " + b.getName() + " unmet " + unmet, unmet);
    }

    /**
     * Forward playback step. The phase index never decreases here: a state that
     * classifies earlier than the current phase holds it. Only {@link #seek}
     * moves backwards.
     */
    public PhaseUpdate update(VehicleState vs) {
        Objects.requireNonNull(vs, "vehicle state must not be null");
        final int prevIdx = state.getCurrentPhaseIndex();
        final PhaseDefinition prev = profile.phase(prevIdx);
        final int newIdx = Math.max(prevIdx, classify(vs));
        final boolean changed = newIdx != prevIdx;

        TransitionCheck check = TransitionCheck.ok();
        if (changed) {
            check = validateTransition(prevIdx, newIdx, vs);
            if (!check.isValid()) {
                log.warn("[Phase] t={}s: transition {}", fmt(vs.getTime()), check.getReason());
            }
            state.enter(newIdx, vs.getTime());
            log.info("[Phase] t={}s alt={}m: {} -> {}", fmt(vs.getTime()), fmt(vs.getAltitude()),
                    prev.getName(), profile.phase(newIdx).getName());
        }
        final PhaseDefinition current = profile.phase(newIdx);

        final List<String> fired = new ArrayList<>();
        for (StatePredicate ev : current.getEvents()) {
            if (!state.getFiredEvents().contains(ev.name()) && ev.test(vs)) {
                state.fire(ev.name());
                fired.add(ev.name());
                log.info("[Phase] t={}s: event '{}' in {}", fmt(vs.getTime()), ev.name(), current.getName());
            }
        }

        final MissionStatus before = state.getMissionStatus();
        if (!before.isTerminal()) {
            for (StatePredicate f : current.getCriticalFailures()) {
                if (f.test(vs)) {
                    state.fail(current.getName() + ": " + f.name());
                    log.warn("[Phase] t={}s: critical failure '{}' ({})", fmt(vs.getTime()), f.name(), vs);
                    break;
                }
            }
            final StatePredicate success = profile.getSuccessCondition();
            if (!state.getMissionStatus().isTerminal() && success != null && success.test(vs)) {
                state.succeed();
                log.info("[Phase] t={}s: mission success ({})", fmt(vs.getTime()), success.name());
            }
        }
        final boolean statusChanged = state.getMissionStatus() != before;

        if (!changed && fired.isEmpty() && !statusChanged) {
            log.trace("[Phase] t={}s: hold {}", fmt(vs.getTime()), current.getName());
        }
        return new PhaseUpdate(changed, prev, current, fired, state.getMissionStatus(), statusChanged,
                state.getFailureReason(), check);
    }

    /**
     * Jump to the phase for {@code vs} without firing events. The fired-event set
     * restarts for the landed-on phase; mission status is kept.
     */
    public PhaseDefinition seek(VehicleState vs) {
        final int idx = classify(vs);
        if (idx != state.getCurrentPhaseIndex()) {
            log.debug("[Phase] seek t={}s: {} -> {}", fmt(vs.getTime()),
                    currentPhase().getName(), profile.phase(idx).getName());
        }
        state.enter(idx, vs.getTime());
        return profile.phase(idx);
    }

    public void reset() {
        state.reset();
        log.debug("[Phase] reset to {}", currentPhase().getName());
    }

    private static String fmt(double x) { return String.format(java.util.Locale.ROOT, "%.2f", x); }
}
