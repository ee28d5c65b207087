package com.edlsim.phase;

import java.util.List;

/**
 * What changed during one {@link PhaseStateMachine#update} call.
 */
public final class PhaseUpdate {

    private final boolean phaseChanged;
    private final PhaseDefinition previousPhase;
    private final PhaseDefinition newPhase;
    private final List<String> newlyFiredEvents;
    private final MissionStatus missionStatus;
    private final boolean statusChanged;
    private final String failureReason;
    private final TransitionCheck transition;

    PhaseUpdate(boolean phaseChanged, PhaseDefinition previousPhase, PhaseDefinition newPhase,
                List<String> newlyFiredEvents, MissionStatus missionStatus, boolean statusChanged,
                String failureReason, TransitionCheck transition) {
        this.phaseChanged = phaseChanged;
        this.previousPhase = previousPhase;
        this.newPhase = newPhase;
        this.newlyFiredEvents = List.copyOf(newlyFiredEvents);
        this.missionStatus = missionStatus;
        this.statusChanged = statusChanged;
        this.failureReason = failureReason;
        this.transition = transition;
    }

    public boolean isPhaseChanged()          { return phaseChanged; }
    public PhaseDefinition getPreviousPhase(){ return previousPhase; }
    /** Current phase after the update, whether or not it changed. */
    public PhaseDefinition getNewPhase()     { return newPhase; }
    public List<String> getNewlyFiredEvents(){ return newlyFiredEvents; }
    public MissionStatus getMissionStatus()  { return missionStatus; }
    public boolean isStatusChanged()         { return statusChanged; }
    public String getFailureReason()         { return failureReason; }
    public TransitionCheck getTransition()   { return transition; }

    @Override
    public String toString() {
        return "PhaseUpdate{" +
                (phaseChanged ? previousPhase.getName() + " -> " : "") + newPhase.getName() +
                ", events=" + newlyFiredEvents +
                ", status=" + missionStatus +
                (failureReason != null ? ", reason='" + failureReason + '\'' : "") +
                "}";
    }
}
