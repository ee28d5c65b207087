package com.edlsim.phase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable phase bookkeeping for one session. Written only by
 * {@link PhaseStateMachine}; callers get read access.
 */
public final class PhaseState {

    private int currentPhaseIndex;
    private double phaseEntryTime;
    private final Set<String> firedEvents = new LinkedHashSet<>();
    private MissionStatus missionStatus = MissionStatus.ACTIVE;
    private String failureReason;
    private final List<Visit> history = new ArrayList<>();

    PhaseState() {
        reset();
    }

    void reset() {
        currentPhaseIndex = 0;
        phaseEntryTime = 0.0;
        firedEvents.clear();
        missionStatus = MissionStatus.ACTIVE;
        failureReason = null;
        history.clear();
        history.add(new Visit(0, 0.0));
    }

    void enter(int index, double time) {
        currentPhaseIndex = index;
        phaseEntryTime = time;
        firedEvents.clear();
        history.add(new Visit(index, time));
    }

    boolean fire(String event) { return firedEvents.add(event); }

    void fail(String reason) {
        missionStatus = MissionStatus.FAILURE;
        failureReason = reason;
    }

    void succeed() { missionStatus = MissionStatus.SUCCESS; }

    public int getCurrentPhaseIndex()     { return currentPhaseIndex; }
    public double getPhaseEntryTime()     { return phaseEntryTime; }
    public Set<String> getFiredEvents()   { return Collections.unmodifiableSet(firedEvents); }
    public MissionStatus getMissionStatus() { return missionStatus; }
    public String getFailureReason()      { return failureReason; }
    public List<Visit> getHistory()       { return Collections.unmodifiableList(history); }

    @Override
    public String toString() {
        return "PhaseState{phase=" + currentPhaseIndex +
                ", since=" + phaseEntryTime +
                ", fired=" + firedEvents +
                ", status=" + missionStatus +
                (failureReason != null ? ", reason='" + failureReason + '\'' : "") +
                "}";
    }

    /** A phase entry: index and the time it happened. */
    public static final class Visit {
        private final int phaseIndex;
        private final double time;

        Visit(int phaseIndex, double time) {
            this.phaseIndex = phaseIndex;
            this.time = time;
        }

        public int getPhaseIndex() { return phaseIndex; }
        public double getTime()    { return time; }

        @Override
        public String toString() { return phaseIndex + "@" + time; }
    }
}
