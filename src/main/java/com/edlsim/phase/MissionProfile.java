package com.edlsim.phase;

import java.util.List;
import java.util.Objects;

/**
 * Ordered phase table plus the condition that ends the mission in success.
 */
public final class MissionProfile {

    private final String name;
    private final List<PhaseDefinition> phases;
    private final StatePredicate successCondition;

    /**
     * @param successCondition nullable; without one the mission can only end in failure
     */
    public MissionProfile(String name, List<PhaseDefinition> phases, StatePredicate successCondition) {
        this.name = Objects.requireNonNull(name, "mission name must not be null");
        Objects.requireNonNull(phases, "phases must not be null");
        if (phases.isEmpty()) throw new IllegalArgumentException("Mission '" + name + "' has no phases");
        this.phases = List.copyOf(phases);
        this.successCondition = successCondition;
    }

    public String getName()                 { return name; }
    public List<PhaseDefinition> getPhases(){ return phases; }
    public int phaseCount()                 { return phases.size(); }
    public PhaseDefinition phase(int index) { return phases.get(index); }
    public StatePredicate getSuccessCondition() { return successCondition; }

    /** Index of the phase with this name, or -1. */
    public int indexOf(String phaseName) {
        for (int i = 0; i < phases.size(); i++) {
            if (phases.get(i).getName().equals(phaseName)) return i;
        }
        return -1;
    }

    @Override
    public String toString() { return "MissionProfile{" + name + ", phases=" + phases.size() + "}"; }
}
