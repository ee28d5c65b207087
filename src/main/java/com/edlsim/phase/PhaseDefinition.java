package com.edlsim.phase;

import com.edlsim.VehicleState;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One row of a mission phase table.
 * <p>
 *   A phase is entered once every configured threshold holds: time at or past
 *   {@code entryTime}, altitude at or below {@code entryAltitude}. A phase with
 *   neither threshold is entered unconditionally.
 * </p>
 */
public final class PhaseDefinition {

    private final String name;
    private final String description;
    private final Double entryTime;      // s, nullable
    private final Double entryAltitude;  // m, nullable
    private final List<StatePredicate> startConditions;
    private final List<StatePredicate> endConditions;
    private final List<StatePredicate> events;
    private final List<StatePredicate> criticalFailures;

    private PhaseDefinition(Builder b) {
        this.name = Objects.requireNonNull(b.name, "phase name must not be null");
        if (name.isBlank()) throw new IllegalArgumentException("phase name is empty");
        this.description = b.description == null ? "" : b.description;
        this.entryTime = b.entryTime;
        this.entryAltitude = b.entryAltitude;
        this.startConditions = List.copyOf(b.startConditions);
        this.endConditions = List.copyOf(b.endConditions);
        this.events = List.copyOf(b.events);
        this.criticalFailures = List.copyOf(b.criticalFailures);
    }

    public static Builder builder(String name) { return new Builder(name); }

    public boolean isEntered(VehicleState state) {
        if (entryTime != null && !(state.getTime() >= entryTime)) return false;
        if (entryAltitude != null && !(state.getAltitude() <= entryAltitude)) return false;
        return true;
    }

    public String getName()                          { return name; }
    public String getDescription()                   { return description; }
    public Double getEntryTime()                     { return entryTime; }
    public Double getEntryAltitude()                 { return entryAltitude; }
    public List<StatePredicate> getStartConditions() { return startConditions; }
    public List<StatePredicate> getEndConditions()   { return endConditions; }
    public List<StatePredicate> getEvents()          { return events; }
    public List<StatePredicate> getCriticalFailures(){ return criticalFailures; }

    @Override
    public String toString() {
        return "PhaseDefinition{" + name +
                (entryTime != null ? ", t>=" + entryTime : "") +
                (entryAltitude != null ? ", alt<=" + entryAltitude : "") +
                "}";
    }

    public static final class Builder {
        private final String name;
        private String description;
        private Double entryTime;
        private Double entryAltitude;
        private final List<StatePredicate> startConditions = new ArrayList<>();
        private final List<StatePredicate> endConditions = new ArrayList<>();
        private final List<StatePredicate> events = new ArrayList<>();
        private final List<StatePredicate> criticalFailures = new ArrayList<>();

        private Builder(String name) { this.name = name; }

        public Builder description(String d)        { this.description = d; return this; }
        public Builder entryTime(double t)          { this.entryTime = t; return this; }
        public Builder entryAltitude(double h)      { this.entryAltitude = h; return this; }
        public Builder startCondition(StatePredicate p) { startConditions.add(Objects.requireNonNull(p)); return this; }
        public Builder endCondition(StatePredicate p)   { endConditions.add(Objects.requireNonNull(p)); return this; }
        public Builder event(StatePredicate p)          { events.add(Objects.requireNonNull(p)); return this; }
        public Builder criticalFailure(StatePredicate p){ criticalFailures.add(Objects.requireNonNull(p)); return this; }

        public PhaseDefinition build() { return new PhaseDefinition(this); }
    }
}
