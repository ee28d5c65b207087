package com.edlsim.phase;

import com.edlsim.VehicleState;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Named condition over a {@link VehicleState}. The name is what shows up in
 * transition diagnostics, fired-event sets and failure reasons.
 */
public final class StatePredicate {

    private final String name;
    private final Predicate<VehicleState> condition;

    private StatePredicate(String name, Predicate<VehicleState> condition) {
        this.name = Objects.requireNonNull(name, "predicate name must not be null");
        this.condition = Objects.requireNonNull(condition, "predicate condition must not be null");
        if (name.isBlank()) throw new IllegalArgumentException("predicate name is empty");
    }

    public static StatePredicate of(String name, Predicate<VehicleState> condition) {
        return new StatePredicate(name, condition);
    }

    /** Always true. */
    public static StatePredicate always(String name) {
        return new StatePredicate(name, s -> true);
    }

    public String name() { return name; }

    public boolean test(VehicleState state) { return condition.test(state); }

    public StatePredicate or(StatePredicate other) {
        return new StatePredicate(name + " or " + other.name, condition.or(other.condition));
    }

    @Override
    public String toString() { return name; }
}
