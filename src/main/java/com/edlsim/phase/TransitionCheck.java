package com.edlsim.phase;

import java.util.List;

/**
 * Outcome of {@link PhaseStateMachine#validateTransition}. Diagnostic only;
 * classification proceeds either way.
 */
public final class TransitionCheck {

    private static final TransitionCheck OK = new TransitionCheck(true, "", List.of());

    private final boolean valid;
    private final String reason;
    private final List<String> unmetConditions;

    private TransitionCheck(boolean valid, String reason, List<String> unmetConditions) {
        this.valid = valid;
        this.reason = reason;
        this.unmetConditions = List.copyOf(unmetConditions);
    }

    public static TransitionCheck ok() { return OK; }

    public static TransitionCheck invalid(String reason, List<String> unmetConditions) {
        return new TransitionCheck(false, reason, unmetConditions);
    }

    public boolean isValid()               { return valid; }
    public String getReason()              { return reason; }
    public List<String> getUnmetConditions() { return unmetConditions; }

    @Override
    public String toString() {
        return valid ? "TransitionCheck{valid}" : "TransitionCheck{invalid: " + reason + "}";
    }
}
