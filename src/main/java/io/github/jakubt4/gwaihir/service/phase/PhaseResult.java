package io.github.jakubt4.gwaihir.service.phase;

import io.github.jakubt4.gwaihir.model.SafetyViolation;

/**
 * Result of one phase: completed, or aborted by a safety violation.
 */
public record PhaseResult(SafetyViolation violation) {

    private static final PhaseResult COMPLETED = new PhaseResult(null);

    public static PhaseResult completed() {
        return COMPLETED;
    }

    public static PhaseResult aborted(final SafetyViolation violation) {
        return new PhaseResult(violation);
    }

    public boolean isAborted() {
        return violation != null;
    }
}
