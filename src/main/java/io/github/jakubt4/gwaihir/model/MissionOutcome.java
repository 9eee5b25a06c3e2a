package io.github.jakubt4.gwaihir.model;

import java.util.Optional;

/**
 * Terminal result of a mission run.
 *
 * <p>{@code reason} is the failing check id for {@link MissionStatus#ABORTED} and a
 * human-readable message for pre-flight and configuration failures. {@code finalState} is
 * {@code null} when the run never created a vehicle state.
 */
public record MissionOutcome(
        MissionStatus status,
        String reason,
        SafetyViolation violation,
        StateSnapshot finalState,
        MissionReport report) {

    public static MissionOutcome success(final StateSnapshot finalState, final MissionReport report) {
        return new MissionOutcome(MissionStatus.SUCCESS, null, null, finalState, report);
    }

    public static MissionOutcome aborted(final SafetyViolation violation, final StateSnapshot finalState,
                                         final MissionReport report) {
        return new MissionOutcome(MissionStatus.ABORTED, violation.checkName(), violation, finalState, report);
    }

    public static MissionOutcome preflightFailed(final String reason, final StateSnapshot finalState) {
        return new MissionOutcome(MissionStatus.PREFLIGHT_FAILED, reason, null, finalState, MissionReport.empty());
    }

    public static MissionOutcome configInvalid(final String reason) {
        return new MissionOutcome(MissionStatus.CONFIG_INVALID, reason, null, null, MissionReport.empty());
    }

    public boolean isSuccess() {
        return status == MissionStatus.SUCCESS;
    }

    public Optional<SafetyViolation> safetyViolation() {
        return Optional.ofNullable(violation);
    }
}
