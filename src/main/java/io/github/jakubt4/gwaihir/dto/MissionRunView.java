package io.github.jakubt4.gwaihir.dto;

import io.github.jakubt4.gwaihir.model.MissionReport;
import io.github.jakubt4.gwaihir.service.MissionRun;

import java.time.Instant;

/**
 * JSON view of a mission run. Outcome fields stay {@code null} until the run has finished.
 */
public record MissionRunView(
        String runId,
        String missionId,
        String vehicleId,
        String state,
        Instant submittedAt,
        Instant finishedAt,
        String outcome,
        String reason,
        String finalMode,
        Integer finalBatteryPercent,
        MissionReport report,
        String error) {

    public static MissionRunView of(final MissionRun run) {
        final var outcome = run.outcome();
        final var finalState = outcome == null ? null : outcome.finalState();
        return new MissionRunView(
                run.runId(),
                run.missionId(),
                run.vehicleId(),
                run.state().name(),
                run.submittedAt(),
                run.finishedAt(),
                outcome == null ? null : outcome.status().name(),
                outcome == null ? null : outcome.reason(),
                finalState == null ? null : finalState.mode().name(),
                finalState == null ? null : finalState.batteryPercent(),
                outcome == null ? null : outcome.report(),
                run.error());
    }
}
