package io.github.jakubt4.gwaihir.service;

import io.github.jakubt4.gwaihir.model.MissionOutcome;

import java.time.Instant;

/**
 * Immutable view of a submitted mission run. Each state change produces a new instance.
 *
 * @param outcome set once the run is {@link RunState#FINISHED}
 * @param error   set once the run is {@link RunState#FAILED}
 */
public record MissionRun(
        String runId,
        String missionId,
        String vehicleId,
        RunState state,
        Instant submittedAt,
        Instant finishedAt,
        MissionOutcome outcome,
        String error) {

    public enum RunState {
        QUEUED,
        RUNNING,
        FINISHED,
        FAILED
    }

    static MissionRun queued(final String runId, final String missionId, final String vehicleId,
                             final Instant submittedAt) {
        return new MissionRun(runId, missionId, vehicleId, RunState.QUEUED, submittedAt, null, null, null);
    }

    MissionRun running() {
        return new MissionRun(runId, missionId, vehicleId, RunState.RUNNING, submittedAt, null, null, null);
    }

    MissionRun finished(final MissionOutcome missionOutcome, final Instant at) {
        return new MissionRun(runId, missionId, vehicleId, RunState.FINISHED, submittedAt, at, missionOutcome, null);
    }

    MissionRun failed(final String message, final Instant at) {
        return new MissionRun(runId, missionId, vehicleId, RunState.FAILED, submittedAt, at, null, message);
    }

    public boolean isDone() {
        return state == RunState.FINISHED || state == RunState.FAILED;
    }
}
