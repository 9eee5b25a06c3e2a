package io.github.jakubt4.gwaihir.service;

import io.github.jakubt4.gwaihir.config.RunProperties;
import io.github.jakubt4.gwaihir.model.MissionDefinition;
import io.github.jakubt4.gwaihir.model.MissionOutcome;
import io.github.jakubt4.gwaihir.model.VehicleProfile;
import io.github.jakubt4.gwaihir.service.config.ConfigInvalidException;
import io.github.jakubt4.gwaihir.service.config.ConfigProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Entry point for running missions by id.
 *
 * <p>{@link #execute} runs on the calling thread. {@link #submit} hands the run to the mission
 * worker and returns immediately; its progress is observable through {@link #find}.
 */
@Slf4j
@Service
public class MissionRunService {

    private final ConfigProvider configProvider;
    private final MissionController missionController;
    private final Executor missionExecutor;
    private final RunProperties runProperties;
    private final Clock clock;
    private final Map<String, MissionRun> runs = new ConcurrentHashMap<>();

    public MissionRunService(final ConfigProvider configProvider, final MissionController missionController,
                             @Qualifier("missionExecutor") final Executor missionExecutor,
                             final RunProperties runProperties, final Clock clock) {
        this.configProvider = configProvider;
        this.missionController = missionController;
        this.missionExecutor = missionExecutor;
        this.runProperties = runProperties;
        this.clock = clock;
    }

    public MissionOutcome execute(final String missionId, final String vehicleId) {
        final MissionDefinition mission;
        final VehicleProfile vehicle;
        try {
            mission = configProvider.loadMission(missionId);
            vehicle = configProvider.loadVehicle(vehicleId);
        } catch (final ConfigInvalidException e) {
            log.error("Configuration for mission [{}] / vehicle [{}] is invalid: {}",
                    missionId, vehicleId, e.getMessage());
            return MissionOutcome.configInvalid(e.getMessage());
        }
        return missionController.execute(mission, vehicle);
    }

    public MissionRun submit(final String missionId, final String vehicleId) {
        final var run = MissionRun.queued(UUID.randomUUID().toString(), missionId, vehicleId, clock.instant());
        runs.put(run.runId(), run);
        log.info("Run [{}] queued — mission [{}] on vehicle [{}]", run.runId(), missionId, vehicleId);
        missionExecutor.execute(() -> process(run));
        return run;
    }

    public Optional<MissionRun> find(final String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Scheduled(fixedDelayString = "#{@'gwaihir.runs-io.github.jakubt4.gwaihir.config.RunProperties'.evictionInterval()}")
    public void evictFinishedRuns() {
        final var cutoff = clock.instant().minus(runProperties.retention());
        final var before = runs.size();
        runs.values().removeIf(run -> run.isDone() && !run.finishedAt().isAfter(cutoff));
        final var evicted = before - runs.size();
        if (evicted > 0) {
            log.debug("Evicted {} finished runs older than {}", evicted, runProperties.retention());
        }
    }

    private void process(final MissionRun queued) {
        runs.put(queued.runId(), queued.running());
        try {
            final var outcome = execute(queued.missionId(), queued.vehicleId());
            runs.put(queued.runId(), queued.finished(outcome, clock.instant()));
            log.info("Run [{}] finished — {}", queued.runId(), outcome.status());
        } catch (final RuntimeException e) {
            runs.put(queued.runId(), queued.failed(e.getMessage(), clock.instant()));
            log.error("Run [{}] failed unexpectedly", queued.runId(), e);
        }
    }
}
