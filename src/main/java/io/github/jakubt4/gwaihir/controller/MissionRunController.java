package io.github.jakubt4.gwaihir.controller;

import io.github.jakubt4.gwaihir.dto.MissionRunRequest;
import io.github.jakubt4.gwaihir.dto.MissionRunResponse;
import io.github.jakubt4.gwaihir.dto.MissionRunView;
import io.github.jakubt4.gwaihir.service.MissionRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoint for mission runs.
 *
 * <p>{@code POST /api/missions/runs} queues a mission on the mission worker;
 * {@code GET /api/missions/runs/{runId}} reports its progress and outcome.
 */
@Slf4j
@RestController
@RequestMapping("/api/missions")
@RequiredArgsConstructor
public class MissionRunController {

    private final MissionRunService missionRunService;

    /**
     * Queues a mission run.
     *
     * @param request mission and vehicle ids
     * @return {@code 202 Accepted} with the run id, {@code 400 Bad Request} when an id is missing
     */
    @PostMapping("/runs")
    public ResponseEntity<MissionRunResponse> submit(@RequestBody final MissionRunRequest request) {
        if (request.missionId() == null || request.missionId().isBlank()) {
            return ResponseEntity.badRequest()
                    .body(new MissionRunResponse(null, "REJECTED", "Mission id is required"));
        }
        if (request.vehicleId() == null || request.vehicleId().isBlank()) {
            return ResponseEntity.badRequest()
                    .body(new MissionRunResponse(null, "REJECTED", "Vehicle id is required"));
        }

        final var run = missionRunService.submit(request.missionId(), request.vehicleId());
        log.info("Mission run [{}] accepted for [{}] on [{}]", run.runId(), request.missionId(), request.vehicleId());
        return ResponseEntity.accepted()
                .body(new MissionRunResponse(run.runId(), "QUEUED", "Mission run queued"));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<MissionRunView> find(@PathVariable final String runId) {
        return missionRunService.find(runId)
                .map(MissionRunView::of)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
