package io.github.jakubt4.gwaihir.client;

import io.github.jakubt4.gwaihir.config.GroundStationProperties;
import io.github.jakubt4.gwaihir.service.telemetry.TelemetrySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts one telemetry snapshot to the ground station as JSON.
 *
 * <p>Called from the uplink thread of {@link GroundStationTelemetryClient}, never from a mission
 * worker, so the retry backoff does not delay mission ticks.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "gwaihir.telemetry.ground-station", name = "enabled", havingValue = "true")
public class GroundStationPublisher {

    private final RestClient restClient;
    private final String path;

    public GroundStationPublisher(final RestClient.Builder restClientBuilder,
                                  final GroundStationProperties properties) {
        this.restClient = restClientBuilder
                .baseUrl(properties.baseUrl())
                .build();
        this.path = properties.path();
    }

    @Retryable(retryFor = RestClientException.class, maxAttempts = 3,
               backoff = @Backoff(delay = 500, maxDelay = 2000))
    public void publish(final TelemetrySnapshot snapshot) {
        restClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .body(snapshot)
                .retrieve()
                .toBodilessEntity();
    }

    @Recover
    public void recoverPublish(final RestClientException e, final TelemetrySnapshot snapshot) {
        log.warn("Failed to send telemetry for [{}] t={}s to ground station after retries: {}",
                snapshot.mission(), String.format("%.1f", snapshot.elapsedSeconds()), e.getMessage());
    }
}
