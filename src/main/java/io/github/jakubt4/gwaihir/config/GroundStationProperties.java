package io.github.jakubt4.gwaihir.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * HTTP ground station that receives telemetry snapshots, bound from
 * {@code gwaihir.telemetry.ground-station.*}.
 *
 * @param queueCapacity snapshots buffered for the uplink thread before new ones are dropped
 */
@ConfigurationProperties(prefix = "gwaihir.telemetry.ground-station")
public record GroundStationProperties(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("http://localhost:8090") String baseUrl,
        @DefaultValue("/api/telemetry/snapshots") String path,
        @DefaultValue("5s") Duration connectTimeout,
        @DefaultValue("5s") Duration readTimeout,
        @DefaultValue("256") int queueCapacity) {
}
