package io.github.jakubt4.gwaihir.model;

import java.time.Duration;
import java.util.List;

/**
 * Telemetry settings of a mission.
 *
 * @param updateRateHz     tick rate of every phase loop, must be positive
 * @param dataPoints       names of the values the operator wants to see (informational)
 * @param loggingEnabled   write each snapshot to the application log
 * @param realTimeDisplay  forward each snapshot to the telemetry sinks
 */
public record TelemetryConfig(int updateRateHz, List<String> dataPoints, boolean loggingEnabled,
                              boolean realTimeDisplay) {

    public TelemetryConfig {
        dataPoints = dataPoints == null ? List.of() : List.copyOf(dataPoints);
    }

    public double tickSeconds() {
        return 1.0 / updateRateHz;
    }

    public Duration tickInterval() {
        return Duration.ofNanos(1_000_000_000L / updateRateHz);
    }
}
