package io.github.jakubt4.gwaihir.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * JSON shape of a mission file ({@code missions/<id>.json}). All fields are nullable here;
 * presence is validated when the document is converted to a mission definition.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MissionDocument(Mission mission, List<Command> commands, Telemetry telemetryConfig) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Mission(String name, String description, String droneModel, Integer durationEstimateSeconds,
                          Safety safetyParameters, Environment environment) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Safety(Double maxAltitudeFeet, Double maxSpeedFps, Integer emergencyLandBatteryPercent,
                         Double geofenceRadiusFeet, Double maxWindSpeedMph) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Environment(Boolean indoorSafe, Boolean outdoorCapable, String recommendedSpace) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Command(Integer id, String type, String description, Map<String, Object> parameters,
                          Integer expectedDurationSeconds, List<String> safetyChecks) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Telemetry(Integer updateRateHz, List<String> dataPoints, Boolean loggingEnabled,
                            Boolean realTimeDisplay) {
    }
}
