package io.github.jakubt4.gwaihir.model;

import java.util.List;

/**
 * Immutable mission as loaded from a {@code ConfigProvider}.
 */
public record MissionDefinition(
        String id,
        String name,
        String description,
        String targetVehicleModel,
        int estimatedDurationSeconds,
        SafetyParameters safety,
        EnvironmentRequirements environment,
        List<CommandSpec> commands,
        TelemetryConfig telemetry) {

    public MissionDefinition {
        commands = commands == null ? List.of() : List.copyOf(commands);
    }
}
