package io.github.jakubt4.gwaihir.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.gwaihir.dto.MissionDocument;
import io.github.jakubt4.gwaihir.dto.VehicleDocument;
import io.github.jakubt4.gwaihir.model.CommandKind;
import io.github.jakubt4.gwaihir.model.CommandSpec;
import io.github.jakubt4.gwaihir.model.EnvironmentRequirements;
import io.github.jakubt4.gwaihir.model.MissionDefinition;
import io.github.jakubt4.gwaihir.model.SafetyParameters;
import io.github.jakubt4.gwaihir.model.TelemetryConfig;
import io.github.jakubt4.gwaihir.model.VehicleProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Loads missions from {@code <missions-path>/<id>.json} and vehicles from
 * {@code <vehicles-path>/<id>.json} on the classpath.
 */
@Slf4j
@Component
public class ClasspathConfigProvider implements ConfigProvider {

    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

    private final ObjectMapper objectMapper;
    private final String missionsPath;
    private final String vehiclesPath;

    public ClasspathConfigProvider(final ObjectMapper objectMapper,
                                   @Value("${gwaihir.config.missions-path:missions}") final String missionsPath,
                                   @Value("${gwaihir.config.vehicles-path:drones}") final String vehiclesPath) {
        this.objectMapper = objectMapper;
        this.missionsPath = missionsPath;
        this.vehiclesPath = vehiclesPath;
    }

    @Override
    public MissionDefinition loadMission(final String missionId) {
        final var document = read(missionsPath, missionId, MissionDocument.class);
        final var mission = require(document.mission(), "mission");
        final var safety = require(mission.safetyParameters(), "mission.safety_parameters");
        final var environment = mission.environment();
        final var telemetry = require(document.telemetryConfig(), "telemetry_config");

        final var definition = new MissionDefinition(
                missionId,
                require(mission.name(), "mission.name"),
                mission.description(),
                mission.droneModel(),
                mission.durationEstimateSeconds() == null ? 0 : mission.durationEstimateSeconds(),
                new SafetyParameters(
                        require(safety.maxAltitudeFeet(), "mission.safety_parameters.max_altitude_feet"),
                        require(safety.maxSpeedFps(), "mission.safety_parameters.max_speed_fps"),
                        require(safety.emergencyLandBatteryPercent(),
                                "mission.safety_parameters.emergency_land_battery_percent"),
                        require(safety.geofenceRadiusFeet(), "mission.safety_parameters.geofence_radius_feet"),
                        require(safety.maxWindSpeedMph(), "mission.safety_parameters.max_wind_speed_mph")),
                environment == null
                        ? new EnvironmentRequirements(false, false, null)
                        : new EnvironmentRequirements(
                                Boolean.TRUE.equals(environment.indoorSafe()),
                                Boolean.TRUE.equals(environment.outdoorCapable()),
                                environment.recommendedSpace()),
                commands(require(document.commands(), "commands")),
                new TelemetryConfig(
                        require(telemetry.updateRateHz(), "telemetry_config.update_rate_hz"),
                        telemetry.dataPoints(),
                        Boolean.TRUE.equals(telemetry.loggingEnabled()),
                        Boolean.TRUE.equals(telemetry.realTimeDisplay())));

        log.info("Mission loaded — [{}] for {} | {} commands | est. {}s | max alt {}ft, max speed {}fps",
                definition.name(), definition.targetVehicleModel(), definition.commands().size(),
                definition.estimatedDurationSeconds(), definition.safety().maxAltitudeFeet(),
                definition.safety().maxSpeedFps());
        return definition;
    }

    @Override
    public VehicleProfile loadVehicle(final String vehicleId) {
        final var document = read(vehiclesPath, vehicleId, VehicleDocument.class);
        final var drone = require(document.drone(), "drone");
        final var profile = new VehicleProfile(
                vehicleId,
                require(drone.model(), "drone.model"),
                drone.manufacturer(),
                drone.type(),
                drone.category(),
                drone.specifications(),
                drone.capabilities());

        log.info("Vehicle loaded — {} by {} ({}), specs: {}g, {}min flight",
                profile.model(), profile.manufacturer(), profile.type(),
                profile.specifications().get("weight_grams"),
                profile.specifications().get("flight_time_minutes"));
        return profile;
    }

    private List<CommandSpec> commands(final List<MissionDocument.Command> documents) {
        final var commands = new ArrayList<CommandSpec>(documents.size());
        for (final var command : documents) {
            if (command == null) {
                throw new ConfigInvalidException("commands must not contain null entries");
            }
            final int id = require(command.id(), "commands[].id");
            final var label = require(command.type(), "commands[" + id + "].type");
            final var kind = CommandKind.fromLabel(label)
                    .orElseThrow(() -> new UnsupportedCommandKindException(id, label));
            commands.add(new CommandSpec(
                    id,
                    kind,
                    command.description(),
                    command.parameters(),
                    command.expectedDurationSeconds() == null ? 0 : command.expectedDurationSeconds(),
                    command.safetyChecks()));
        }
        return commands;
    }

    private <T> T read(final String folder, final String id, final Class<T> type) {
        if (id == null || !ID_PATTERN.matcher(id).matches()) {
            throw new ConfigInvalidException("Invalid configuration id: " + id);
        }
        final var resource = folder + "/" + id + ".json";
        try (var stream = ClasspathConfigProvider.class.getClassLoader().getResourceAsStream(resource)) {
            if (stream == null) {
                throw new ConfigInvalidException("Configuration not found on classpath: " + resource);
            }
            final var value = objectMapper.readValue(stream, type);
            if (value == null) {
                throw new ConfigInvalidException("Configuration is empty: " + resource);
            }
            return value;
        } catch (final IOException e) {
            throw new ConfigInvalidException("Malformed configuration " + resource + ": " + e.getMessage(), e);
        }
    }

    private static <T> T require(final T value, final String field) {
        if (value == null) {
            throw new ConfigInvalidException("Missing required field '" + field + "'");
        }
        return value;
    }
}
