package io.github.jakubt4.gwaihir.service;

import io.github.jakubt4.gwaihir.config.EngineProperties;
import io.github.jakubt4.gwaihir.model.CommandSpec;
import io.github.jakubt4.gwaihir.model.DroneState;
import io.github.jakubt4.gwaihir.model.MissionDefinition;
import io.github.jakubt4.gwaihir.model.MissionOutcome;
import io.github.jakubt4.gwaihir.model.SafetyViolation;
import io.github.jakubt4.gwaihir.model.VehicleProfile;
import io.github.jakubt4.gwaihir.service.config.ConfigInvalidException;
import io.github.jakubt4.gwaihir.service.config.UnsupportedCommandKindException;
import io.github.jakubt4.gwaihir.service.phase.PhaseContext;
import io.github.jakubt4.gwaihir.service.phase.PhaseDispatcher;
import io.github.jakubt4.gwaihir.service.phase.PlannedPhase;
import io.github.jakubt4.gwaihir.service.safety.SafetyGate;
import io.github.jakubt4.gwaihir.service.telemetry.CompositeTelemetrySink;
import io.github.jakubt4.gwaihir.service.telemetry.SensorModel;
import io.github.jakubt4.gwaihir.service.telemetry.TelemetryEmitter;
import io.github.jakubt4.gwaihir.service.telemetry.TelemetrySink;
import io.github.jakubt4.gwaihir.service.time.TickPacer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Mission execution engine — drives a simulated vehicle through a mission's commands.
 *
 * <p>A run validates the whole mission before touching any state, performs the pre-flight
 * check, arms the vehicle and then executes the commands strictly in ascending id order on the
 * calling thread. A failed safety check ends the run immediately: the vehicle is disarmed,
 * its mode set to {@code ABORTED}, and no later command is attempted.
 *
 * <p>Each run owns a fresh {@link DroneState}; nothing is shared between runs.
 */
@Slf4j
@Service
public class MissionController {

    private final EngineProperties properties;
    private final SafetyGate safetyGate;
    private final PhaseDispatcher dispatcher;
    private final TelemetrySink telemetrySink;
    private final TickPacer pacer;

    public MissionController(final EngineProperties properties, final SafetyGate safetyGate,
                             final PhaseDispatcher dispatcher, final List<TelemetrySink> telemetrySinks,
                             final TickPacer pacer) {
        this.properties = properties;
        this.safetyGate = safetyGate;
        this.dispatcher = dispatcher;
        this.telemetrySink = new CompositeTelemetrySink(telemetrySinks);
        this.pacer = pacer;
    }

    public MissionOutcome execute(final MissionDefinition mission, final VehicleProfile vehicle) {
        final List<PlannedPhase<?>> plan;
        try {
            plan = plan(mission);
        } catch (final ConfigInvalidException e) {
            log.error("Mission [{}] rejected — {}", mission.name(), e.getMessage());
            return MissionOutcome.configInvalid(e.getMessage());
        }

        final var state = new DroneState(properties.initialBatteryPercent(), vehicle.motorCount(),
                properties.ambientTemperatureCelsius(), properties.motorTemperatureMaxCelsius());

        final var preflightFailure = preflight(mission, vehicle, state);
        if (preflightFailure.isPresent()) {
            log.warn("Mission [{}] pre-flight failed — {}", mission.name(), preflightFailure.get());
            return MissionOutcome.preflightFailed(preflightFailure.get(), state.snapshot());
        }

        log.info("MISSION START — [{}] on {} | {} commands | telemetry {}Hz",
                mission.name(), vehicle.model(), plan.size(), mission.telemetry().updateRateHz());
        if (!mission.telemetry().dataPoints().isEmpty()) {
            log.debug("Requested telemetry data points: {}", mission.telemetry().dataPoints());
        }

        final var emitter = new TelemetryEmitter(mission, telemetrySink);
        final var sensors = new SensorModel(mission.safety(), vehicle.hasGps(), properties);
        final var baseContext = new PhaseContext(state, mission.safety(), mission.telemetry(), properties,
                safetyGate, emitter, sensors, pacer, List.of());

        state.arm();
        sensors.update(state);

        final var total = plan.size();
        for (var index = 0; index < total; index++) {
            final var phase = plan.get(index);
            final var command = phase.command();
            state.setCurrentCommandId(command.id());
            state.setMissionProgressPercent(index * 100 / total);
            log.info("EXECUTING COMMAND {} ({}/{}) — {}: {}",
                    command.id(), index + 1, total, command.kind(), command.description());

            final var preCommand = safetyGate.check(command.safetyChecks(), state, mission.safety());
            if (preCommand.isPresent()) {
                return abort(mission, state, emitter, preCommand.get(), index);
            }

            final var result = phase.run(baseContext.withChecks(command.safetyChecks()));
            if (result.isAborted()) {
                return abort(mission, state, emitter, result.violation(), index);
            }
        }

        state.complete();
        state.coolMotors(properties.heating().landingCooldown());
        final var report = emitter.report(state, total);
        log.info("MISSION COMPLETE — [{}] flight time {}s | distance {}ft | max altitude {}ft | battery {}% ({}V)",
                mission.name(),
                String.format("%.1f", report.flightTimeSeconds()),
                String.format("%.1f", report.distanceFeet()),
                String.format("%.1f", report.maxAltitudeFeet()),
                state.getBatteryPercent(),
                String.format("%.2f", state.getBatteryVoltage()));
        return MissionOutcome.success(state.snapshot(), report);
    }

    private List<PlannedPhase<?>> plan(final MissionDefinition mission) {
        if (mission.telemetry() == null || mission.telemetry().updateRateHz() <= 0) {
            throw new ConfigInvalidException("Telemetry update rate must be positive");
        }
        if (mission.safety() == null) {
            throw new ConfigInvalidException("Mission has no safety parameters");
        }

        final var ordered = new ArrayList<>(mission.commands());
        ordered.sort(Comparator.comparingInt(CommandSpec::id));
        for (var i = 1; i < ordered.size(); i++) {
            final var previous = ordered.get(i - 1).id();
            final var current = ordered.get(i).id();
            if (current != previous + 1) {
                throw new ConfigInvalidException(current == previous
                        ? "Duplicate command id " + current
                        : "Command ids must be contiguous, found gap between " + previous + " and " + current);
            }
        }

        final var plan = new ArrayList<PlannedPhase<?>>(ordered.size());
        for (final var command : ordered) {
            for (final var check : command.safetyChecks()) {
                if (!safetyGate.supports(check)) {
                    throw new ConfigInvalidException("Unknown safety check '" + check + "' on command " + command.id());
                }
            }
            try {
                plan.add(dispatcher.plan(command));
            } catch (final UnsupportedCommandKindException e) {
                log.error("Command {} has unsupported kind [{}]", e.getCommandId(), e.getLabel());
                throw e;
            } catch (final ConfigInvalidException e) {
                throw new ConfigInvalidException("Command " + command.id() + ": " + e.getMessage(), e);
            }
        }
        return plan;
    }

    private Optional<String> preflight(final MissionDefinition mission, final VehicleProfile vehicle,
                                       final DroneState state) {
        if (mission.commands().isEmpty()) {
            return Optional.of("Mission has no commands");
        }
        if (state.getBatteryPercent() <= 0) {
            return Optional.of("No battery charge");
        }
        if (state.getBatteryPercent() < mission.safety().emergencyLandBatteryPercent()) {
            return Optional.of("Battery at " + state.getBatteryPercent() + "% is below the emergency threshold of "
                    + mission.safety().emergencyLandBatteryPercent() + "%");
        }
        final var target = mission.targetVehicleModel();
        if (target != null && !target.isBlank() && vehicle.model() != null
                && !target.trim().toLowerCase(Locale.ROOT).equals(vehicle.model().trim().toLowerCase(Locale.ROOT))) {
            return Optional.of("Mission targets " + target + " but vehicle is " + vehicle.model());
        }
        log.info("Pre-flight checks passed — battery {}% ({}V), {} motors, signal {}%",
                state.getBatteryPercent(), String.format("%.2f", state.getBatteryVoltage()),
                state.getMotorTemperatures().size(), state.getSignalStrengthPercent());
        return Optional.empty();
    }

    private MissionOutcome abort(final MissionDefinition mission, final DroneState state,
                                 final TelemetryEmitter emitter, final SafetyViolation violation,
                                 final int commandsCompleted) {
        state.abort();
        log.warn("MISSION ABORTED — [{}] at command {}: {} ({})",
                mission.name(), state.getCurrentCommandId(), violation.checkName(), violation.reason());
        return MissionOutcome.aborted(violation, state.snapshot(), emitter.report(state, commandsCompleted));
    }
}
