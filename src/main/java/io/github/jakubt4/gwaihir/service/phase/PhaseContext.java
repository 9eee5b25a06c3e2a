package io.github.jakubt4.gwaihir.service.phase;

import io.github.jakubt4.gwaihir.config.EngineProperties;
import io.github.jakubt4.gwaihir.model.DroneState;
import io.github.jakubt4.gwaihir.model.SafetyParameters;
import io.github.jakubt4.gwaihir.model.SafetyViolation;
import io.github.jakubt4.gwaihir.model.TelemetryConfig;
import io.github.jakubt4.gwaihir.service.safety.SafetyGate;
import io.github.jakubt4.gwaihir.service.telemetry.SensorModel;
import io.github.jakubt4.gwaihir.service.telemetry.TelemetryEmitter;
import io.github.jakubt4.gwaihir.service.time.TickPacer;

import java.util.List;
import java.util.Optional;

/**
 * Everything a phase executor touches while running one command.
 *
 * <p>A tick is: the executor mutates {@link #state()}, then calls {@link #tick}, which advances
 * the simulated clock, refreshes the sensor fields, emits one telemetry snapshot, re-evaluates
 * the command's safety checks and finally waits for the tick interval. A violation is returned
 * before the wait so the executor can stop without producing another tick.
 */
public class PhaseContext {

    private static final double TICK_EPSILON = 1e-9;

    private final DroneState state;
    private final SafetyParameters safety;
    private final TelemetryConfig telemetry;
    private final EngineProperties properties;
    private final SafetyGate safetyGate;
    private final TelemetryEmitter emitter;
    private final SensorModel sensors;
    private final TickPacer pacer;
    private final List<String> checks;

    public PhaseContext(final DroneState state, final SafetyParameters safety, final TelemetryConfig telemetry,
                        final EngineProperties properties, final SafetyGate safetyGate,
                        final TelemetryEmitter emitter, final SensorModel sensors, final TickPacer pacer,
                        final List<String> checks) {
        this.state = state;
        this.safety = safety;
        this.telemetry = telemetry;
        this.properties = properties;
        this.safetyGate = safetyGate;
        this.emitter = emitter;
        this.sensors = sensors;
        this.pacer = pacer;
        this.checks = List.copyOf(checks);
    }

    public PhaseContext withChecks(final List<String> commandChecks) {
        return new PhaseContext(state, safety, telemetry, properties, safetyGate, emitter, sensors, pacer,
                commandChecks);
    }

    public DroneState state() {
        return state;
    }

    public EngineProperties properties() {
        return properties;
    }

    public int updateRateHz() {
        return telemetry.updateRateHz();
    }

    public double tickSeconds() {
        return telemetry.tickSeconds();
    }

    /**
     * Number of whole ticks that fit in the given span of simulated time.
     */
    public int ticksFor(final double seconds) {
        return (int) Math.floor(seconds * telemetry.updateRateHz() + TICK_EPSILON);
    }

    public Optional<SafetyViolation> tick(final String phaseLabel) {
        state.advanceClock(telemetry.tickSeconds());
        sensors.update(state);
        emitter.emit(state, phaseLabel);
        final var violation = safetyGate.check(checks, state, safety);
        if (violation.isPresent()) {
            return violation;
        }
        pacer.pause(telemetry.tickInterval());
        return Optional.empty();
    }
}
