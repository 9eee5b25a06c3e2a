package io.github.jakubt4.gwaihir.service.phase;

import io.github.jakubt4.gwaihir.model.FlightMode;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Hover in place for a fixed duration.
 *
 * <p>Air currents are modelled as a bounded sinusoidal drift around the anchor point. Active
 * position hold scales the drift down rather than removing it. At the end the vehicle settles
 * back on the anchor.
 */
@Slf4j
@Component
public class HoldExecutor implements PhaseExecutor<HoldExecutor.Parameters> {

    private static final double DEFAULT_ALTITUDE_TOLERANCE_FEET = 0.5;

    public record Parameters(double durationSeconds, boolean positionHold, double altitudeToleranceFeet) {
    }

    @Override
    public Parameters parseParameters(final Map<String, Object> raw) {
        final var params = new CommandParameters(raw);
        return new Parameters(
                params.requireNonNegative("duration_seconds"),
                params.requireBoolean("position_hold"),
                params.optionalNonNegative("altitude_tolerance_feet", DEFAULT_ALTITUDE_TOLERANCE_FEET));
    }

    @Override
    public PhaseResult execute(final Parameters parameters, final PhaseContext context) {
        final var state = context.state();
        final var hold = context.properties().hold();
        final var drainInterval = Math.max(1, context.properties().drain().holdIntervalTicks());
        final var heatPerTick = context.properties().heating().holdPerTick();

        state.transitionTo(FlightMode.HOVER);
        log.info("Hovering for {}s with position hold: {}", parameters.durationSeconds(), parameters.positionHold());

        final var anchor = state.getPosition();
        final var correction = parameters.positionHold() ? hold.positionHoldFactor() : 1.0;
        final var horizontalAmplitude = hold.driftAmplitudeFeet() * correction;
        final var verticalAmplitude = state.isFlying() ? parameters.altitudeToleranceFeet() * 0.5 * correction : 0.0;

        var previous = anchor;
        final var steps = context.ticksFor(parameters.durationSeconds());
        for (var step = 0; step < steps; step++) {
            final var position = new Vector3D(
                    anchor.getX() + horizontalAmplitude * FastMath.sin(step * 0.1),
                    anchor.getY() + horizontalAmplitude * FastMath.sin(step * 0.07),
                    anchor.getZ() + verticalAmplitude * FastMath.sin(step * 0.05));
            state.setPosition(position);
            state.setVelocity(position.subtract(previous).scalarMultiply(context.updateRateHz()));
            previous = position;

            if (step % drainInterval == 0) {
                state.drainBattery(1);
            }
            state.heatMotors(heatPerTick);

            final var violation = context.tick("HOVER");
            if (violation.isPresent()) {
                return PhaseResult.aborted(violation.get());
            }
        }

        state.setPosition(anchor);
        state.setVelocity(Vector3D.ZERO);
        log.info("Hover phase complete");
        return PhaseResult.completed();
    }
}
