package io.github.jakubt4.gwaihir.service.phase;

import io.github.jakubt4.gwaihir.model.FlightMode;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Takeoff: a linear climb to the target altitude followed by a stabilization hold.
 *
 * <p>The climb is split into {@code (int)(climb / rate * hz)} equal steps, the last of which
 * lands exactly on the target altitude. Battery drains and motors heat on every climb tick.
 */
@Slf4j
@Component
public class AscendExecutor implements PhaseExecutor<AscendExecutor.Parameters> {

    public record Parameters(double targetAltitudeFeet, double climbRateFps, double stabilizationSeconds) {
    }

    @Override
    public Parameters parseParameters(final Map<String, Object> raw) {
        final var params = new CommandParameters(raw);
        return new Parameters(
                params.requirePositive("target_altitude_feet"),
                params.requirePositive("climb_rate_fps"),
                params.requireNonNegative("stabilization_time_seconds"));
    }

    @Override
    public PhaseResult execute(final Parameters parameters, final PhaseContext context) {
        final var state = context.state();
        final var drain = context.properties().drain();
        final var heating = context.properties().heating();

        state.setFlying(true);
        state.transitionTo(FlightMode.ASCEND);

        final var start = state.getPosition();
        final var climb = parameters.targetAltitudeFeet() - start.getZ();
        log.info("Initiating takeoff to {}ft at {}fps", parameters.targetAltitudeFeet(), parameters.climbRateFps());

        if (climb > 0.0) {
            final var steps = Math.max(1, context.ticksFor(climb / parameters.climbRateFps()));
            final var altitudeStep = climb / steps;
            for (var step = 0; step < steps; step++) {
                final var altitude = step == steps - 1
                        ? parameters.targetAltitudeFeet()
                        : start.getZ() + (step + 1) * altitudeStep;
                state.setPosition(new Vector3D(start.getX(), start.getY(), altitude));
                state.setVelocity(new Vector3D(0.0, 0.0, parameters.climbRateFps()));
                state.drainBattery(drain.climbPercentPerTick());
                state.heatMotors(heating.climbPerTick());

                final var violation = context.tick("CLIMB");
                if (violation.isPresent()) {
                    return PhaseResult.aborted(violation.get());
                }
            }
        } else {
            log.warn("Already at {}ft, at or above the takeoff target of {}ft — skipping climb",
                    String.format("%.2f", start.getZ()), parameters.targetAltitudeFeet());
        }

        state.setVelocity(Vector3D.ZERO);
        state.transitionTo(FlightMode.STABILIZING);
        final var stabilizationTicks = context.ticksFor(parameters.stabilizationSeconds());
        for (var tick = 0; tick < stabilizationTicks; tick++) {
            final var violation = context.tick("STABILIZE");
            if (violation.isPresent()) {
                return PhaseResult.aborted(violation.get());
            }
        }

        state.transitionTo(FlightMode.HOVER);
        log.info("Takeoff complete — stable hover at {}ft", String.format("%.1f", state.getPosition().getZ()));
        return PhaseResult.completed();
    }
}
