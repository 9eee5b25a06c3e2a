package io.github.jakubt4.gwaihir.service.phase;

import io.github.jakubt4.gwaihir.model.FlightMode;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Landing sequence: optional precision centering, controlled descent to the final-approach
 * height, slow final approach to the ground, touchdown.
 *
 * <p>Precision centering moves the vehicle towards the home point (the origin) in a fixed number
 * of adjustments, each closing the same fraction of the remaining horizontal offset.
 */
@Slf4j
@Component
public class DescendAndLandExecutor implements PhaseExecutor<DescendAndLandExecutor.Parameters> {

    private static final double GROUND_EPSILON_FEET = 1e-9;
    private static final double DEFAULT_FINAL_APPROACH_HEIGHT_FEET = 1.0;
    private static final double DEFAULT_TOUCHDOWN_SPEED_FPS = 0.2;

    public record Parameters(double descentRateFps, boolean precisionLanding, double finalApproachHeightFeet,
                             double touchdownSpeedFps) {
    }

    @Override
    public Parameters parseParameters(final Map<String, Object> raw) {
        final var params = new CommandParameters(raw);
        return new Parameters(
                params.requirePositive("descent_rate_fps"),
                params.requireBoolean("precision_landing"),
                params.optionalNonNegative("final_approach_height_feet", DEFAULT_FINAL_APPROACH_HEIGHT_FEET),
                params.optionalPositive("touchdown_speed_fps", DEFAULT_TOUCHDOWN_SPEED_FPS));
    }

    @Override
    public PhaseResult execute(final Parameters parameters, final PhaseContext context) {
        final var state = context.state();
        if (state.getMode() == FlightMode.LANDED) {
            log.warn("Already on the ground — nothing to land");
            return PhaseResult.completed();
        }
        state.transitionTo(FlightMode.DESCENDING);
        log.info("Initiating landing sequence");

        if (parameters.precisionLanding()) {
            final var centering = center(context);
            if (centering.isAborted()) {
                return centering;
            }
        }

        log.info("Beginning controlled descent at {}fps", parameters.descentRateFps());
        final var drainInterval = Math.max(1, context.properties().drain().descentIntervalTicks());
        final var descentStep = parameters.descentRateFps() * context.tickSeconds();
        var tick = 0;
        while (state.getPosition().getZ() > parameters.finalApproachHeightFeet() + GROUND_EPSILON_FEET) {
            final var position = state.getPosition();
            final var altitude = Math.max(parameters.finalApproachHeightFeet(), position.getZ() - descentStep);
            state.setPosition(new Vector3D(position.getX(), position.getY(), altitude));
            state.setVelocity(new Vector3D(0.0, 0.0, -parameters.descentRateFps()));
            if (tick % drainInterval == 0) {
                state.drainBattery(1);
            }
            tick++;

            final var violation = context.tick("DESCENT");
            if (violation.isPresent()) {
                return PhaseResult.aborted(violation.get());
            }
        }

        if (state.getPosition().getZ() > GROUND_EPSILON_FEET) {
            state.transitionTo(FlightMode.FINAL_APPROACH);
            log.info("Final approach — reducing to touchdown speed {}fps", parameters.touchdownSpeedFps());
            final var touchdownStep = parameters.touchdownSpeedFps() * context.tickSeconds();
            while (state.getPosition().getZ() > GROUND_EPSILON_FEET) {
                final var position = state.getPosition();
                state.setPosition(new Vector3D(position.getX(), position.getY(),
                        Math.max(0.0, position.getZ() - touchdownStep)));
                state.setVelocity(new Vector3D(0.0, 0.0, -parameters.touchdownSpeedFps()));

                final var violation = context.tick("FINAL");
                if (violation.isPresent()) {
                    return PhaseResult.aborted(violation.get());
                }
            }
        }

        final var touchdown = state.getPosition();
        state.setPosition(new Vector3D(touchdown.getX(), touchdown.getY(), 0.0));
        state.setVelocity(Vector3D.ZERO);
        state.setFlying(false);
        state.transitionTo(FlightMode.LANDED);
        state.coolMotors(context.properties().heating().landingCooldown());
        log.info("Landing complete — motors disarmed, aircraft secured");
        return PhaseResult.completed();
    }

    private PhaseResult center(final PhaseContext context) {
        final var state = context.state();
        final var landing = context.properties().precisionLanding();
        final var ticksPerAdjustment = Math.max(1, context.ticksFor(landing.adjustmentSeconds()));
        log.info("Precision landing — adjusting to landing zone center");

        for (var adjustment = 1; adjustment <= landing.adjustments(); adjustment++) {
            final var from = state.getPosition();
            final var targetX = from.getX() * landing.centeringFactor();
            final var targetY = from.getY() * landing.centeringFactor();
            var previous = from;
            for (var tick = 1; tick <= ticksPerAdjustment; tick++) {
                final var fraction = (double) tick / ticksPerAdjustment;
                final var position = new Vector3D(
                        from.getX() + (targetX - from.getX()) * fraction,
                        from.getY() + (targetY - from.getY()) * fraction,
                        from.getZ());
                state.setPosition(position);
                state.setVelocity(position.subtract(previous).scalarMultiply(context.updateRateHz()));
                previous = position;

                final var violation = context.tick("POSITION " + adjustment + "/" + landing.adjustments());
                if (violation.isPresent()) {
                    return PhaseResult.aborted(violation.get());
                }
            }
        }
        state.setVelocity(Vector3D.ZERO);
        return PhaseResult.completed();
    }
}
