package io.github.jakubt4.gwaihir.service.phase;

import io.github.jakubt4.gwaihir.model.FlightMode;
import io.github.jakubt4.gwaihir.service.config.ConfigInvalidException;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Orbit the current position at a fixed radius and altitude.
 *
 * <p>The current x/y becomes the circle center. Each tick places the vehicle at
 * {@code center + r·(cos θ, sin θ)} with θ advancing by a constant step, negative for clockwise
 * flight. After the last tick the vehicle is put back on the center exactly, so the path closes
 * regardless of rounding in the angle steps.
 */
@Slf4j
@Component
public class CircularPathExecutor implements PhaseExecutor<CircularPathExecutor.Parameters> {

    public record Parameters(double radiusFeet, double speedFps, double altitudeFeet, boolean clockwise,
                             double revolutions, boolean smoothEntry) {
    }

    @Override
    public Parameters parseParameters(final Map<String, Object> raw) {
        final var params = new CommandParameters(raw);
        return new Parameters(
                params.requirePositive("radius_feet"),
                params.requirePositive("speed_fps"),
                params.requirePositive("altitude_feet"),
                isClockwise(params.requireString("direction")),
                params.optionalPositive("num_revolutions", 1.0),
                params.optionalBoolean("smooth_entry", true));
    }

    private static boolean isClockwise(final String direction) {
        return switch (direction.trim().toLowerCase(Locale.ROOT)) {
            case "clockwise", "cw" -> true;
            case "counterclockwise", "counter_clockwise", "anticlockwise", "ccw" -> false;
            default -> throw new ConfigInvalidException("Unknown circle direction: " + direction);
        };
    }

    @Override
    public PhaseResult execute(final Parameters parameters, final PhaseContext context) {
        final var state = context.state();
        final var drainInterval = Math.max(1, context.properties().drain().circleIntervalTicks());
        final var heatPerTick = context.properties().heating().circlePerTick();

        state.setFlying(true);
        state.transitionTo(FlightMode.CIRCLE);

        final var centerX = state.getPosition().getX();
        final var centerY = state.getPosition().getY();
        final var radius = parameters.radiusFeet();
        final var altitude = parameters.altitudeFeet();
        state.setPosition(new Vector3D(centerX, centerY, altitude));

        final var circumference = 2 * FastMath.PI * radius * parameters.revolutions();
        final var totalTime = circumference / parameters.speedFps();
        final var totalSteps = Math.max(1, context.ticksFor(totalTime));
        final var direction = parameters.clockwise() ? -1.0 : 1.0;
        final var angleStep = direction * 2 * FastMath.PI * parameters.revolutions() / totalSteps;
        final var angularRate = angleStep * context.updateRateHz();

        log.info("Flying {}ft diameter circle ({}) at {}fps — circumference {}ft, duration {}s",
                radius * 2, parameters.clockwise() ? "clockwise" : "counterclockwise", parameters.speedFps(),
                String.format("%.1f", circumference), String.format("%.1f", totalTime));

        if (parameters.smoothEntry()) {
            state.setVelocity(Vector3D.ZERO);
            final var entryTicks = context.ticksFor(context.properties().circle().smoothEntrySeconds());
            for (var tick = 0; tick < entryTicks; tick++) {
                final var violation = context.tick("CIRCLE ENTRY");
                if (violation.isPresent()) {
                    return PhaseResult.aborted(violation.get());
                }
            }
        }

        for (var step = 0; step < totalSteps; step++) {
            final var angle = step * angleStep;
            final var cos = FastMath.cos(angle);
            final var sin = FastMath.sin(angle);
            state.setPosition(new Vector3D(centerX + radius * cos, centerY + radius * sin, altitude));
            state.setVelocity(new Vector3D(-radius * sin * angularRate, radius * cos * angularRate, 0.0));

            if (step % drainInterval == 0) {
                state.drainBattery(1);
            }
            state.heatMotors(heatPerTick);

            final var progress = (step + 1) * 100 / totalSteps;
            final var violation = context.tick("CIRCLE (" + progress + "%)");
            if (violation.isPresent()) {
                return PhaseResult.aborted(violation.get());
            }
        }

        state.setPosition(new Vector3D(centerX, centerY, altitude));
        state.setVelocity(Vector3D.ZERO);
        state.transitionTo(FlightMode.HOVER);
        log.info("Circular flight pattern complete — returned to center position");
        return PhaseResult.completed();
    }
}
