package io.github.jakubt4.gwaihir.service.safety;

import io.github.jakubt4.gwaihir.model.DroneState;
import io.github.jakubt4.gwaihir.model.SafetyParameters;

import java.util.List;
import java.util.Optional;

/**
 * Built-in safety checks.
 */
public final class SafetyChecks {

    public static final String BATTERY_LEVEL = "battery_level";
    public static final String ALTITUDE_HOLD = "altitude_hold";
    public static final String POSITION_STABILITY = "position_stability";
    public static final String PATH_CLEAR = "path_clear";
    public static final String LANDING_ZONE_CLEAR = "landing_zone_clear";

    private SafetyChecks() {
    }

    public static List<SafetyCheck> standard() {
        return List.of(
                batteryLevel(),
                altitudeHold(),
                advisory(POSITION_STABILITY),
                advisory(PATH_CLEAR),
                advisory(LANDING_ZONE_CLEAR));
    }

    public static SafetyCheck batteryLevel() {
        return of(BATTERY_LEVEL, (state, params) -> state.getBatteryPercent() < params.emergencyLandBatteryPercent()
                ? Optional.of("Battery too low (" + state.getBatteryPercent() + "% < "
                        + params.emergencyLandBatteryPercent() + "%)")
                : Optional.empty());
    }

    public static SafetyCheck altitudeHold() {
        return of(ALTITUDE_HOLD, (state, params) -> state.getPosition().getZ() > params.maxAltitudeFeet()
                ? Optional.of(String.format("Altitude limit exceeded (%.2fft > %.2fft)",
                        state.getPosition().getZ(), params.maxAltitudeFeet()))
                : Optional.empty());
    }

    /**
     * A check without a sensor behind it in the simulation; always passes.
     */
    public static SafetyCheck advisory(final String id) {
        return of(id, (state, params) -> Optional.empty());
    }

    private static SafetyCheck of(final String id, final Evaluator evaluator) {
        return new SafetyCheck() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public Optional<String> evaluate(final DroneState state, final SafetyParameters parameters) {
                return evaluator.evaluate(state, parameters);
            }

            @Override
            public String toString() {
                return "SafetyCheck[" + id + "]";
            }
        };
    }

    @FunctionalInterface
    private interface Evaluator {
        Optional<String> evaluate(DroneState state, SafetyParameters parameters);
    }
}
