package io.github.jakubt4.gwaihir.service.safety;

import io.github.jakubt4.gwaihir.model.DroneState;
import io.github.jakubt4.gwaihir.model.SafetyParameters;

import java.util.Optional;

/**
 * A named precondition evaluated against the current vehicle state.
 *
 * <p>Sensor-backed deployments can register their own implementations under the advisory ids
 * ({@code position_stability}, {@code path_clear}, {@code landing_zone_clear}).
 */
public interface SafetyCheck {

    String id();

    /**
     * @return a failure reason, or empty when the check passes
     */
    Optional<String> evaluate(DroneState state, SafetyParameters parameters);
}
