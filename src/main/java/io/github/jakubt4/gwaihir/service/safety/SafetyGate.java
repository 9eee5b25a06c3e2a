package io.github.jakubt4.gwaihir.service.safety;

import io.github.jakubt4.gwaihir.model.DroneState;
import io.github.jakubt4.gwaihir.model.SafetyParameters;
import io.github.jakubt4.gwaihir.model.SafetyViolation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates named safety checks against the vehicle state and the mission's thresholds.
 *
 * <p>Checks run in the order they are requested; the first failure is returned and the
 * remaining checks are skipped. Nothing is retried.
 */
@Slf4j
@Component
public class SafetyGate {

    private final Map<String, SafetyCheck> checks;

    /**
     * @param registered checks contributed as beans; a registered check replaces the built-in
     *                   check with the same id
     */
    public SafetyGate(final List<SafetyCheck> registered) {
        final var byId = new LinkedHashMap<String, SafetyCheck>();
        SafetyChecks.standard().forEach(check -> byId.put(check.id(), check));
        for (final var check : registered) {
            if (byId.put(check.id(), check) != null) {
                log.info("Safety check [{}] overridden by {}", check.id(), check.getClass().getSimpleName());
            } else {
                log.info("Safety check [{}] registered by {}", check.id(), check.getClass().getSimpleName());
            }
        }
        this.checks = Map.copyOf(byId);
    }

    public static SafetyGate standard() {
        return new SafetyGate(List.of());
    }

    public boolean supports(final String checkId) {
        return checks.containsKey(checkId);
    }

    /**
     * Runs the named checks.
     *
     * @return the first violation, or empty when every check passes
     * @throws IllegalArgumentException if a name is not a registered check; missions are
     *                                  validated against {@link #supports} before they start
     */
    public Optional<SafetyViolation> check(final List<String> names, final DroneState state,
                                           final SafetyParameters parameters) {
        for (final var name : names) {
            final var check = checks.get(name);
            if (check == null) {
                throw new IllegalArgumentException("Unknown safety check: " + name);
            }
            final var failure = check.evaluate(state, parameters);
            if (failure.isPresent()) {
                log.warn("SAFETY ABORT — check [{}] failed: {}", name, failure.get());
                return Optional.of(new SafetyViolation(name, failure.get(), state.snapshot()));
            }
        }
        return Optional.empty();
    }
}
