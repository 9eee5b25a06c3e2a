package io.github.jakubt4.gwaihir.model;

/**
 * A failed safety check.
 *
 * @param checkName id of the failing check, e.g. {@code battery_level}
 * @param reason    operator-readable detail
 * @param state     vehicle state at the moment of the failure
 */
public record SafetyViolation(String checkName, String reason, StateSnapshot state) {
}
