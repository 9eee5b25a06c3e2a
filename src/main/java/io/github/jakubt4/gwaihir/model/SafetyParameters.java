package io.github.jakubt4.gwaihir.model;

/**
 * Per-mission safety thresholds. Consulted by every phase through the safety gate.
 *
 * @param maxAltitudeFeet              ceiling enforced by the {@code altitude_hold} check
 * @param maxSpeedFps                  maximum horizontal speed
 * @param emergencyLandBatteryPercent  floor enforced by the {@code battery_level} check
 * @param geofenceRadiusFeet           advisory operating radius around the home point
 * @param maxWindSpeedMph              maximum tolerable wind speed
 */
public record SafetyParameters(
        double maxAltitudeFeet,
        double maxSpeedFps,
        int emergencyLandBatteryPercent,
        double geofenceRadiusFeet,
        double maxWindSpeedMph) {
}
