package io.github.jakubt4.gwaihir.model;

/**
 * Summary figures of one mission run.
 *
 * @param flightTimeSeconds   simulated time between arming and the terminal state
 * @param distanceFeet        path length travelled, summed over telemetry ticks
 * @param maxAltitudeFeet     highest altitude observed
 * @param finalBatteryPercent battery level in the terminal state
 * @param snapshotCount       telemetry ticks produced
 * @param commandsCompleted   commands that ran to completion
 */
public record MissionReport(
        double flightTimeSeconds,
        double distanceFeet,
        double maxAltitudeFeet,
        int finalBatteryPercent,
        long snapshotCount,
        int commandsCompleted) {

    public static MissionReport empty() {
        return new MissionReport(0.0, 0.0, 0.0, 0, 0, 0);
    }
}
