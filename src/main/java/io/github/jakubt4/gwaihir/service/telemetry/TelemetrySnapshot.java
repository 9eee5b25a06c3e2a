package io.github.jakubt4.gwaihir.service.telemetry;

import io.github.jakubt4.gwaihir.model.FlightMode;

import java.util.Locale;

/**
 * One telemetry tick as handed to a {@link TelemetrySink}.
 *
 * @param mission                mission name
 * @param commandId              id of the executing command
 * @param phase                  phase label, e.g. {@code CLIMB} or {@code CIRCLE (40%)}
 * @param elapsedSeconds         simulated flight time since arming
 * @param x                      east offset from home, feet
 * @param y                      north offset from home, feet
 * @param z                      altitude, feet
 * @param speedFps               velocity magnitude
 * @param batteryPercent         remaining battery
 * @param batteryVoltage         per-cell voltage derived from the battery percent
 * @param signalStrengthPercent  link quality
 * @param averageMotorTemperature mean of all motor temperatures, Celsius
 * @param mode                   flight mode
 * @param progressPercent        mission progress
 * @param armed                  motors armed
 * @param flying                 vehicle airborne
 * @param satellites             satellites in view, zero without GPS
 * @param geofence               advisory position relative to the geofence radius
 */
public record TelemetrySnapshot(
        String mission,
        int commandId,
        String phase,
        double elapsedSeconds,
        double x,
        double y,
        double z,
        double speedFps,
        int batteryPercent,
        double batteryVoltage,
        int signalStrengthPercent,
        double averageMotorTemperature,
        FlightMode mode,
        int progressPercent,
        boolean armed,
        boolean flying,
        int satellites,
        GeofenceStatus geofence) {

    public enum GeofenceStatus {
        INSIDE,
        OUTSIDE
    }

    /**
     * Single-line console rendering.
     */
    public String format() {
        return String.format(Locale.ROOT, "[%s] T:%.1fs | Pos:(%.2f, %.2f, %.2f) | Vel:%.1ffps | Bat:%d%% (%.2fV) | Sig:%d%% | Temp:%.1fC",
                phase, elapsedSeconds, x, y, z, speedFps, batteryPercent, batteryVoltage,
                signalStrengthPercent, averageMotorTemperature);
    }
}
