package io.github.jakubt4.gwaihir.model;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.util.List;

/**
 * Immutable copy of a {@link DroneState} taken at one instant.
 */
public record StateSnapshot(
        Vector3D position,
        Vector3D velocity,
        int batteryPercent,
        double batteryVoltage,
        boolean armed,
        boolean flying,
        FlightMode mode,
        int currentCommandId,
        int missionProgressPercent,
        double elapsedSeconds,
        List<Double> motorTemperatures,
        int signalStrengthPercent,
        int satelliteCount) {

    public StateSnapshot {
        motorTemperatures = List.copyOf(motorTemperatures);
    }
}
