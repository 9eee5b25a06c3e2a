package io.github.jakubt4.gwaihir.model;

import lombok.Getter;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.util.Arrays;
import java.util.List;

/**
 * Mutable state of the simulated vehicle during one mission run.
 *
 * <p>Owned by a single mission run and mutated only by the mission controller and the phase
 * executors it calls. The mutators keep the invariants that telemetry consumers rely on:
 * <ul>
 *   <li>altitude never drops below zero, positions are clamped</li>
 *   <li>battery only drains and stays within {@code [0, 100]}</li>
 *   <li>mission progress never decreases</li>
 *   <li>mode changes follow {@link FlightMode#canTransitionTo}</li>
 *   <li>motor temperatures never exceed the configured maximum and only cool on the ground</li>
 * </ul>
 */
@Getter
public class DroneState {

    private static final double CELL_EMPTY_VOLTS = 3.0;
    private static final double CELL_RANGE_VOLTS = 1.2;

    private final double ambientTemperature;
    private final double maxMotorTemperature;
    private final double[] motorTemperatures;

    private Vector3D position = Vector3D.ZERO;
    private Vector3D velocity = Vector3D.ZERO;
    private int batteryPercent;
    private double batteryVoltage;
    private boolean armed;
    private boolean flying;
    private FlightMode mode = FlightMode.DISARMED;
    private int currentCommandId;
    private int missionProgressPercent;
    private double elapsedSeconds;
    private int signalStrengthPercent = 100;
    private int satelliteCount;

    public DroneState(final int initialBatteryPercent, final int motorCount,
                      final double ambientTemperature, final double maxMotorTemperature) {
        if (motorCount <= 0) {
            throw new IllegalArgumentException("motorCount must be positive: " + motorCount);
        }
        this.ambientTemperature = ambientTemperature;
        this.maxMotorTemperature = maxMotorTemperature;
        this.motorTemperatures = new double[motorCount];
        Arrays.fill(motorTemperatures, ambientTemperature);
        this.batteryPercent = Math.max(0, Math.min(100, initialBatteryPercent));
        this.batteryVoltage = voltageFor(batteryPercent);
    }

    public void setPosition(final Vector3D position) {
        this.position = position.getZ() < 0.0
                ? new Vector3D(position.getX(), position.getY(), 0.0)
                : position;
    }

    public void setVelocity(final Vector3D velocity) {
        this.velocity = velocity;
    }

    public void setFlying(final boolean flying) {
        this.flying = flying;
    }

    public void setCurrentCommandId(final int currentCommandId) {
        this.currentCommandId = currentCommandId;
    }

    public void setSignalStrengthPercent(final int signalStrengthPercent) {
        this.signalStrengthPercent = Math.max(0, Math.min(100, signalStrengthPercent));
    }

    public void setSatelliteCount(final int satelliteCount) {
        this.satelliteCount = Math.max(0, satelliteCount);
    }

    /**
     * @throws IllegalArgumentException if the value is lower than the current progress or above 100
     */
    public void setMissionProgressPercent(final int progress) {
        if (progress < missionProgressPercent || progress > 100) {
            throw new IllegalArgumentException("Mission progress must stay within ["
                    + missionProgressPercent + ", 100]: " + progress);
        }
        this.missionProgressPercent = progress;
    }

    /**
     * @throws IllegalStateException if the current mode does not allow the transition
     */
    public void transitionTo(final FlightMode target) {
        if (mode == target) {
            return;
        }
        if (!mode.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal flight mode transition " + mode + " -> " + target);
        }
        this.mode = target;
    }

    public void arm() {
        transitionTo(FlightMode.ARMED);
        this.armed = true;
        this.elapsedSeconds = 0.0;
    }

    public void complete() {
        transitionTo(FlightMode.MISSION_COMPLETE);
        this.missionProgressPercent = 100;
        this.armed = false;
        this.flying = false;
        this.velocity = Vector3D.ZERO;
    }

    public void abort() {
        transitionTo(FlightMode.ABORTED);
        this.armed = false;
    }

    public void advanceClock(final double seconds) {
        if (seconds < 0.0) {
            throw new IllegalArgumentException("Cannot move the mission clock backwards");
        }
        this.elapsedSeconds += seconds;
    }

    public void drainBattery(final int percent) {
        if (percent < 0) {
            throw new IllegalArgumentException("Battery drain must not be negative: " + percent);
        }
        this.batteryPercent = Math.max(0, batteryPercent - percent);
        this.batteryVoltage = voltageFor(batteryPercent);
    }

    public void heatMotors(final double degrees) {
        for (var i = 0; i < motorTemperatures.length; i++) {
            motorTemperatures[i] = Math.min(maxMotorTemperature, motorTemperatures[i] + degrees);
        }
    }

    /**
     * @throws IllegalStateException while the vehicle is flying
     */
    public void coolMotors(final double degrees) {
        if (flying) {
            throw new IllegalStateException("Motors cannot cool down while flying");
        }
        for (var i = 0; i < motorTemperatures.length; i++) {
            motorTemperatures[i] = Math.max(ambientTemperature, motorTemperatures[i] - degrees);
        }
    }

    public List<Double> getMotorTemperatures() {
        return Arrays.stream(motorTemperatures).boxed().toList();
    }

    public double averageMotorTemperature() {
        return Arrays.stream(motorTemperatures).average().orElse(ambientTemperature);
    }

    public double speed() {
        return velocity.getNorm();
    }

    public StateSnapshot snapshot() {
        return new StateSnapshot(position, velocity, batteryPercent, batteryVoltage, armed, flying, mode,
                currentCommandId, missionProgressPercent, elapsedSeconds, getMotorTemperatures(),
                signalStrengthPercent, satelliteCount);
    }

    private static double voltageFor(final int percent) {
        return CELL_EMPTY_VOLTS + (percent / 100.0) * CELL_RANGE_VOLTS;
    }
}
