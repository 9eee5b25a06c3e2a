package io.github.jakubt4.gwaihir.service.telemetry;

import io.github.jakubt4.gwaihir.config.EngineProperties;
import io.github.jakubt4.gwaihir.model.DroneState;
import io.github.jakubt4.gwaihir.model.SafetyParameters;
import org.hipparchus.util.FastMath;

import java.util.Random;

/**
 * Derives the simulated sensor fields of a {@link DroneState}.
 *
 * <p>Signal strength falls linearly from 100% at the home point to
 * {@code 100 - MAX_RANGE_LOSS}% at the geofence radius and stays there beyond it. When sensor
 * noise is enabled a uniformly distributed jitter from a seeded generator is added, so two runs
 * with the same seed report the same values.
 */
public class SensorModel {

    static final int MAX_RANGE_LOSS = 40;

    private final double geofenceRadiusFeet;
    private final int satellites;
    private final Random noise;
    private final int jitterPercent;

    public SensorModel(final SafetyParameters safety, final boolean gps, final EngineProperties properties) {
        this.geofenceRadiusFeet = safety.geofenceRadiusFeet();
        this.satellites = gps ? properties.gpsSatellites() : 0;
        final var sensorNoise = properties.sensorNoise();
        this.noise = sensorNoise.enabled() ? new Random(sensorNoise.seed()) : null;
        this.jitterPercent = Math.max(0, sensorNoise.signalJitterPercent());
    }

    public void update(final DroneState state) {
        state.setSignalStrengthPercent(signalStrength(state) + jitter());
        state.setSatelliteCount(satellites);
    }

    static double horizontalDistance(final DroneState state) {
        return FastMath.hypot(state.getPosition().getX(), state.getPosition().getY());
    }

    private int signalStrength(final DroneState state) {
        if (geofenceRadiusFeet <= 0.0) {
            return 100;
        }
        final var ratio = FastMath.min(1.0, horizontalDistance(state) / geofenceRadiusFeet);
        return 100 - (int) FastMath.round(ratio * MAX_RANGE_LOSS);
    }

    private int jitter() {
        if (noise == null || jitterPercent == 0) {
            return 0;
        }
        return noise.nextInt(2 * jitterPercent + 1) - jitterPercent;
    }
}
