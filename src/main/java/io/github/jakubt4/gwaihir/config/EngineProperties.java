package io.github.jakubt4.gwaihir.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Simulation constants of the mission engine, bound from {@code gwaihir.engine.*}.
 *
 * <p>Passed into the mission controller at construction; nothing in the engine reads
 * configuration from anywhere else.
 */
@ConfigurationProperties(prefix = "gwaihir.engine")
public record EngineProperties(
        @DefaultValue("true") boolean realTimePacing,
        @DefaultValue("100") int initialBatteryPercent,
        @DefaultValue("25.0") double ambientTemperatureCelsius,
        @DefaultValue("65.0") double motorTemperatureMaxCelsius,
        @DefaultValue("12") int gpsSatellites,
        @DefaultValue Drain drain,
        @DefaultValue Heating heating,
        @DefaultValue Hold hold,
        @DefaultValue Circle circle,
        @DefaultValue PrecisionLanding precisionLanding,
        @DefaultValue SensorNoise sensorNoise) {

    /**
     * Battery consumption. Climb drains on every tick, other phases every N ticks.
     */
    public record Drain(
            @DefaultValue("1") int climbPercentPerTick,
            @DefaultValue("20") int holdIntervalTicks,
            @DefaultValue("15") int circleIntervalTicks,
            @DefaultValue("30") int descentIntervalTicks) {}

    /**
     * Motor temperature change per tick, and the drop applied once the vehicle has landed.
     */
    public record Heating(
            @DefaultValue("0.5") double climbPerTick,
            @DefaultValue("0.0") double holdPerTick,
            @DefaultValue("0.1") double circlePerTick,
            @DefaultValue("5.0") double landingCooldown) {}

    public record Hold(
            @DefaultValue("0.5") double driftAmplitudeFeet,
            @DefaultValue("0.25") double positionHoldFactor) {}

    public record Circle(@DefaultValue("1.0") double smoothEntrySeconds) {}

    public record PrecisionLanding(
            @DefaultValue("3") int adjustments,
            @DefaultValue("0.7") double centeringFactor,
            @DefaultValue("1.0") double adjustmentSeconds) {}

    /**
     * Optional seeded jitter on top of the deterministic signal model.
     */
    public record SensorNoise(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("42") long seed,
            @DefaultValue("3") int signalJitterPercent) {}

    public static EngineProperties defaults() {
        return new EngineProperties(false, 100, 25.0, 65.0, 12,
                new Drain(1, 20, 15, 30),
                new Heating(0.5, 0.0, 0.1, 5.0),
                new Hold(0.5, 0.25),
                new Circle(1.0),
                new PrecisionLanding(3, 0.7, 1.0),
                new SensorNoise(false, 42L, 3));
    }

    public EngineProperties withInitialBatteryPercent(final int percent) {
        return new EngineProperties(realTimePacing, percent, ambientTemperatureCelsius, motorTemperatureMaxCelsius,
                gpsSatellites, drain, heating, hold, circle, precisionLanding, sensorNoise);
    }

    public EngineProperties withSensorNoise(final SensorNoise noise) {
        return new EngineProperties(realTimePacing, initialBatteryPercent, ambientTemperatureCelsius,
                motorTemperatureMaxCelsius, gpsSatellites, drain, heating, hold, circle, precisionLanding, noise);
    }
}
