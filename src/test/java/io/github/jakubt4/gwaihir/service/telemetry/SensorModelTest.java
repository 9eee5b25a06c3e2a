package io.github.jakubt4.gwaihir.service.telemetry;

import io.github.jakubt4.gwaihir.config.EngineProperties;
import io.github.jakubt4.gwaihir.model.DroneState;
import io.github.jakubt4.gwaihir.model.SafetyParameters;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SensorModelTest {

    private static final SafetyParameters LIMITS = new SafetyParameters(50.0, 10.0, 20, 100.0, 10.0);

    private final DroneState state = new DroneState(100, 4, 25.0, 65.0);

    @Test
    void signalFallsLinearlyWithDistanceFromHome() {
        final var sensors = new SensorModel(LIMITS, false, EngineProperties.defaults());

        assertThat(signalAt(sensors, 0.0, 0.0)).isEqualTo(100);
        assertThat(signalAt(sensors, 30.0, 40.0)).isEqualTo(80);
        assertThat(signalAt(sensors, 100.0, 0.0)).isEqualTo(100 - SensorModel.MAX_RANGE_LOSS);
        assertThat(signalAt(sensors, 300.0, 0.0)).isEqualTo(100 - SensorModel.MAX_RANGE_LOSS);
    }

    @Test
    void altitudeDoesNotAffectSignal() {
        final var sensors = new SensorModel(LIMITS, false, EngineProperties.defaults());
        state.setPosition(new Vector3D(0.0, 0.0, 40.0));

        sensors.update(state);

        assertThat(state.getSignalStrengthPercent()).isEqualTo(100);
    }

    @Test
    void satellitesAreReportedOnlyWithGps() {
        new SensorModel(LIMITS, true, EngineProperties.defaults()).update(state);
        assertThat(state.getSatelliteCount()).isEqualTo(12);

        new SensorModel(LIMITS, false, EngineProperties.defaults()).update(state);
        assertThat(state.getSatelliteCount()).isZero();
    }

    @Test
    void seededNoiseIsReproducibleAndBounded() {
        final var noisy = EngineProperties.defaults().withSensorNoise(new EngineProperties.SensorNoise(true, 7L, 3));

        final var first = readings(new SensorModel(LIMITS, false, noisy));
        final var second = readings(new SensorModel(LIMITS, false, noisy));

        assertThat(first).isEqualTo(second);
        assertThat(first).allSatisfy(signal -> assertThat(signal).isBetween(77, 83));
        assertThat(first).anySatisfy(signal -> assertThat(signal).isNotEqualTo(80));
    }

    private int signalAt(final SensorModel sensors, final double x, final double y) {
        state.setPosition(new Vector3D(x, y, 5.0));
        sensors.update(state);
        return state.getSignalStrengthPercent();
    }

    private List<Integer> readings(final SensorModel sensors) {
        final var values = new ArrayList<Integer>();
        for (var i = 0; i < 50; i++) {
            values.add(signalAt(sensors, 30.0, 40.0));
        }
        return values;
    }
}
