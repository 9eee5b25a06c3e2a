package io.github.jakubt4.gwaihir.service.phase;

import io.github.jakubt4.gwaihir.RecordingTelemetrySink;
import io.github.jakubt4.gwaihir.model.DroneState;
import io.github.jakubt4.gwaihir.model.FlightMode;
import io.github.jakubt4.gwaihir.model.MissionDefinition;
import io.github.jakubt4.gwaihir.service.config.ConfigInvalidException;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.github.jakubt4.gwaihir.MissionFixtures.armedState;
import static io.github.jakubt4.gwaihir.MissionFixtures.context;
import static io.github.jakubt4.gwaihir.MissionFixtures.hold;
import static io.github.jakubt4.gwaihir.MissionFixtures.mission;
import static io.github.jakubt4.gwaihir.MissionFixtures.safety;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HoldExecutorTest {

    private static final Vector3D ANCHOR = new Vector3D(2.0, -1.0, 10.0);

    private final HoldExecutor executor = new HoldExecutor();
    private final RecordingTelemetrySink sink = new RecordingTelemetrySink();
    private final MissionDefinition mission = mission(safety(20), List.of());

    private DroneState state;

    @BeforeEach
    void setUp() {
        state = airborne(100);
    }

    @Test
    void hoversForDurationAndSettlesOnAnchor() {
        final var result = executor.execute(executor.parseParameters(hold(5.0, true)), context(state, mission, sink));

        assertThat(result.isAborted()).isFalse();
        assertThat(sink.snapshots()).hasSize(50).allSatisfy(snapshot -> {
            assertThat(snapshot.mode()).isEqualTo(FlightMode.HOVER);
            assertThat(snapshot.phase()).isEqualTo("HOVER");
        });
        assertThat(state.getPosition()).isEqualTo(ANCHOR);
        assertThat(state.getVelocity()).isEqualTo(Vector3D.ZERO);
        assertThat(state.getBatteryPercent()).isEqualTo(97);
    }

    @Test
    void positionHoldDampsDrift() {
        executor.execute(executor.parseParameters(hold(5.0, true)), context(state, mission, sink));

        assertThat(sink.snapshots()).allSatisfy(snapshot -> {
            assertThat(Math.abs(snapshot.x() - ANCHOR.getX())).isLessThanOrEqualTo(0.125 + 1e-9);
            assertThat(Math.abs(snapshot.y() - ANCHOR.getY())).isLessThanOrEqualTo(0.125 + 1e-9);
            assertThat(Math.abs(snapshot.z() - ANCHOR.getZ())).isLessThanOrEqualTo(0.0625 + 1e-9);
        });
    }

    @Test
    void driftIsLargerWithoutPositionHold() {
        executor.execute(executor.parseParameters(hold(5.0, false)), context(state, mission, sink));

        assertThat(sink.snapshots()).allSatisfy(snapshot ->
                assertThat(Math.abs(snapshot.x() - ANCHOR.getX())).isLessThanOrEqualTo(0.5 + 1e-9));
        assertThat(sink.snapshots()).anySatisfy(snapshot ->
                assertThat(Math.abs(snapshot.x() - ANCHOR.getX())).isGreaterThan(0.125));
    }

    @Test
    void zeroDurationProducesNoTicks() {
        final var result = executor.execute(executor.parseParameters(hold(0.0, true)), context(state, mission, sink));

        assertThat(result.isAborted()).isFalse();
        assertThat(sink.snapshots()).isEmpty();
        assertThat(state.getMode()).isEqualTo(FlightMode.HOVER);
    }

    @Test
    void batteryCheckStopsTheHoverOnTheFirstFailingTick() {
        state = airborne(21);

        final var result = executor.execute(executor.parseParameters(hold(5.0, true)),
                context(state, mission, sink, "battery_level"));

        assertThat(result.isAborted()).isTrue();
        assertThat(result.violation().checkName()).isEqualTo("battery_level");
        assertThat(sink.snapshots()).hasSize(21);
        assertThat(sink.snapshots().get(20).batteryPercent()).isEqualTo(19);
        assertThat(state.getBatteryPercent()).isEqualTo(19);
    }

    @Test
    void rejectsNegativeDurationAndMissingPositionHold() {
        assertThatThrownBy(() -> executor.parseParameters(hold(-1.0, true)))
                .isInstanceOf(ConfigInvalidException.class);
        assertThatThrownBy(() -> executor.parseParameters(Map.of("duration_seconds", 5.0)))
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("position_hold");
    }

    private static DroneState airborne(final int batteryPercent) {
        final var drone = armedState(batteryPercent);
        drone.setFlying(true);
        drone.transitionTo(FlightMode.HOVER);
        drone.setPosition(ANCHOR);
        return drone;
    }
}
