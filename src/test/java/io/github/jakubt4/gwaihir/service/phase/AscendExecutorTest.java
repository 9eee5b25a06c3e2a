package io.github.jakubt4.gwaihir.service.phase;

import io.github.jakubt4.gwaihir.RecordingTelemetrySink;
import io.github.jakubt4.gwaihir.model.CommandKind;
import io.github.jakubt4.gwaihir.model.FlightMode;
import io.github.jakubt4.gwaihir.service.config.ConfigInvalidException;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.github.jakubt4.gwaihir.MissionFixtures.armedState;
import static io.github.jakubt4.gwaihir.MissionFixtures.ascend;
import static io.github.jakubt4.gwaihir.MissionFixtures.command;
import static io.github.jakubt4.gwaihir.MissionFixtures.context;
import static io.github.jakubt4.gwaihir.MissionFixtures.mission;
import static io.github.jakubt4.gwaihir.MissionFixtures.safety;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AscendExecutorTest {

    private final AscendExecutor executor = new AscendExecutor();
    private final RecordingTelemetrySink sink = new RecordingTelemetrySink();

    @Test
    void climbsToTargetAndStabilizesIntoHover() {
        final var mission = mission(safety(20), List.of(command(1, CommandKind.ASCEND, ascend(10.0, 2.0, 1.0))));
        final var state = armedState();

        final var result = executor.execute(executor.parseParameters(ascend(10.0, 2.0, 1.0)),
                context(state, mission, sink));

        assertThat(result.isAborted()).isFalse();
        assertThat(state.getPosition().getZ()).isEqualTo(10.0);
        assertThat(state.getMode()).isEqualTo(FlightMode.HOVER);
        assertThat(state.isFlying()).isTrue();
        assertThat(state.getVelocity()).isEqualTo(Vector3D.ZERO);
        assertThat(state.getElapsedSeconds()).isCloseTo(6.0, within(1e-9));

        assertThat(sink.withPhasePrefix("CLIMB")).hasSize(50)
                .allSatisfy(snapshot -> {
                    assertThat(snapshot.mode()).isEqualTo(FlightMode.ASCEND);
                    assertThat(snapshot.speedFps()).isEqualTo(2.0);
                });
        assertThat(sink.withPhasePrefix("STABILIZE")).hasSize(10)
                .allSatisfy(snapshot -> {
                    assertThat(snapshot.mode()).isEqualTo(FlightMode.STABILIZING);
                    assertThat(snapshot.z()).isEqualTo(10.0);
                    assertThat(snapshot.speedFps()).isZero();
                });
    }

    @Test
    void altitudeRisesMonotonicallyWhileBatteryDrainsEveryClimbTick() {
        final var mission = mission(safety(20), List.of());
        final var state = armedState();

        executor.execute(executor.parseParameters(ascend(10.0, 2.0, 0.0)), context(state, mission, sink));

        final var snapshots = sink.snapshots();
        for (var i = 1; i < snapshots.size(); i++) {
            assertThat(snapshots.get(i).z()).isGreaterThan(snapshots.get(i - 1).z());
            assertThat(snapshots.get(i).batteryPercent()).isEqualTo(snapshots.get(i - 1).batteryPercent() - 1);
        }
        assertThat(state.getBatteryPercent()).isEqualTo(50);
        assertThat(state.averageMotorTemperature()).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void altitudeLimitAbortsTheClimbOnTheOffendingTick() {
        final var mission = mission(safety(7.9, 20), List.of());
        final var state = armedState();

        final var result = executor.execute(executor.parseParameters(ascend(10.0, 2.0, 1.0)),
                context(state, mission, sink, "altitude_hold"));

        assertThat(result.isAborted()).isTrue();
        assertThat(result.violation().checkName()).isEqualTo("altitude_hold");
        assertThat(sink.snapshots()).hasSize(40);
        assertThat(state.getMode()).isEqualTo(FlightMode.ASCEND);
    }

    @Test
    void skipsClimbWhenAlreadyAboveTarget() {
        final var mission = mission(safety(20), List.of());
        final var state = armedState();
        executor.execute(executor.parseParameters(ascend(10.0, 2.0, 0.0)), context(state, mission, sink));
        sink.snapshots().clear();

        final var result = executor.execute(executor.parseParameters(ascend(5.0, 2.0, 1.0)),
                context(state, mission, sink));

        assertThat(result.isAborted()).isFalse();
        assertThat(sink.withPhasePrefix("CLIMB")).isEmpty();
        assertThat(sink.withPhasePrefix("STABILIZE")).hasSize(10);
        assertThat(state.getPosition().getZ()).isEqualTo(10.0);
        assertThat(state.getMode()).isEqualTo(FlightMode.HOVER);
    }

    @Test
    void rejectsMissingOrNonPositiveParameters() {
        assertThatThrownBy(() -> executor.parseParameters(Map.of("climb_rate_fps", 2.0)))
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("target_altitude_feet");
        assertThatThrownBy(() -> executor.parseParameters(ascend(10.0, 0.0, 1.0)))
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("climb_rate_fps");
        assertThatThrownBy(() -> executor.parseParameters(Map.of(
                "target_altitude_feet", "high", "climb_rate_fps", 2.0, "stabilization_time_seconds", 1.0)))
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("must be a number");
    }
}
