package io.github.jakubt4.gwaihir.service.phase;

import io.github.jakubt4.gwaihir.model.CommandKind;
import io.github.jakubt4.gwaihir.service.config.ConfigInvalidException;
import io.github.jakubt4.gwaihir.service.config.UnsupportedCommandKindException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static io.github.jakubt4.gwaihir.MissionFixtures.ascend;
import static io.github.jakubt4.gwaihir.MissionFixtures.circle;
import static io.github.jakubt4.gwaihir.MissionFixtures.command;
import static io.github.jakubt4.gwaihir.MissionFixtures.hold;
import static io.github.jakubt4.gwaihir.MissionFixtures.land;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhaseDispatcherTest {

    private final PhaseDispatcher dispatcher = PhaseDispatcher.standard();

    @Test
    void bindsEveryKindToItsExecutor() {
        assertThat(dispatcher.plan(command(1, CommandKind.ASCEND, ascend(10.0, 2.0, 1.0))).executor())
                .isInstanceOf(AscendExecutor.class);
        assertThat(dispatcher.plan(command(2, CommandKind.HOLD, hold(5.0, true))).executor())
                .isInstanceOf(HoldExecutor.class);
        assertThat(dispatcher.plan(command(3, CommandKind.CIRCULAR_PATH, circle(6.0, 1.0, 10.0, "cw"))).executor())
                .isInstanceOf(CircularPathExecutor.class);
        assertThat(dispatcher.plan(command(4, CommandKind.DESCEND_AND_LAND, land(1.0, true))).executor())
                .isInstanceOf(DescendAndLandExecutor.class);
    }

    @Test
    void parsesParametersWhilePlanning() {
        final var planned = dispatcher.plan(command(1, CommandKind.ASCEND, ascend(12.0, 3.0, 0.5)));

        assertThat(planned.parameters()).isEqualTo(new AscendExecutor.Parameters(12.0, 3.0, 0.5));
    }

    @Test
    void commandWithoutKindIsUnsupported() {
        assertThatThrownBy(() -> dispatcher.plan(command(7, null, Map.of())))
                .isInstanceOf(UnsupportedCommandKindException.class)
                .extracting("commandId").isEqualTo(7);
    }

    @Test
    void invalidParametersFailBeforeExecution() {
        assertThatThrownBy(() -> dispatcher.plan(command(3, CommandKind.CIRCULAR_PATH, Map.of("radius_feet", 6.0))))
                .isInstanceOf(ConfigInvalidException.class);
    }

    @ParameterizedTest
    @ValueSource(doubles = {Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.NaN})
    void nonFiniteParametersAreRejected(final double value) {
        assertThatThrownBy(() -> dispatcher.plan(command(3, CommandKind.CIRCULAR_PATH, circle(value, 1.0, 10.0, "cw"))))
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("radius_feet");
        assertThatThrownBy(() -> dispatcher.plan(command(1, CommandKind.ASCEND, ascend(10.0, value, 1.0))))
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("climb_rate_fps");
    }
}
