package io.github.jakubt4.gwaihir.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class FlightModeTest {

    @ParameterizedTest
    @EnumSource(value = FlightMode.class, names = {"MISSION_COMPLETE", "ABORTED"})
    void terminalModesAllowNoFurtherTransition(final FlightMode terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        assertThat(Arrays.stream(FlightMode.values()).filter(terminal::canTransitionTo)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(value = FlightMode.class, names = {"MISSION_COMPLETE", "ABORTED"}, mode = EnumSource.Mode.EXCLUDE)
    void everyActiveModeCanAbort(final FlightMode mode) {
        assertThat(mode.isTerminal()).isFalse();
        assertThat(mode.canTransitionTo(FlightMode.ABORTED)).isTrue();
    }

    @Test
    void takeoffMustPassThroughStabilization() {
        assertThat(FlightMode.ASCEND.canTransitionTo(FlightMode.HOVER)).isFalse();
        assertThat(FlightMode.ASCEND.canTransitionTo(FlightMode.STABILIZING)).isTrue();
        assertThat(FlightMode.STABILIZING.canTransitionTo(FlightMode.HOVER)).isTrue();
    }

    @Test
    void vehicleMustBeArmedBeforeFlying() {
        assertThat(FlightMode.DISARMED.canTransitionTo(FlightMode.ASCEND)).isFalse();
        assertThat(FlightMode.DISARMED.canTransitionTo(FlightMode.ARMED)).isTrue();
    }

    @Test
    void missionCompletesFromHoverOrLandedOnly() {
        assertThat(Arrays.stream(FlightMode.values()).filter(mode -> mode.canTransitionTo(FlightMode.MISSION_COMPLETE)))
                .containsExactlyInAnyOrder(FlightMode.HOVER, FlightMode.LANDED);
    }

    @Test
    void circleReturnsToHoverBeforeLanding() {
        assertThat(FlightMode.CIRCLE.canTransitionTo(FlightMode.DESCENDING)).isFalse();
        assertThat(FlightMode.HOVER.canTransitionTo(FlightMode.DESCENDING)).isTrue();
    }
}
