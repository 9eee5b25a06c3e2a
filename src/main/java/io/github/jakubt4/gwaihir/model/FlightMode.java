package io.github.jakubt4.gwaihir.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Flight mode of the simulated vehicle and the transitions allowed between modes.
 *
 * <p>{@link #MISSION_COMPLETE} and {@link #ABORTED} are terminal. Every non-terminal mode may
 * transition to {@link #ABORTED}.
 */
public enum FlightMode {
    DISARMED,
    ARMED,
    ASCEND,
    STABILIZING,
    HOVER,
    CIRCLE,
    DESCENDING,
    FINAL_APPROACH,
    LANDED,
    MISSION_COMPLETE,
    ABORTED;

    public boolean isTerminal() {
        return this == MISSION_COMPLETE || this == ABORTED;
    }

    public boolean canTransitionTo(final FlightMode target) {
        return allowedTargets().contains(target);
    }

    private Set<FlightMode> allowedTargets() {
        return switch (this) {
            case DISARMED -> EnumSet.of(ARMED, ABORTED);
            case ARMED -> EnumSet.of(ASCEND, HOVER, CIRCLE, DESCENDING, ABORTED);
            case ASCEND -> EnumSet.of(STABILIZING, ABORTED);
            case STABILIZING -> EnumSet.of(HOVER, ABORTED);
            case HOVER -> EnumSet.of(ASCEND, HOVER, CIRCLE, DESCENDING, MISSION_COMPLETE, ABORTED);
            case CIRCLE -> EnumSet.of(HOVER, ABORTED);
            case DESCENDING -> EnumSet.of(FINAL_APPROACH, LANDED, ABORTED);
            case FINAL_APPROACH -> EnumSet.of(LANDED, ABORTED);
            case LANDED -> EnumSet.of(ASCEND, HOVER, CIRCLE, MISSION_COMPLETE, ABORTED);
            case MISSION_COMPLETE, ABORTED -> EnumSet.noneOf(FlightMode.class);
        };
    }
}
