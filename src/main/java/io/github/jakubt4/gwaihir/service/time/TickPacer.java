package io.github.jakubt4.gwaihir.service.time;

import java.time.Duration;

/**
 * Suspension point between two ticks of a phase loop.
 *
 * <p>Simulated mission time advances by the tick interval regardless of the pacer; the pacer
 * only decides how much wall-clock time a tick takes.
 */
@FunctionalInterface
public interface TickPacer {

    /**
     * Returns immediately. Missions run as fast as the CPU allows.
     */
    TickPacer NONE = interval -> {
    };

    void pause(Duration interval);
}
