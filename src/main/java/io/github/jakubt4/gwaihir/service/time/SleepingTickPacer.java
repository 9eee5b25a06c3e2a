package io.github.jakubt4.gwaihir.service.time;

import java.time.Duration;

/**
 * Paces ticks in real time by sleeping the mission worker thread.
 */
public class SleepingTickPacer implements TickPacer {

    @Override
    public void pause(final Duration interval) {
        try {
            Thread.sleep(interval.toMillis(), interval.toNanosPart() % 1_000_000);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Mission worker interrupted while pacing", e);
        }
    }
}
