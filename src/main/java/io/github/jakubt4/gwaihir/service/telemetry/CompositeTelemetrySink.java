package io.github.jakubt4.gwaihir.service.telemetry;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Fans a snapshot out to every registered sink. A sink that throws is logged and skipped so
 * the remaining sinks and the mission keep running.
 */
@Slf4j
public class CompositeTelemetrySink implements TelemetrySink {

    private final List<TelemetrySink> delegates;

    public CompositeTelemetrySink(final List<TelemetrySink> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void accept(final TelemetrySnapshot snapshot) {
        for (final var delegate : delegates) {
            try {
                delegate.accept(snapshot);
            } catch (final RuntimeException e) {
                log.error("Telemetry sink {} rejected snapshot at T={}s: {}",
                        delegate.getClass().getSimpleName(), snapshot.elapsedSeconds(), e.getMessage());
            }
        }
    }
}
