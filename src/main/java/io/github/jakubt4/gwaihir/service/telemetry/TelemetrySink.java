package io.github.jakubt4.gwaihir.service.telemetry;

/**
 * Consumer of telemetry snapshots (console, log file, network publisher).
 *
 * <p>Snapshots arrive in non-decreasing elapsed-time order, at most one per tick.
 */
public interface TelemetrySink {

    void accept(TelemetrySnapshot snapshot);
}
