package io.github.jakubt4.gwaihir.service.telemetry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Console display of live telemetry.
 */
@Slf4j
@Component
public class LoggingTelemetrySink implements TelemetrySink {

    @Override
    public void accept(final TelemetrySnapshot snapshot) {
        log.info("[{}] {}", snapshot.mission(), snapshot.format());
    }
}
