package io.github.jakubt4.gwaihir.service.telemetry;

import io.github.jakubt4.gwaihir.RecordingTelemetrySink;
import io.github.jakubt4.gwaihir.model.FlightMode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class CompositeTelemetrySinkTest {

    private static final TelemetrySnapshot SNAPSHOT = new TelemetrySnapshot("Test Mission", 1, "HOVER", 1.0,
            0.0, 0.0, 5.0, 0.0, 90, 4.08, 100, 30.0, FlightMode.HOVER, 25, true, true, 0,
            TelemetrySnapshot.GeofenceStatus.INSIDE);

    @Test
    void deliversToEverySinkInOrder() {
        final var first = new RecordingTelemetrySink();
        final var second = new RecordingTelemetrySink();

        new CompositeTelemetrySink(List.of(first, second)).accept(SNAPSHOT);

        assertThat(first.snapshots()).containsExactly(SNAPSHOT);
        assertThat(second.snapshots()).containsExactly(SNAPSHOT);
    }

    @Test
    void failingSinkDoesNotStarveTheOthers() {
        final TelemetrySink broken = snapshot -> {
            throw new IllegalStateException("display disconnected");
        };
        final var recorder = new RecordingTelemetrySink();
        final var composite = new CompositeTelemetrySink(List.of(broken, recorder));

        assertThatCode(() -> composite.accept(SNAPSHOT)).doesNotThrowAnyException();
        assertThat(recorder.snapshots()).containsExactly(SNAPSHOT);
    }
}
