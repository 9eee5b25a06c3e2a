package io.github.jakubt4.gwaihir.client;

import io.github.jakubt4.gwaihir.config.GroundStationProperties;
import io.github.jakubt4.gwaihir.service.telemetry.TelemetrySink;
import io.github.jakubt4.gwaihir.service.telemetry.TelemetrySnapshot;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streams telemetry snapshots to the ground station without blocking the mission worker.
 *
 * <p>{@link #accept} only enqueues. A single uplink thread drains the bounded queue in order
 * and hands each snapshot to {@link GroundStationPublisher}. When the queue is full the newest
 * snapshot is dropped.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "gwaihir.telemetry.ground-station", name = "enabled", havingValue = "true")
public class GroundStationTelemetryClient implements TelemetrySink {

    private static final long DROP_LOG_EVERY = 100;

    private final GroundStationPublisher publisher;
    private final ThreadPoolExecutor uplink;
    private final AtomicLong dropped = new AtomicLong();

    public GroundStationTelemetryClient(final GroundStationPublisher publisher,
                                        final GroundStationProperties properties) {
        this.publisher = publisher;
        this.uplink = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(properties.queueCapacity()),
                runnable -> {
                    final var thread = new Thread(runnable, "ground-station-uplink");
                    thread.setDaemon(true);
                    return thread;
                },
                (task, executor) -> onDropped());
        log.info("Ground station telemetry enabled — {}{} | queue capacity {}",
                properties.baseUrl(), properties.path(), properties.queueCapacity());
    }

    @Override
    public void accept(final TelemetrySnapshot snapshot) {
        uplink.execute(() -> publisher.publish(snapshot));
    }

    public long droppedSnapshots() {
        return dropped.get();
    }

    @PreDestroy
    void stop() {
        uplink.shutdownNow();
        try {
            uplink.awaitTermination(5, TimeUnit.SECONDS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void onDropped() {
        final var count = dropped.incrementAndGet();
        if (count == 1 || count % DROP_LOG_EVERY == 0) {
            log.warn("Ground station uplink queue full — {} snapshots dropped so far", count);
        }
    }
}
