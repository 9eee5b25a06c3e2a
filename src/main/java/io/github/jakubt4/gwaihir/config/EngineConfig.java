package io.github.jakubt4.gwaihir.config;

import io.github.jakubt4.gwaihir.service.time.SleepingTickPacer;
import io.github.jakubt4.gwaihir.service.time.TickPacer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    TickPacer tickPacer(final EngineProperties properties) {
        if (properties.realTimePacing()) {
            log.info("Real-time pacing enabled — ticks follow the mission update rate");
            return new SleepingTickPacer();
        }
        log.info("Real-time pacing disabled — missions run unpaced");
        return TickPacer.NONE;
    }

    /**
     * Single worker: one mission flies at a time, runs queue in submission order.
     */
    @Bean(destroyMethod = "shutdownNow")
    ExecutorService missionExecutor() {
        final var counter = new AtomicInteger();
        return Executors.newSingleThreadExecutor(runnable -> {
            final var thread = new Thread(runnable, "mission-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(prefix = "gwaihir.runs.scheduling", name = "enabled", matchIfMissing = true)
    static class SchedulingConfig {
    }
}
