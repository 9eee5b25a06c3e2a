package io.github.jakubt4.gwaihir.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Bookkeeping of submitted mission runs, bound from {@code gwaihir.runs.*}.
 *
 * @param retention        how long a finished run stays queryable
 * @param evictionInterval delay between two eviction sweeps
 */
@ConfigurationProperties(prefix = "gwaihir.runs")
public record RunProperties(
        @DefaultValue("1h") Duration retention,
        @DefaultValue("5m") Duration evictionInterval) {
}
