package io.github.jakubt4.gwaihir;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Gwaihir — declarative mission execution engine for simulated multirotor vehicles.
 *
 * <p>Loads a mission and a vehicle profile from JSON, runs the mission's commands through
 * the phase executors on a simulated vehicle, evaluates safety checks on every tick and
 * streams telemetry snapshots to the registered sinks.
 *
 * @see io.github.jakubt4.gwaihir.service.MissionController
 * @see io.github.jakubt4.gwaihir.service.MissionRunService
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class GwaihirApplication {

    public static void main(String[] args) {
        SpringApplication.run(GwaihirApplication.class, args);
    }
}
