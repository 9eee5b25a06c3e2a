package io.github.jakubt4.gwaihir.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive vehicle data. Only the motor count and the GPS capability feed the simulation.
 */
public record VehicleProfile(
        String id,
        String model,
        String manufacturer,
        String type,
        String category,
        Map<String, Object> specifications,
        Map<String, Boolean> capabilities) {

    private static final int DEFAULT_MOTOR_COUNT = 4;

    public VehicleProfile {
        specifications = specifications == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(specifications));
        capabilities = capabilities == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(capabilities));
    }

    public int motorCount() {
        final var value = specifications.get("motor_count");
        if (value instanceof Number number && number.intValue() > 0) {
            return number.intValue();
        }
        return DEFAULT_MOTOR_COUNT;
    }

    public boolean hasGps() {
        return Boolean.TRUE.equals(capabilities.get("gps"));
    }
}
