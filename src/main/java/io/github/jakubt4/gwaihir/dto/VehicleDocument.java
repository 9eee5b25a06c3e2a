package io.github.jakubt4.gwaihir.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * JSON shape of a vehicle file ({@code drones/<id>.json}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VehicleDocument(Drone drone) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Drone(String model, String manufacturer, String type, String category,
                        Map<String, Object> specifications, Map<String, Boolean> capabilities) {
    }
}
