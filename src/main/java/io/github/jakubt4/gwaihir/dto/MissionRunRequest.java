package io.github.jakubt4.gwaihir.dto;

/**
 * Request body for submitting a mission run.
 *
 * @param missionId mission document id, resolved as {@code missions/<missionId>.json}
 * @param vehicleId vehicle document id, resolved as {@code drones/<vehicleId>.json}
 */
public record MissionRunRequest(String missionId, String vehicleId) {
}
