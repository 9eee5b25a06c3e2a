package io.github.jakubt4.gwaihir.service.config;

import io.github.jakubt4.gwaihir.model.MissionDefinition;
import io.github.jakubt4.gwaihir.model.VehicleProfile;

/**
 * Source of mission and vehicle definitions. The engine does not care where they come from.
 */
public interface ConfigProvider {

    /**
     * @throws ConfigInvalidException if the mission is unknown or required fields are absent
     *                                or of the wrong shape
     */
    MissionDefinition loadMission(String missionId);

    /**
     * @throws ConfigInvalidException if the vehicle is unknown or required fields are absent
     *                                or of the wrong shape
     */
    VehicleProfile loadVehicle(String vehicleId);
}
