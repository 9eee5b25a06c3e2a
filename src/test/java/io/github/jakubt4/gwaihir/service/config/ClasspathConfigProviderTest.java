package io.github.jakubt4.gwaihir.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.gwaihir.model.CommandKind;
import io.github.jakubt4.gwaihir.model.CommandSpec;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClasspathConfigProviderTest {

    private final ClasspathConfigProvider provider = new ClasspathConfigProvider(new ObjectMapper(), "missions", "drones");

    @Test
    void loadsBundledMission() {
        final var mission = provider.loadMission("basic_flight");

        assertThat(mission.id()).isEqualTo("basic_flight");
        assertThat(mission.name()).isEqualTo("Basic Flight Pattern");
        assertThat(mission.targetVehicleModel()).isEqualTo("Cetus Lite");
        assertThat(mission.safety().emergencyLandBatteryPercent()).isEqualTo(15);
        assertThat(mission.safety().maxAltitudeFeet()).isEqualTo(15.0);
        assertThat(mission.environment().indoorSafe()).isTrue();
        assertThat(mission.telemetry().updateRateHz()).isEqualTo(10);
        assertThat(mission.telemetry().realTimeDisplay()).isTrue();
        assertThat(mission.commands()).extracting(CommandSpec::kind).containsExactly(
                CommandKind.ASCEND, CommandKind.HOLD, CommandKind.CIRCULAR_PATH, CommandKind.DESCEND_AND_LAND);
        assertThat(mission.commands().get(0).parameters()).containsEntry("target_altitude_feet", 10.0);
        assertThat(mission.commands().get(0).safetyChecks()).containsExactly("battery_level", "altitude_hold");
        assertThat(mission.commands().get(2).parameters()).containsEntry("direction", "clockwise");
    }

    @Test
    void loadsBundledVehicleIgnoringUnknownSections() {
        final var vehicle = provider.loadVehicle("cetus_lite");

        assertThat(vehicle.model()).isEqualTo("Cetus Lite");
        assertThat(vehicle.manufacturer()).isEqualTo("BetaFPV");
        assertThat(vehicle.motorCount()).isEqualTo(4);
        assertThat(vehicle.hasGps()).isFalse();
    }

    @Test
    void loadsVehicleWithGps() {
        assertThat(provider.loadVehicle("skyhawk_x4").hasGps()).isTrue();
    }

    @Test
    void unknownCommandTypeFailsWhileLoading() {
        assertThatThrownBy(() -> provider.loadMission("unsupported_kind"))
                .isInstanceOf(UnsupportedCommandKindException.class)
                .hasMessageContaining("BARREL_ROLL")
                .extracting("commandId").isEqualTo(2);
    }

    @Test
    void missingSectionIsNamedInTheError() {
        assertThatThrownBy(() -> provider.loadMission("missing_safety"))
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("safety_parameters");
    }

    @Test
    void malformedJsonIsConfigInvalid() {
        assertThatThrownBy(() -> provider.loadMission("malformed"))
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("Malformed configuration missions/malformed.json");
    }

    @Test
    void missingFileIsConfigInvalid() {
        assertThatThrownBy(() -> provider.loadVehicle("does_not_exist"))
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void idsCannotEscapeTheConfigurationFolder() {
        assertThatThrownBy(() -> provider.loadMission("../application"))
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("Invalid configuration id");
    }
}
