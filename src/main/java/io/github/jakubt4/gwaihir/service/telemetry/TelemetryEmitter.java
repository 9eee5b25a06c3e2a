package io.github.jakubt4.gwaihir.service.telemetry;

import io.github.jakubt4.gwaihir.model.DroneState;
import io.github.jakubt4.gwaihir.model.MissionDefinition;
import io.github.jakubt4.gwaihir.model.MissionReport;
import io.github.jakubt4.gwaihir.model.TelemetryConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Formats the vehicle state into {@link TelemetrySnapshot}s, one per executor tick.
 *
 * <p>The emitter has no timer of its own; it produces exactly one snapshot per call to
 * {@link #emit}. Snapshots reach the sink only when real-time display is enabled, while
 * the run statistics behind {@link #report} are tracked for every tick.
 */
@Slf4j
public class TelemetryEmitter {

    private final String missionName;
    private final TelemetryConfig config;
    private final double geofenceRadiusFeet;
    private final TelemetrySink sink;

    @Getter
    private long snapshotCount;
    @Getter
    private TelemetrySnapshot lastSnapshot;

    private Vector3D lastPosition;
    private double distanceFeet;
    private double maxAltitudeFeet;

    public TelemetryEmitter(final MissionDefinition mission, final TelemetrySink sink) {
        this.missionName = mission.name();
        this.config = mission.telemetry();
        this.geofenceRadiusFeet = mission.safety().geofenceRadiusFeet();
        this.sink = sink;
    }

    public void emit(final DroneState state, final String phaseLabel) {
        final var position = state.getPosition();
        if (lastPosition != null) {
            distanceFeet += Vector3D.distance(lastPosition, position);
        }
        lastPosition = position;
        maxAltitudeFeet = Math.max(maxAltitudeFeet, position.getZ());
        snapshotCount++;

        final var snapshot = new TelemetrySnapshot(
                missionName,
                state.getCurrentCommandId(),
                phaseLabel,
                state.getElapsedSeconds(),
                position.getX(),
                position.getY(),
                position.getZ(),
                state.speed(),
                state.getBatteryPercent(),
                state.getBatteryVoltage(),
                state.getSignalStrengthPercent(),
                state.averageMotorTemperature(),
                state.getMode(),
                state.getMissionProgressPercent(),
                state.isArmed(),
                state.isFlying(),
                state.getSatelliteCount(),
                geofenceStatus(position));
        lastSnapshot = snapshot;

        if (config.loggingEnabled()) {
            log.debug("[{}] {}", missionName, snapshot.format());
        }
        if (config.realTimeDisplay()) {
            sink.accept(snapshot);
        }
    }

    public MissionReport report(final DroneState state, final int commandsCompleted) {
        return new MissionReport(state.getElapsedSeconds(), distanceFeet, maxAltitudeFeet,
                state.getBatteryPercent(), snapshotCount, commandsCompleted);
    }

    private TelemetrySnapshot.GeofenceStatus geofenceStatus(final Vector3D position) {
        if (geofenceRadiusFeet <= 0.0) {
            return TelemetrySnapshot.GeofenceStatus.INSIDE;
        }
        final var horizontal = Math.hypot(position.getX(), position.getY());
        return horizontal <= geofenceRadiusFeet
                ? TelemetrySnapshot.GeofenceStatus.INSIDE
                : TelemetrySnapshot.GeofenceStatus.OUTSIDE;
    }
}
