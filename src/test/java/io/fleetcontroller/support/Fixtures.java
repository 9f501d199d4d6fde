package io.fleetcontroller.support;

import io.fleetcontroller.config.FleetControllerConfig;
import io.fleetcontroller.enums.BackendStatus;
import io.fleetcontroller.enums.DroneStatus;
import io.fleetcontroller.metrics.MetricsProvider;
import io.fleetcontroller.models.Backend;
import io.fleetcontroller.models.Drone;
import io.fleetcontroller.models.ExecutorConfig;
import io.fleetcontroller.models.SpawnConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Instant;
import java.util.Map;

import static io.fleetcontroller.config.Constants.ADMIN_STATE_NORMAL;

/**
 * Shared builders for tests.
 */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private Fixtures() {
    }

    public static Drone availableDrone(String cluster, String name, String id, Instant lastHeartbeat) {
        return Drone.builder()
            .id(id)
            .cluster(cluster)
            .name(name)
            .controller("controller-test")
            .version("1.0.0")
            .status(DroneStatus.AVAILABLE)
            .adminState(ADMIN_STATE_NORMAL)
            .lastHeartbeat(lastHeartbeat)
            .statusTime(lastHeartbeat)
            .registeredAt(lastHeartbeat)
            .build();
    }

    /**
     * Backend created at {@link #T0} on the given drone, with no lifetime or idle budget.
     */
    public static Backend backend(String cluster, String id, String droneName, String droneId, BackendStatus status) {
        return Backend.builder()
            .id(id)
            .cluster(cluster)
            .droneName(droneName)
            .droneId(droneId)
            .status(status)
            .statusTime(T0)
            .lastKeepalive(T0)
            .spawnConfig(spawnConfig("img"))
            .createdAt(T0)
            .build();
    }

    public static SpawnConfig spawnConfig(String image) {
        return SpawnConfig.builder()
            .executable(ExecutorConfig.builder().image(image).env(Map.of("MODE", "test")).build())
            .build();
    }

    public static SpawnConfig spawnConfig(String image, Long lifetimeLimitSeconds, Long maxIdleSeconds) {
        return SpawnConfig.builder()
            .executable(ExecutorConfig.builder().image(image).build())
            .lifetimeLimitSeconds(lifetimeLimitSeconds)
            .maxIdleSeconds(maxIdleSeconds)
            .build();
    }

    public static FleetControllerConfig.FleetControllerConfigBuilder config() {
        return FleetControllerConfig.defaults().controllerId("controller-test");
    }

    public static MetricsProvider metricsProvider() {
        return new MetricsProvider(new SimpleMeterRegistry(), "controller-test");
    }
}
