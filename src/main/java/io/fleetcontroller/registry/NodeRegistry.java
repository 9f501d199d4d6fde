package io.fleetcontroller.registry;

import io.fleetcontroller.enums.DroneStatus;
import io.fleetcontroller.events.FleetEvents;
import io.fleetcontroller.metrics.MetricsProvider;
import io.fleetcontroller.models.Backend;
import io.fleetcontroller.models.Drone;
import io.fleetcontroller.models.FleetEvent;
import io.fleetcontroller.store.FleetStore;
import io.fleetcontroller.store.Versioned;
import io.fleetcontroller.util.IdGenerator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Collectors;

import static io.fleetcontroller.config.Constants.ADMIN_STATE_DRAIN;
import static io.fleetcontroller.config.Constants.ADMIN_STATE_NORMAL;
import static io.fleetcontroller.config.Constants.MAX_CAS_ATTEMPTS;
import static io.fleetcontroller.metrics.MetricsConstants.*;

/**
 * Tracks drones per cluster: registration, heartbeats, drain and fail-stop termination.
 * <p>
 * A Terminated drone never comes back. If the same name registers again it gets a new
 * incarnation id, and the backends of the old incarnation stay orphaned until an operator
 * force-terminates them.
 */
@Slf4j
public class NodeRegistry {

    private final FleetStore fleetStore;
    private final String controllerId;
    private final Duration terminateAfter;
    private final MetricsProvider metricsProvider;
    private final Clock clock;

    public NodeRegistry(FleetStore fleetStore, String controllerId, Duration terminateAfter,
                        MetricsProvider metricsProvider, Clock clock) {
        this.fleetStore = fleetStore;
        this.controllerId = controllerId;
        this.terminateAfter = terminateAfter;
        this.metricsProvider = metricsProvider;
        this.clock = clock;
    }

    /**
     * Register a drone process. A live registration is refreshed in place; an absent or
     * Terminated one starts a new incarnation in Starting.
     */
    public Drone register(String cluster, String name, String version, String hash) throws Exception {
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Optional<Versioned<Drone>> current = fleetStore.getDrone(cluster, name);
            Instant now = clock.instant();

            if (current.isPresent() && !current.get().getValue().isTerminated()) {
                Drone refreshed = current.get().getValue().toBuilder()
                    .version(version)
                    .hash(hash)
                    .controller(controllerId)
                    .lastHeartbeat(now)
                    .build();
                if (fleetStore.compareAndPutDrone(refreshed, current.get().getRevision(), List.of())) {
                    log.info("Drone {}/{} re-registered ({}), keeping incarnation {}", cluster, name, version,
                        refreshed.getId());
                    return refreshed;
                }
                continue;
            }

            Drone drone = Drone.builder()
                .id(IdGenerator.droneId())
                .cluster(cluster)
                .name(name)
                .controller(controllerId)
                .version(version)
                .hash(hash)
                .status(DroneStatus.STARTING)
                .adminState(ADMIN_STATE_NORMAL)
                .lastHeartbeat(now)
                .statusTime(now)
                .registeredAt(now)
                .build();
            long expectedRevision = current.map(Versioned::getRevision).orElse(0L);
            if (fleetStore.compareAndPutDrone(drone, expectedRevision, List.of(FleetEvents.droneRegistered(drone, now)))) {
                log.info("Drone {}/{} registered as {} (version {})", cluster, name, drone.getId(), version);
                return drone;
            }
        }
        throw new ConcurrentModificationException("Drone " + cluster + "/" + name + " kept changing during registration");
    }

    /**
     * Record a heartbeat. The first heartbeat promotes Starting to Available. An unknown drone
     * is registered implicitly; a Terminated one is ignored.
     *
     * @return the stored drone, or empty if the heartbeat was ignored
     */
    public Optional<Drone> heartbeat(String cluster, String name) throws Exception {
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Optional<Versioned<Drone>> current = fleetStore.getDrone(cluster, name);
            if (current.isEmpty()) {
                log.info("Heartbeat from unknown drone {}/{}, registering it", cluster, name);
                register(cluster, name, null, null);
                continue;
            }

            Drone drone = current.get().getValue();
            if (drone.isTerminated()) {
                log.warn("Ignoring heartbeat from terminated drone {}/{} ({})", cluster, name, drone.getId());
                return Optional.empty();
            }

            Instant now = clock.instant();
            Drone.DroneBuilder updated = drone.toBuilder().lastHeartbeat(now);
            List<FleetEvent> events = new ArrayList<>();
            if (drone.getStatus() == DroneStatus.STARTING) {
                updated.status(DroneStatus.AVAILABLE).statusTime(now);
            }
            Drone result = updated.build();
            if (result.getStatus() != drone.getStatus()) {
                events.add(FleetEvents.droneStatus(result, DroneStatus.AVAILABLE, now));
            }

            if (fleetStore.compareAndPutDrone(result, current.get().getRevision(), events)) {
                if (!events.isEmpty()) {
                    log.info("Drone {}/{} is now Available", cluster, name);
                } else {
                    log.debug("Heartbeat from drone {}/{}", cluster, name);
                }
                return Optional.of(result);
            }
        }
        throw new ConcurrentModificationException("Drone " + cluster + "/" + name + " kept changing during heartbeat");
    }

    /**
     * Explicit shutdown reported by the drone.
     *
     * @return false if the drone was unknown or already Terminated
     */
    public boolean shutdown(String cluster, String name) throws Exception {
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Optional<Versioned<Drone>> current = fleetStore.getDrone(cluster, name);
            if (current.isEmpty() || current.get().getValue().isTerminated()) {
                return false;
            }
            if (markTerminated(current.get(), "shutdown")) {
                return true;
            }
        }
        throw new ConcurrentModificationException("Drone " + cluster + "/" + name + " kept changing during shutdown");
    }

    /**
     * Remove a drone from the placement pool. Its running backends are left alone.
     *
     * @throws NoSuchElementException if the drone is unknown
     */
    public Drone drain(String cluster, String name) throws Exception {
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Versioned<Drone> current = fleetStore.getDrone(cluster, name)
                .orElseThrow(() -> new NoSuchElementException("Drone " + name + " not found in cluster " + cluster));
            Drone drone = current.getValue();
            if (drone.isDrained()) {
                log.info("Drone {}/{} is already drained", cluster, name);
                return drone;
            }

            Instant now = clock.instant();
            Drone drained = drone.toBuilder().adminState(ADMIN_STATE_DRAIN).build();
            if (fleetStore.compareAndPutDrone(drained, current.getRevision(),
                    List.of(FleetEvents.droneDrained(drained, now)))) {
                log.info("Drained drone {}/{} ({})", cluster, name, drone.getId());
                return drained;
            }
        }
        throw new ConcurrentModificationException("Drone " + cluster + "/" + name + " kept changing during drain");
    }

    /**
     * Terminate every drone whose last heartbeat is older than the terminate-after window.
     * Failures are logged per drone and the sweep continues.
     *
     * @return number of drones terminated
     */
    public int sweepStaleDrones(Instant now) {
        int terminated = 0;
        try {
            for (Drone drone : fleetStore.getAllDrones()) {
                if (drone.isTerminated()) {
                    continue;
                }
                if (drone.getLastHeartbeat() != null && !drone.getLastHeartbeat().isBefore(now.minus(terminateAfter))) {
                    continue;
                }
                try {
                    Optional<Versioned<Drone>> current = fleetStore.getDrone(drone.getCluster(), drone.getName());
                    if (current.isPresent() && current.get().getValue().getId().equals(drone.getId())
                            && markTerminated(current.get(), "heartbeat silent since " + drone.getLastHeartbeat())) {
                        terminated++;
                    }
                } catch (Exception e) {
                    log.error("Failed to terminate stale drone {}/{}: {}", drone.getCluster(), drone.getName(),
                        e.getMessage(), e);
                }
            }
        } catch (Exception e) {
            log.error("Failed to sweep stale drones: {}", e.getMessage(), e);
        }

        if (terminated > 0) {
            log.info("Drone sweep terminated {} stale drones", terminated);
        }
        return terminated;
    }

    /**
     * Non-terminal backends whose drone incarnation is gone or Terminated.
     *
     * @param cluster null for all clusters
     */
    public List<Backend> findOrphanedBackends(String cluster) throws Exception {
        List<Drone> drones = cluster == null ? fleetStore.getAllDrones() : fleetStore.getDrones(cluster);
        List<Backend> backends = cluster == null ? fleetStore.getAllBackends() : fleetStore.getBackends(cluster);

        Map<String, Drone> dronesById = new HashMap<>();
        for (Drone drone : drones) {
            dronesById.put(drone.getId(), drone);
        }

        List<Backend> orphans = backends.stream()
            .filter(backend -> !backend.isTerminated())
            .filter(backend -> {
                Drone owner = dronesById.get(backend.getDroneId());
                return owner == null || owner.isTerminated();
            })
            .collect(Collectors.toList());

        metricsProvider.gauge(ORPHANED_BACKENDS_METRIC_NAME, Map.of(CLUSTER_TAG, cluster == null ? "all" : cluster))
            .set(orphans.size());
        return orphans;
    }

    /**
     * @param cluster null for all clusters
     * @param all     include Terminated drones
     */
    public List<Drone> listDrones(String cluster, boolean all) throws Exception {
        List<Drone> drones = cluster == null ? fleetStore.getAllDrones() : fleetStore.getDrones(cluster);
        if (all) {
            return drones;
        }
        return drones.stream().filter(drone -> !drone.isTerminated()).collect(Collectors.toList());
    }

    public Drone getDrone(String cluster, String name) throws Exception {
        return fleetStore.getDrone(cluster, name)
            .map(Versioned::getValue)
            .orElseThrow(() -> new NoSuchElementException("Drone " + name + " not found in cluster " + cluster));
    }

    private boolean markTerminated(Versioned<Drone> current, String reason) throws Exception {
        Instant now = clock.instant();
        Drone drone = current.getValue();
        Drone terminated = drone.toBuilder()
            .status(DroneStatus.TERMINATED)
            .statusTime(now)
            .build();
        if (!fleetStore.compareAndPutDrone(terminated, current.getRevision(),
                List.of(FleetEvents.droneStatus(terminated, DroneStatus.TERMINATED, now)))) {
            return false;
        }

        log.info("Drone {}/{} ({}) terminated: {}", drone.getCluster(), drone.getName(), drone.getId(), reason);
        metricsProvider.counter(DRONES_TERMINATED_METRIC_NAME, Map.of(CLUSTER_TAG, drone.getCluster())).increment();

        List<Backend> orphans = fleetStore.getBackends(drone.getCluster()).stream()
            .filter(backend -> !backend.isTerminated() && drone.getId().equals(backend.getDroneId()))
            .collect(Collectors.toList());
        for (Backend orphan : orphans) {
            log.warn("Backend {} ({}) is orphaned by terminated drone {}/{}", orphan.getId(), orphan.getStatus(),
                drone.getCluster(), drone.getName());
        }
        return true;
    }
}
