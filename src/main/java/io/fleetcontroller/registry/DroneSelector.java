package io.fleetcontroller.registry;

import io.fleetcontroller.enums.DroneStatus;
import io.fleetcontroller.models.Backend;
import io.fleetcontroller.models.Drone;
import io.fleetcontroller.store.FleetStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Load-based drone placement.
 * <p>
 * Eligible drones are Available, not drained and have heartbeated within the staleness window.
 * The drone with the fewest non-terminal backends wins; ties go to the lowest drone id.
 */
@Slf4j
public class DroneSelector {

    private final FleetStore fleetStore;
    private final Duration heartbeatStaleness;

    public DroneSelector(FleetStore fleetStore, Duration heartbeatStaleness) {
        this.fleetStore = fleetStore;
        this.heartbeatStaleness = heartbeatStaleness;
    }

    public Optional<Drone> select(String cluster, Instant now) throws Exception {
        List<Drone> eligible = eligibleDrones(cluster, now);
        if (eligible.isEmpty()) {
            log.warn("No eligible drone in cluster {}", cluster);
            return Optional.empty();
        }

        Map<String, Long> load = countLiveBackends(cluster);
        Optional<Drone> selected = eligible.stream()
            .min(Comparator.<Drone>comparingLong(drone -> load.getOrDefault(drone.getId(), 0L))
                .thenComparing(Drone::getId));

        selected.ifPresent(drone -> log.debug("Selected drone {} ({}) in cluster {} with {} live backends",
            drone.getName(), drone.getId(), cluster, load.getOrDefault(drone.getId(), 0L)));
        return selected;
    }

    public List<Drone> eligibleDrones(String cluster, Instant now) throws Exception {
        return fleetStore.getDrones(cluster).stream()
            .filter(drone -> drone.getStatus() == DroneStatus.AVAILABLE)
            .filter(drone -> !drone.isDrained())
            .filter(drone -> drone.isHeartbeatFresh(now, heartbeatStaleness))
            .collect(Collectors.toList());
    }

    private Map<String, Long> countLiveBackends(String cluster) throws Exception {
        Map<String, Long> load = new HashMap<>();
        for (Backend backend : fleetStore.getBackends(cluster)) {
            if (!backend.isTerminated() && backend.getDroneId() != null) {
                load.merge(backend.getDroneId(), 1L, Long::sum);
            }
        }
        return load;
    }
}
