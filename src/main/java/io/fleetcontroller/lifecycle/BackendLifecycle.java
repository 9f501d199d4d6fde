package io.fleetcontroller.lifecycle;

import io.fleetcontroller.bus.DroneBus;
import io.fleetcontroller.enums.BackendStatus;
import io.fleetcontroller.enums.DroneCommandType;
import io.fleetcontroller.events.FleetEvents;
import io.fleetcontroller.metrics.MetricsProvider;
import io.fleetcontroller.models.Backend;
import io.fleetcontroller.models.Drone;
import io.fleetcontroller.models.DroneCommand;
import io.fleetcontroller.models.FleetEvent;
import io.fleetcontroller.models.KeyLock;
import io.fleetcontroller.store.FleetStore;
import io.fleetcontroller.store.KeyRelease;
import io.fleetcontroller.store.Versioned;
import io.fleetcontroller.util.IdGenerator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

import static io.fleetcontroller.config.Constants.MAX_CAS_ATTEMPTS;
import static io.fleetcontroller.metrics.MetricsConstants.BACKEND_STATUS_APPLIED_METRIC_NAME;
import static io.fleetcontroller.metrics.MetricsConstants.STATUS_TAG;

/**
 * Backend lifecycle state machine.
 * <p>
 * A status is applied only when it ranks strictly above the stored one, so duplicate, late and
 * reordered reports are no-ops. Reaching Terminated releases the backend's key lock in the same
 * transaction, provided the lock still points at this backend.
 */
@Slf4j
public class BackendLifecycle {

    private final FleetStore fleetStore;
    private final DroneBus droneBus;
    private final MetricsProvider metricsProvider;
    private final Clock clock;

    public BackendLifecycle(FleetStore fleetStore, DroneBus droneBus, MetricsProvider metricsProvider, Clock clock) {
        this.fleetStore = fleetStore;
        this.droneBus = droneBus;
        this.metricsProvider = metricsProvider;
        this.clock = clock;
    }

    /**
     * Apply a reported status with the monotonic rule.
     *
     * @throws NoSuchElementException          if the backend does not exist
     * @throws ConcurrentModificationException if the compare-and-set kept losing
     */
    public StatusUpdate applyStatus(String cluster, String backendId, BackendStatus status) throws Exception {
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Versioned<Backend> current = requireBackend(cluster, backendId);
            Backend backend = current.getValue();
            BackendStatus previous = backend.getStatus();

            if (!status.isAfter(previous)) {
                log.debug("Ignoring status {} for backend {} (current {})", status, backendId, previous);
                return new StatusUpdate(backend, previous, false);
            }

            Instant now = clock.instant();
            Backend updated = backend.toBuilder()
                .status(status)
                .statusTime(now)
                .build();

            List<FleetEvent> events = new ArrayList<>();
            events.add(FleetEvents.backendStatus(updated, status, now));
            KeyRelease release = null;
            if (status.isTerminal()) {
                release = lockReleaseFor(backend);
                if (release != null) {
                    events.add(FleetEvents.keyReleased(cluster, backend.getKey(), backendId, now));
                }
            }

            if (fleetStore.compareAndPutBackend(updated, current.getRevision(), release, events)) {
                log.info("Backend {} in cluster {}: {} -> {}{}", backendId, cluster, previous, status,
                    release != null ? " (released key " + backend.getKey() + ")" : "");
                metricsProvider.counter(BACKEND_STATUS_APPLIED_METRIC_NAME, Map.of(STATUS_TAG, status.getValue()))
                    .increment();
                return new StatusUpdate(updated, previous, true);
            }
            log.debug("Concurrent update of backend {} on attempt {}, retrying", backendId, attempt);
        }
        throw new ConcurrentModificationException(
            "Backend " + backendId + " kept changing while applying status " + status);
    }

    /**
     * Request a soft or hard terminate. The status moves to Terminating or HardTerminating and the
     * terminate command is sent to the owning drone unless the backend is already Terminated or
     * a stronger terminate was requested before.
     *
     * @return the resulting status update
     */
    public StatusUpdate terminate(String cluster, String backendId, boolean hard) throws Exception {
        BackendStatus target = hard ? BackendStatus.HARD_TERMINATING : BackendStatus.TERMINATING;
        StatusUpdate update = applyStatus(cluster, backendId, target);
        Backend backend = update.getBackend();

        if (backend.isTerminated() || backend.getStatus().isAfter(target)) {
            log.info("Backend {} already {}, not sending terminate", backendId, backend.getStatus());
            return update;
        }

        Instant now = clock.instant();
        DroneCommand command = DroneCommand.builder()
            .id(IdGenerator.timeOrderedId(now))
            .type(DroneCommandType.TERMINATE)
            .cluster(cluster)
            .droneName(backend.getDroneName())
            .droneId(backend.getDroneId())
            .backendId(backendId)
            .hard(hard)
            .issuedAt(now)
            .build();
        droneBus.sendCommand(command);
        return update;
    }

    /**
     * Operator override for orphaned backends: mark Terminated directly and release the key.
     *
     * @throws IllegalStateException if the owning drone is still alive
     */
    public StatusUpdate forceTerminate(String cluster, String backendId) throws Exception {
        Backend backend = requireBackend(cluster, backendId).getValue();
        if (backend.isTerminated()) {
            return new StatusUpdate(backend, backend.getStatus(), false);
        }

        Optional<Drone> drone = fleetStore.getDrone(cluster, backend.getDroneName()).map(Versioned::getValue);
        boolean ownerAlive = drone.isPresent()
            && drone.get().getId().equals(backend.getDroneId())
            && !drone.get().isTerminated();
        if (ownerAlive) {
            throw new IllegalStateException("Backend " + backendId + " is owned by live drone "
                + backend.getDroneName() + "; use soft or hard terminate");
        }

        log.warn("Force terminating orphaned backend {} (drone {} is gone)", backendId, backend.getDroneName());
        return applyStatus(cluster, backendId, BackendStatus.TERMINATED);
    }

    /**
     * Refresh the last keepalive. Never moves backwards and is ignored once Terminated.
     *
     * @return true if the stored keepalive changed
     */
    public boolean recordKeepalive(String cluster, String backendId, Instant timestamp) throws Exception {
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Versioned<Backend> current = requireBackend(cluster, backendId);
            Backend backend = current.getValue();
            if (backend.isTerminated()) {
                log.debug("Ignoring keepalive for terminated backend {}", backendId);
                return false;
            }
            if (backend.getLastKeepalive() != null && !timestamp.isAfter(backend.getLastKeepalive())) {
                return false;
            }

            Backend updated = backend.toBuilder().lastKeepalive(timestamp).build();
            if (fleetStore.compareAndPutBackend(updated, current.getRevision(), null, List.of())) {
                return true;
            }
        }
        throw new ConcurrentModificationException("Backend " + backendId + " kept changing while recording keepalive");
    }

    public Backend getBackend(String cluster, String backendId) throws Exception {
        return requireBackend(cluster, backendId).getValue();
    }

    private Versioned<Backend> requireBackend(String cluster, String backendId) throws Exception {
        return fleetStore.getBackend(cluster, backendId)
            .orElseThrow(() -> new NoSuchElementException("Backend " + backendId + " not found in cluster " + cluster));
    }

    /**
     * Release of the backend's key lock, or null if it holds none (any more).
     */
    private KeyRelease lockReleaseFor(Backend backend) throws Exception {
        if (backend.getKey() == null) {
            return null;
        }
        Optional<Versioned<KeyLock>> lock = fleetStore.getKeyLock(backend.getCluster(), backend.getKey());
        if (lock.isEmpty() || !backend.getId().equals(lock.get().getValue().getBackendId())) {
            return null;
        }
        return new KeyRelease(backend.getCluster(), backend.getKey(), lock.get().getRevision());
    }
}
