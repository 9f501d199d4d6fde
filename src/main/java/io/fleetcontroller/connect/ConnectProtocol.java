package io.fleetcontroller.connect;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.fleetcontroller.bus.DroneBus;
import io.fleetcontroller.config.FleetControllerConfig;
import io.fleetcontroller.enums.BackendStatus;
import io.fleetcontroller.enums.DroneCommandType;
import io.fleetcontroller.events.FleetEvents;
import io.fleetcontroller.metrics.MetricsProvider;
import io.fleetcontroller.models.Backend;
import io.fleetcontroller.models.Drone;
import io.fleetcontroller.models.DroneCommand;
import io.fleetcontroller.models.KeyConfig;
import io.fleetcontroller.models.KeyLock;
import io.fleetcontroller.models.SpawnConfig;
import io.fleetcontroller.registry.DroneSelector;
import io.fleetcontroller.store.FleetStore;
import io.fleetcontroller.store.KeyRelease;
import io.fleetcontroller.store.Versioned;
import io.fleetcontroller.util.IdGenerator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static io.fleetcontroller.metrics.MetricsConstants.*;

/**
 * Atomic decision procedure run on every client connect.
 * <p>
 * The lock row for (cluster, key) and the new backend row are written in one store transaction
 * guarded by the lock revision observed when the decision was made. Nothing is written before
 * placement succeeds, so a failed placement leaves neither a lock nor a backend behind.
 * A lost transaction is re-evaluated once against the winner's lock: identical requests resolve
 * to the winner's backend, anything else surfaces as {@link ConnectError#FAILED_TO_ACQUIRE_KEY}.
 */
@Slf4j
public class ConnectProtocol {

    private static final int GENERATED_TAG_LENGTH = 12;

    private final FleetStore fleetStore;
    private final DroneSelector droneSelector;
    private final DroneBus droneBus;
    private final FleetControllerConfig config;
    private final MetricsProvider metricsProvider;
    private final Clock clock;

    public ConnectProtocol(FleetStore fleetStore,
                           DroneSelector droneSelector,
                           DroneBus droneBus,
                           FleetControllerConfig config,
                           MetricsProvider metricsProvider,
                           Clock clock) {
        this.fleetStore = fleetStore;
        this.droneSelector = droneSelector;
        this.droneBus = droneBus;
        this.config = config;
        this.metricsProvider = metricsProvider;
        this.clock = clock;
    }

    /**
     * Route the caller to the live backend bound to {@code key}, or schedule a new one.
     *
     * @param requestedCluster explicit cluster, or null for the configured default
     * @param key              optional idempotency key
     * @param spawnConfig      required whenever a new backend has to be created
     */
    public ConnectResult connect(String requestedCluster, KeyConfig key, SpawnConfig spawnConfig)
            throws ConnectException {
        long startNanos = System.nanoTime();
        String outcome = null;
        try {
            ConnectResult result = doConnect(requestedCluster, normalize(key), spawnConfig);
            outcome = result.isSpawned() ? OUTCOME_SPAWNED : OUTCOME_EXISTING;
            return result;
        } catch (ConnectException e) {
            outcome = e.getError().name().toLowerCase();
            throw e;
        } finally {
            metricsProvider.counter(CONNECT_REQUESTS_METRIC_NAME, Map.of(OUTCOME_TAG, outcome != null ? outcome : "unknown"))
                .increment();
            metricsProvider.timer(CONNECT_LATENCY_METRIC_NAME, Map.of())
                .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
    }

    /**
     * Remove the lock row of (cluster, key) regardless of the state of its holder.
     *
     * @return false when the key was not held
     */
    public boolean releaseKey(String cluster, String key) throws ConnectException {
        try {
            Optional<Versioned<KeyLock>> lock = fleetStore.getKeyLock(cluster, key);
            if (lock.isEmpty()) {
                log.info("Key {} in cluster {} is not held, nothing to release", key, cluster);
                return false;
            }
            KeyLock current = lock.get().getValue();
            KeyRelease release = new KeyRelease(cluster, key, lock.get().getRevision());
            boolean released = fleetStore.deleteKeyLock(release,
                List.of(FleetEvents.keyReleased(cluster, key, current.getBackendId(), clock.instant())));
            if (!released) {
                log.warn("Key {} in cluster {} changed while releasing it", key, cluster);
                throw new ConnectException(ConnectError.FAILED_TO_REMOVE_KEY);
            }
            log.info("Released key {} in cluster {} (was held by backend {})", key, cluster, current.getBackendId());
            return true;
        } catch (ConnectException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to release key {} in cluster {}", key, cluster, e);
            throw new ConnectException(ConnectError.FAILED_TO_REMOVE_KEY, e);
        }
    }

    public String resolveCluster(String requestedCluster) throws ConnectException {
        if (requestedCluster != null && !requestedCluster.isBlank()) {
            return requestedCluster.trim();
        }
        return config.getDefaultCluster()
            .orElseThrow(() -> new ConnectException(ConnectError.NO_CLUSTER_PROVIDED));
    }

    public String connectionUrl(String cluster, String backendId) {
        return String.format("%s://%s.%s/", config.getUrlScheme(), backendId, cluster);
    }

    private ConnectResult doConnect(String requestedCluster, KeyConfig key, SpawnConfig spawnConfig)
            throws ConnectException {
        String cluster = resolveCluster(requestedCluster);
        if (key == null && spawnConfig == null) {
            throw new ConnectException(ConnectError.KEY_UNHELD_NO_SPAWN_CONFIG);
        }

        try {
            Optional<ConnectResult> result = tryConnect(cluster, key, spawnConfig);
            if (result.isPresent()) {
                return result.get();
            }

            log.info("Lost the race for key {} in cluster {}, re-evaluating", key != null ? key.getName() : null, cluster);
            if (key != null) {
                Optional<ConnectResult> winner = findLiveHolder(cluster, key);
                if (winner.isPresent()) {
                    return winner.get();
                }
            }
            throw new ConnectException(ConnectError.FAILED_TO_ACQUIRE_KEY);
        } catch (ConnectException e) {
            throw e;
        } catch (JsonProcessingException e) {
            log.error("Serialization failure during connect in cluster {}", cluster, e);
            throw new ConnectException(ConnectError.SERIALIZATION, e);
        } catch (Exception e) {
            log.error("Store failure during connect in cluster {}", cluster, e);
            throw new ConnectException(ConnectError.DATABASE_ERROR, e);
        }
    }

    /**
     * One pass of the decision procedure.
     *
     * @return empty when the store transaction lost a compare-and-set
     */
    private Optional<ConnectResult> tryConnect(String cluster, KeyConfig key, SpawnConfig spawnConfig)
            throws Exception {
        long lockRevision = 0;
        if (key != null) {
            Optional<Versioned<KeyLock>> lock = fleetStore.getKeyLock(cluster, key.getName());
            if (lock.isPresent()) {
                lockRevision = lock.get().getRevision();
                Optional<Backend> holder = liveBackend(cluster, lock.get().getValue());
                if (holder.isPresent()) {
                    return Optional.of(resolveHeldKey(cluster, key, lock.get().getValue(), holder.get()));
                }
                log.debug("Key {} in cluster {} is bound to terminated backend {}, treating as unheld",
                    key.getName(), cluster, lock.get().getValue().getBackendId());
            }
            if (spawnConfig == null) {
                throw new ConnectException(ConnectError.KEY_UNHELD_NO_SPAWN_CONFIG);
            }
        }

        Instant now = clock.instant();
        Drone drone = droneSelector.select(cluster, now)
            .orElseThrow(() -> new ConnectException(ConnectError.NO_DRONE_AVAILABLE));

        Backend backend = newBackend(cluster, drone, key, spawnConfig, now);
        KeyLock newLock = key == null ? null : KeyLock.builder()
            .cluster(cluster)
            .key(key.getName())
            .backendId(backend.getId())
            .tag(backend.getTag())
            .acquiredAt(now)
            .build();

        boolean created = fleetStore.createBackend(backend, newLock, lockRevision,
            List.of(FleetEvents.backendCreated(backend, now)));
        if (!created) {
            return Optional.empty();
        }

        log.info("Created backend {} on drone {} in cluster {}{}", backend.getId(), drone.getName(), cluster,
            key != null ? " for key " + key.getName() : "");
        dispatchSpawn(backend, drone, now);
        return Optional.of(toResult(backend, true));
    }

    private Optional<ConnectResult> findLiveHolder(String cluster, KeyConfig key) throws Exception {
        Optional<Versioned<KeyLock>> lock = fleetStore.getKeyLock(cluster, key.getName());
        if (lock.isEmpty()) {
            return Optional.empty();
        }
        Optional<Backend> holder = liveBackend(cluster, lock.get().getValue());
        if (holder.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(resolveHeldKey(cluster, key, lock.get().getValue(), holder.get()));
    }

    /**
     * The backend bound by a lock row, unless it is gone or already Terminated.
     */
    private Optional<Backend> liveBackend(String cluster, KeyLock lock) throws Exception {
        return fleetStore.getBackend(cluster, lock.getBackendId())
            .map(Versioned::getValue)
            .filter(backend -> !backend.isTerminated());
    }

    private ConnectResult resolveHeldKey(String cluster, KeyConfig key, KeyLock lock, Backend holder)
            throws Exception {
        if (!isHealthy(cluster, holder)) {
            log.warn("Key {} in cluster {} is held by unhealthy backend {} (status {})", key.getName(), cluster,
                holder.getId(), holder.getStatus());
            throw new ConnectException(ConnectError.KEY_HELD_UNHEALTHY);
        }
        if (key.getTag() != null && !key.getTag().equals(lock.getTag())) {
            log.info("Key {} in cluster {} is held by backend {} with a different tag", key.getName(), cluster,
                holder.getId());
            throw ConnectException.keyHeld(lock.getTag());
        }
        log.debug("Key {} in cluster {} resolved to existing backend {}", key.getName(), cluster, holder.getId());
        return toResult(holder, false);
    }

    /**
     * A holder is unhealthy once a terminate was requested, or when the drone incarnation it was
     * placed on is gone or Terminated.
     */
    private boolean isHealthy(String cluster, Backend holder) throws Exception {
        if (holder.getStatus().isTerminating()) {
            return false;
        }
        return fleetStore.getDrone(cluster, holder.getDroneName())
            .map(Versioned::getValue)
            .filter(drone -> drone.getId().equals(holder.getDroneId()))
            .filter(drone -> !drone.isTerminated())
            .isPresent();
    }

    private Backend newBackend(String cluster, Drone drone, KeyConfig key, SpawnConfig spawnConfig, Instant now) {
        String tag = null;
        if (key != null) {
            tag = key.getTag() != null ? key.getTag() : IdGenerator.randomString(GENERATED_TAG_LENGTH);
        }
        return Backend.builder()
            .id(IdGenerator.backendId())
            .cluster(cluster)
            .droneId(drone.getId())
            .droneName(drone.getName())
            .status(BackendStatus.SCHEDULED)
            .statusTime(now)
            .lastKeepalive(now)
            .expirationTime(spawnConfig.getLifetimeLimitSeconds() != null
                ? now.plusSeconds(spawnConfig.getLifetimeLimitSeconds()) : null)
            .allowedIdleSeconds(spawnConfig.getMaxIdleSeconds())
            .spawnConfig(spawnConfig)
            .key(key != null ? key.getName() : null)
            .tag(tag)
            .createdAt(now)
            .build();
    }

    /**
     * Spawn dispatch happens after commit. The backend row is already authoritative, so a failed
     * dispatch is logged and counted; the idle watchdog reclaims a backend that never starts.
     */
    private void dispatchSpawn(Backend backend, Drone drone, Instant now) {
        DroneCommand command = DroneCommand.builder()
            .id(IdGenerator.timeOrderedId(now))
            .type(DroneCommandType.SPAWN)
            .cluster(backend.getCluster())
            .droneName(drone.getName())
            .droneId(drone.getId())
            .backendId(backend.getId())
            .spawnConfig(backend.getSpawnConfig())
            .issuedAt(now)
            .build();
        try {
            droneBus.sendCommand(command);
        } catch (Exception e) {
            log.error("Failed to dispatch spawn of backend {} to drone {}", backend.getId(), drone.getName(), e);
            metricsProvider.counter(SPAWN_DISPATCH_FAILURES_METRIC_NAME, Map.of(CLUSTER_TAG, backend.getCluster()))
                .increment();
        }
    }

    private ConnectResult toResult(Backend backend, boolean spawned) {
        return ConnectResult.builder()
            .backendId(backend.getId())
            .cluster(backend.getCluster())
            .spawned(spawned)
            .status(backend.getStatus())
            .url(connectionUrl(backend.getCluster(), backend.getId()))
            .droneName(backend.getDroneName())
            .key(backend.getKey())
            .tag(backend.getTag())
            .build();
    }

    private static KeyConfig normalize(KeyConfig key) {
        if (key == null || key.getName() == null || key.getName().isBlank()) {
            return null;
        }
        return key;
    }
}
