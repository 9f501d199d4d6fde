package io.fleetcontroller.store;

import io.fleetcontroller.models.Backend;
import io.fleetcontroller.models.Drone;
import io.fleetcontroller.models.FleetEvent;
import io.fleetcontroller.models.KeyLock;

import java.util.List;
import java.util.Optional;

/**
 * Shared store holding the node, backend and key lock tables.
 * <p>
 * Every mutation is a compare-and-set against the revisions the caller observed; a
 * {@code false} return means another writer got there first and nothing was written.
 * Events passed to a mutation are appended in the same transaction.
 */
public interface FleetStore {

    // =================================================================
    // DRONES
    // =================================================================

    Optional<Versioned<Drone>> getDrone(String cluster, String name) throws Exception;

    List<Drone> getDrones(String cluster) throws Exception;

    List<Drone> getAllDrones() throws Exception;

    boolean compareAndPutDrone(Drone drone, long expectedRevision, List<FleetEvent> events) throws Exception;

    // =================================================================
    // BACKENDS
    // =================================================================

    Optional<Versioned<Backend>> getBackend(String cluster, String backendId) throws Exception;

    List<Backend> getBackends(String cluster) throws Exception;

    List<Backend> getAllBackends() throws Exception;

    /**
     * Create a backend row that must not exist yet. When {@code lock} is non-null the lock row is
     * written in the same transaction, guarded by {@code expectedLockRevision}.
     */
    boolean createBackend(Backend backend, KeyLock lock, long expectedLockRevision,
                          List<FleetEvent> events) throws Exception;

    /**
     * Overwrite a backend row at {@code expectedRevision}, optionally releasing a key lock
     * in the same transaction.
     */
    boolean compareAndPutBackend(Backend backend, long expectedRevision, KeyRelease release,
                                 List<FleetEvent> events) throws Exception;

    // =================================================================
    // KEY LOCKS
    // =================================================================

    Optional<Versioned<KeyLock>> getKeyLock(String cluster, String key) throws Exception;

    boolean deleteKeyLock(KeyRelease release, List<FleetEvent> events) throws Exception;
}
