package io.fleetcontroller.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.DeleteOption;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import io.fleetcontroller.models.Backend;
import io.fleetcontroller.models.Drone;
import io.fleetcontroller.models.FleetEvent;
import io.fleetcontroller.models.KeyLock;
import io.fleetcontroller.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static io.fleetcontroller.config.Constants.PATH_BACKENDS;
import static io.fleetcontroller.config.Constants.PATH_DELIMITER;
import static io.fleetcontroller.config.Constants.PATH_DRONES;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * etcd-based implementation of FleetStore.
 * Every mutation is a single etcd transaction guarded by mod revision comparisons.
 */
@Slf4j
public class EtcdFleetStore implements FleetStore {

    // TODO: Make etcd timeout configurable via application.yml
    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;

    private final KV kvClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;

    public EtcdFleetStore(KV kvClient, EtcdPathResolver pathResolver) {
        this.kvClient = kvClient;
        this.pathResolver = pathResolver;
        this.objectMapper = JsonUtils.newObjectMapper();
        log.info("EtcdFleetStore initialized");
    }

    // =================================================================
    // DRONES
    // =================================================================

    @Override
    public Optional<Versioned<Drone>> getDrone(String cluster, String name) throws Exception {
        return getVersionedByPath(pathResolver.getDronePath(cluster, name), Drone.class);
    }

    @Override
    public List<Drone> getDrones(String cluster) throws Exception {
        return getAllObjectsByPrefix(pathResolver.getDronesPrefix(cluster), Drone.class);
    }

    @Override
    public List<Drone> getAllDrones() throws Exception {
        return getClusterTable(PATH_DRONES, Drone.class);
    }

    @Override
    public boolean compareAndPutDrone(Drone drone, long expectedRevision, List<FleetEvent> events) throws Exception {
        String path = pathResolver.getDronePath(drone.getCluster(), drone.getName());
        List<Cmp> conditions = new ArrayList<>();
        List<Op> operations = new ArrayList<>();
        conditions.add(revisionEquals(path, expectedRevision));
        operations.add(putOp(path, drone));
        addEventOps(operations, events);

        boolean succeeded = commit(conditions, operations);
        log.debug("Drone {}/{} compare-and-put at revision {}: {}", drone.getCluster(), drone.getName(),
            expectedRevision, succeeded ? "applied" : "conflict");
        return succeeded;
    }

    // =================================================================
    // BACKENDS
    // =================================================================

    @Override
    public Optional<Versioned<Backend>> getBackend(String cluster, String backendId) throws Exception {
        return getVersionedByPath(pathResolver.getBackendPath(cluster, backendId), Backend.class);
    }

    @Override
    public List<Backend> getBackends(String cluster) throws Exception {
        return getAllObjectsByPrefix(pathResolver.getBackendsPrefix(cluster), Backend.class);
    }

    @Override
    public List<Backend> getAllBackends() throws Exception {
        return getClusterTable(PATH_BACKENDS, Backend.class);
    }

    @Override
    public boolean createBackend(Backend backend, KeyLock lock, long expectedLockRevision,
                                 List<FleetEvent> events) throws Exception {
        String backendPath = pathResolver.getBackendPath(backend.getCluster(), backend.getId());
        List<Cmp> conditions = new ArrayList<>();
        List<Op> operations = new ArrayList<>();

        conditions.add(revisionEquals(backendPath, 0));
        operations.add(putOp(backendPath, backend));

        if (lock != null) {
            String lockPath = pathResolver.getKeyLockPath(lock.getCluster(), lock.getKey());
            conditions.add(revisionEquals(lockPath, expectedLockRevision));
            operations.add(putOp(lockPath, lock));
        }
        addEventOps(operations, events);

        boolean succeeded = commit(conditions, operations);
        if (succeeded) {
            log.debug("Created backend {} in cluster {}{}", backend.getId(), backend.getCluster(),
                lock != null ? " holding key " + lock.getKey() : "");
        }
        return succeeded;
    }

    @Override
    public boolean compareAndPutBackend(Backend backend, long expectedRevision, KeyRelease release,
                                        List<FleetEvent> events) throws Exception {
        String backendPath = pathResolver.getBackendPath(backend.getCluster(), backend.getId());
        List<Cmp> conditions = new ArrayList<>();
        List<Op> operations = new ArrayList<>();

        conditions.add(revisionEquals(backendPath, expectedRevision));
        operations.add(putOp(backendPath, backend));

        if (release != null) {
            String lockPath = pathResolver.getKeyLockPath(release.getCluster(), release.getKey());
            conditions.add(revisionEquals(lockPath, release.getExpectedRevision()));
            operations.add(deleteOp(lockPath));
        }
        addEventOps(operations, events);

        return commit(conditions, operations);
    }

    // =================================================================
    // KEY LOCKS
    // =================================================================

    @Override
    public Optional<Versioned<KeyLock>> getKeyLock(String cluster, String key) throws Exception {
        return getVersionedByPath(pathResolver.getKeyLockPath(cluster, key), KeyLock.class);
    }

    @Override
    public boolean deleteKeyLock(KeyRelease release, List<FleetEvent> events) throws Exception {
        String lockPath = pathResolver.getKeyLockPath(release.getCluster(), release.getKey());
        List<Cmp> conditions = new ArrayList<>();
        List<Op> operations = new ArrayList<>();
        conditions.add(revisionEquals(lockPath, release.getExpectedRevision()));
        operations.add(deleteOp(lockPath));
        addEventOps(operations, events);
        return commit(conditions, operations);
    }

    // =================================================================
    // PRIVATE HELPER METHODS FOR ETCD OPERATIONS
    // =================================================================

    /**
     * Executes etcd prefix query to retrieve all keys matching the given prefix
     */
    private GetResponse executeEtcdPrefixQuery(String prefix) throws Exception {
        // Add trailing slash for etcd prefix queries to ensure precise matching
        ByteSequence prefixBytes = ByteSequence.from(prefix + PATH_DELIMITER, UTF_8);
        return kvClient.get(
            prefixBytes,
            GetOption.newBuilder().withPrefix(prefixBytes).build()
        ).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private GetResponse executeEtcdGet(String key) throws Exception {
        return kvClient.get(ByteSequence.from(key, UTF_8)).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private boolean commit(List<Cmp> conditions, List<Op> operations) throws Exception {
        TxnResponse response = kvClient.txn()
            .If(conditions.toArray(new Cmp[0]))
            .Then(operations.toArray(new Op[0]))
            .commit()
            .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        return response.isSucceeded();
    }

    private Cmp revisionEquals(String path, long revision) {
        return new Cmp(ByteSequence.from(path, UTF_8), Cmp.Op.EQUAL, CmpTarget.modRevision(revision));
    }

    private Op putOp(String path, Object value) throws Exception {
        String json = objectMapper.writeValueAsString(value);
        return Op.put(ByteSequence.from(path, UTF_8), ByteSequence.from(json, UTF_8), PutOption.DEFAULT);
    }

    private Op deleteOp(String path) {
        return Op.delete(ByteSequence.from(path, UTF_8), DeleteOption.DEFAULT);
    }

    private void addEventOps(List<Op> operations, List<FleetEvent> events) throws Exception {
        if (events == null) {
            return;
        }
        for (FleetEvent event : events) {
            operations.add(putOp(pathResolver.getEventPath(event.getKey(), event.getId()), event));
        }
    }

    private <T> Optional<Versioned<T>> getVersionedByPath(String path, Class<T> clazz) throws Exception {
        GetResponse response = executeEtcdGet(path);
        if (response.getCount() == 0 || response.getKvs().isEmpty()) {
            return Optional.empty();
        }
        KeyValue kv = response.getKvs().get(0);
        T value = objectMapper.readValue(kv.getValue().toString(UTF_8), clazz);
        return Optional.of(new Versioned<>(value, kv.getModRevision()));
    }

    private <T> List<T> getAllObjectsByPrefix(String prefix, Class<T> clazz) throws Exception {
        GetResponse response = executeEtcdPrefixQuery(prefix);
        List<T> items = new ArrayList<>();
        for (KeyValue kv : response.getKvs()) {
            items.add(objectMapper.readValue(kv.getValue().toString(UTF_8), clazz));
        }
        return items;
    }

    /**
     * Scans every cluster and keeps the rows of one table.
     */
    private <T> List<T> getClusterTable(String table, Class<T> clazz) throws Exception {
        GetResponse response = executeEtcdPrefixQuery(pathResolver.getClustersPrefix());
        List<T> items = new ArrayList<>();
        for (KeyValue kv : response.getKvs()) {
            if (pathResolver.isTablePath(kv.getKey().toString(UTF_8), table)) {
                items.add(objectMapper.readValue(kv.getValue().toString(UTF_8), clazz));
            }
        }
        return items;
    }
}
