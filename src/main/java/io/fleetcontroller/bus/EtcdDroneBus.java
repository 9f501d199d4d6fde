package io.fleetcontroller.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Lease;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import io.etcd.jetcd.options.WatchOption;
import io.etcd.jetcd.watch.WatchEvent;
import io.fleetcontroller.events.Subscription;
import io.fleetcontroller.models.DroneCommand;
import io.fleetcontroller.models.DroneReport;
import io.fleetcontroller.store.EtcdPathResolver;
import io.fleetcontroller.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static io.fleetcontroller.config.Constants.PATH_DELIMITER;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Drone bus over etcd keys.
 * <p>
 * Commands are written under the target drone's command prefix with a lease, so a command
 * nobody picks up disappears after the TTL. Reports are consumed by watching the report
 * prefix and deleted once handled; a report whose handler fails stays in place and is
 * picked up again by the periodic rescan of the report prefix.
 */
@Slf4j
public class EtcdDroneBus implements DroneBus {

    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;

    private final KV kvClient;
    private final Lease leaseClient;
    private final Watch watchClient;
    private final EtcdPathResolver pathResolver;
    private final long commandTtlSeconds;
    private final Duration reportRescanInterval;
    private final ObjectMapper objectMapper;

    public EtcdDroneBus(Client etcdClient, EtcdPathResolver pathResolver, long commandTtlSeconds,
                        Duration reportRescanInterval) {
        this(etcdClient.getKVClient(), etcdClient.getLeaseClient(), etcdClient.getWatchClient(),
            pathResolver, commandTtlSeconds, reportRescanInterval);
    }

    public EtcdDroneBus(KV kvClient, Lease leaseClient, Watch watchClient,
                        EtcdPathResolver pathResolver, long commandTtlSeconds, Duration reportRescanInterval) {
        this.kvClient = kvClient;
        this.leaseClient = leaseClient;
        this.watchClient = watchClient;
        this.pathResolver = pathResolver;
        this.commandTtlSeconds = commandTtlSeconds;
        this.reportRescanInterval = reportRescanInterval;
        this.objectMapper = JsonUtils.newObjectMapper();
        log.info("EtcdDroneBus initialized (command ttl: {}s, report rescan: {})", commandTtlSeconds,
            reportRescanInterval);
    }

    @Override
    public void sendCommand(DroneCommand command) throws Exception {
        long leaseId = leaseClient.grant(commandTtlSeconds)
            .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)
            .getID();

        String path = pathResolver.getDroneCommandPath(command.getCluster(), command.getDroneName(), command.getId());
        String json = objectMapper.writeValueAsString(command);
        kvClient.put(
            ByteSequence.from(path, UTF_8),
            ByteSequence.from(json, UTF_8),
            PutOption.newBuilder().withLeaseId(leaseId).build()
        ).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

        log.info("Sent {} command {} for backend {} to drone {}/{}", command.getType(), command.getId(),
            command.getBackendId(), command.getCluster(), command.getDroneName());
    }

    @Override
    public Subscription consumeReports(Consumer<DroneReport> handler) throws Exception {
        // Watch callbacks must not block; reports are handled on a dedicated thread
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "drone-report-consumer");
            thread.setDaemon(true);
            return thread;
        });
        // Paths queued or being handled, so the watch and a rescan never queue one report twice
        Set<String> inFlight = ConcurrentHashMap.newKeySet();

        ByteSequence prefixBytes = ByteSequence.from(pathResolver.getReportsPrefix() + PATH_DELIMITER, UTF_8);
        GetResponse backlog = scanReports(prefixBytes);

        log.info("Processing {} pending drone reports", backlog.getKvs().size());
        for (KeyValue kv : backlog.getKvs()) {
            submitReport(executor, inFlight, kv, handler);
        }

        Watch.Watcher watcher = watchClient.watch(
            prefixBytes,
            WatchOption.newBuilder()
                .withPrefix(prefixBytes)
                .withRevision(backlog.getHeader().getRevision() + 1)
                .build(),
            watchResponse -> {
                for (WatchEvent event : watchResponse.getEvents()) {
                    if (event.getEventType() == WatchEvent.EventType.PUT) {
                        submitReport(executor, inFlight, event.getKeyValue(), handler);
                    }
                }
            }
        );

        long rescanMillis = reportRescanInterval.toMillis();
        executor.scheduleWithFixedDelay(() -> rescanReports(prefixBytes, executor, inFlight, handler),
            rescanMillis, rescanMillis, TimeUnit.MILLISECONDS);

        return () -> {
            watcher.close();
            executor.shutdown();
            log.info("Stopped consuming drone reports");
        };
    }

    /**
     * Re-queue reports still present under the prefix. A report stays until its handler succeeds,
     * so this is what retries a report whose handler failed.
     */
    private void rescanReports(ByteSequence prefixBytes, ExecutorService executor, Set<String> inFlight,
                               Consumer<DroneReport> handler) {
        try {
            GetResponse pending = scanReports(prefixBytes);
            if (!pending.getKvs().isEmpty()) {
                log.info("Rescan found {} pending drone reports", pending.getKvs().size());
            }
            for (KeyValue kv : pending.getKvs()) {
                submitReport(executor, inFlight, kv, handler);
            }
        } catch (Exception e) {
            log.warn("Failed to rescan pending drone reports", e);
        }
    }

    private void submitReport(ExecutorService executor, Set<String> inFlight, KeyValue kv,
                              Consumer<DroneReport> handler) {
        String path = kv.getKey().toString(UTF_8);
        if (!inFlight.add(path)) {
            return;
        }
        try {
            executor.submit(() -> {
                try {
                    processReport(kv.getKey(), kv.getValue(), handler);
                } finally {
                    inFlight.remove(path);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(path);
            log.debug("Report consumer stopped, leaving {} for the next start", path);
        }
    }

    private GetResponse scanReports(ByteSequence prefixBytes) throws Exception {
        return kvClient.get(
            prefixBytes,
            GetOption.newBuilder().withPrefix(prefixBytes).build()
        ).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    void processReport(ByteSequence key, ByteSequence value, Consumer<DroneReport> handler) {
        String path = key.toString(UTF_8);
        DroneReport report;
        try {
            report = objectMapper.readValue(value.toString(UTF_8), DroneReport.class);
        } catch (JsonProcessingException e) {
            log.warn("Discarding malformed drone report at {}: {}", path, e.getOriginalMessage());
            deleteReport(key);
            return;
        }

        try {
            handler.accept(report);
        } catch (Exception e) {
            log.error("Failed to handle drone report {} from {}/{}", report.getId(), report.getCluster(),
                report.getDroneName(), e);
            return;
        }
        deleteReport(key);
    }

    private void deleteReport(ByteSequence key) {
        try {
            kvClient.delete(key).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (Exception e) {
            log.warn("Failed to delete handled drone report {}: {}", key.toString(UTF_8), e.getMessage());
        }
    }
}
