package io.fleetcontroller.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.WatchOption;
import io.etcd.jetcd.watch.WatchEvent;
import io.etcd.jetcd.watch.WatchResponse;
import io.fleetcontroller.models.FleetEvent;
import io.fleetcontroller.store.EtcdPathResolver;
import io.fleetcontroller.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static io.fleetcontroller.config.Constants.PATH_DELIMITER;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Event log stored under /fleet/events, streamed with etcd watches.
 */
@Slf4j
public class EtcdEventLog implements EventLog {

    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;

    private final KV kvClient;
    private final Watch watchClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;

    public EtcdEventLog(Client etcdClient, EtcdPathResolver pathResolver) {
        this(etcdClient.getKVClient(), etcdClient.getWatchClient(), pathResolver);
    }

    public EtcdEventLog(KV kvClient, Watch watchClient, EtcdPathResolver pathResolver) {
        this.kvClient = kvClient;
        this.watchClient = watchClient;
        this.pathResolver = pathResolver;
        this.objectMapper = JsonUtils.newObjectMapper();
        log.info("EtcdEventLog initialized");
    }

    @Override
    public List<FleetEvent> recent(String key, int limit) throws Exception {
        String prefix = key == null ? pathResolver.getEventsPrefix() : pathResolver.getEntityEventsPrefix(key);
        GetResponse response = executeEtcdPrefixQuery(prefix, false);

        List<FleetEvent> events = new ArrayList<>();
        for (KeyValue kv : response.getKvs()) {
            events.add(objectMapper.readValue(kv.getValue().toString(UTF_8), FleetEvent.class));
        }
        events.sort(Comparator.comparing(FleetEvent::getTimestamp).thenComparing(FleetEvent::getId));
        if (limit > 0 && events.size() > limit) {
            return new ArrayList<>(events.subList(events.size() - limit, events.size()));
        }
        return events;
    }

    @Override
    public Subscription subscribeAll(Consumer<FleetEvent> listener) {
        return watchPrefix(pathResolver.getEventsPrefix(), 0L, listener);
    }

    @Override
    public Subscription subscribe(String key, Consumer<FleetEvent> listener) {
        return watchPrefix(pathResolver.getEntityEventsPrefix(key), 0L, listener);
    }

    @Override
    public Subscription subscribe(String key, long fromRevision, Consumer<FleetEvent> listener) {
        return watchPrefix(pathResolver.getEntityEventsPrefix(key), fromRevision, listener);
    }

    @Override
    public int pruneOlderThan(Instant cutoff) throws Exception {
        GetResponse response = executeEtcdPrefixQuery(pathResolver.getEventsPrefix(), true);
        long cutoffMillis = cutoff.toEpochMilli();
        int pruned = 0;

        for (KeyValue kv : response.getKvs()) {
            String path = kv.getKey().toString(UTF_8);
            Long eventMillis = parseEventMillis(path);
            if (eventMillis == null) {
                log.warn("Skipping event key with unexpected format: {}", path);
                continue;
            }
            if (eventMillis < cutoffMillis) {
                kvClient.delete(kv.getKey()).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
                pruned++;
            }
        }

        if (pruned > 0) {
            log.info("Pruned {} events older than {}", pruned, cutoff);
        }
        return pruned;
    }

    /**
     * Note: the listener runs on the watch callback thread and should not block.
     */
    private Subscription watchPrefix(String prefix, long fromRevision, Consumer<FleetEvent> listener) {
        ByteSequence prefixBytes = ByteSequence.from(prefix + PATH_DELIMITER, UTF_8);
        WatchOption.Builder option = WatchOption.newBuilder().withPrefix(prefixBytes);
        if (fromRevision > 0) {
            option.withRevision(fromRevision);
        }
        Watch.Watcher watcher = watchClient.watch(
            prefixBytes,
            option.build(),
            watchResponse -> deliver(watchResponse, listener)
        );
        log.debug("Subscribed to events under {} from revision {}", prefix, fromRevision > 0 ? fromRevision : "now");
        return watcher::close;
    }

    private void deliver(WatchResponse watchResponse, Consumer<FleetEvent> listener) {
        for (WatchEvent watchEvent : watchResponse.getEvents()) {
            if (watchEvent.getEventType() != WatchEvent.EventType.PUT) {
                continue;
            }
            String json = watchEvent.getKeyValue().getValue().toString(UTF_8);
            try {
                listener.accept(objectMapper.readValue(json, FleetEvent.class));
            } catch (Exception e) {
                log.warn("Failed to deliver event from {}: {}",
                    watchEvent.getKeyValue().getKey().toString(UTF_8), e.getMessage());
            }
        }
    }

    private GetResponse executeEtcdPrefixQuery(String prefix, boolean keysOnly) throws Exception {
        ByteSequence prefixBytes = ByteSequence.from(prefix + PATH_DELIMITER, UTF_8);
        return kvClient.get(
            prefixBytes,
            GetOption.newBuilder().withPrefix(prefixBytes).withKeysOnly(keysOnly).build()
        ).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * Event ids start with zero-padded epoch millis: /fleet/events/<key>/<millis>-<suffix>
     */
    static Long parseEventMillis(String path) {
        int slash = path.lastIndexOf(PATH_DELIMITER);
        String eventId = slash >= 0 ? path.substring(slash + 1) : path;
        int dash = eventId.indexOf('-');
        if (dash <= 0) {
            return null;
        }
        try {
            return Long.parseLong(eventId.substring(0, dash));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
