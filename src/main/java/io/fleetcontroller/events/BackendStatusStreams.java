package io.fleetcontroller.events;

import io.fleetcontroller.enums.BackendStatus;
import io.fleetcontroller.models.Backend;
import io.fleetcontroller.models.FleetEvent;
import io.fleetcontroller.store.FleetStore;
import io.fleetcontroller.store.Versioned;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Entity-scoped status streams built on the event log.
 */
@Slf4j
public class BackendStatusStreams {

    private final FleetStore fleetStore;
    private final EventLog eventLog;

    public BackendStatusStreams(FleetStore fleetStore, EventLog eventLog) {
        this.fleetStore = fleetStore;
        this.eventLog = eventLog;
    }

    /**
     * Completes with the first observed status at or beyond {@code target}.
     * The current row is read first and the subscription replays from the revision after it.
     * A status event is committed with the row it describes, so no transition after the read
     * can be missed however late the watch registers. The subscription is closed once the
     * future completes by any path (status reached, timeout, cancellation, error).
     *
     * @param timeout null waits indefinitely
     */
    public CompletableFuture<BackendStatus> awaitStatus(String cluster, String backendId,
                                                        BackendStatus target, Duration timeout) {
        CompletableFuture<BackendStatus> result = new CompletableFuture<>();
        Versioned<Backend> current;
        try {
            Optional<Versioned<Backend>> read = fleetStore.getBackend(cluster, backendId);
            if (read.isEmpty()) {
                result.completeExceptionally(new NoSuchElementException(
                    "Backend " + backendId + " not found in cluster " + cluster));
                return result;
            }
            current = read.get();
        } catch (Exception e) {
            log.error("Failed to read backend {} while waiting for {}", backendId, target, e);
            result.completeExceptionally(e);
            return result;
        }

        BackendStatus status = current.getValue().getStatus();
        if (status.isAtLeast(target)) {
            result.complete(status);
            return result;
        }

        Subscription subscription = eventLog.subscribe(backendId, current.getRevision() + 1, event -> {
            BackendStatus observed = FleetEvents.statusOf(event);
            if (observed != null && observed.isAtLeast(target)) {
                result.complete(observed);
            }
        });
        result.whenComplete((reached, error) -> subscription.close());

        if (timeout != null) {
            result.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return result;
    }

    /**
     * Stream every event of one backend to the listener until the subscription is closed.
     */
    public Subscription streamBackend(String backendId, Consumer<FleetEvent> listener) {
        log.debug("Opening status stream for backend {}", backendId);
        return eventLog.subscribe(backendId, listener);
    }

    public Subscription streamAll(Consumer<FleetEvent> listener) {
        log.debug("Opening global event stream");
        return eventLog.subscribeAll(listener);
    }
}
