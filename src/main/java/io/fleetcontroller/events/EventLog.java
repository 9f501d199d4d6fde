package io.fleetcontroller.events;

import io.fleetcontroller.models.FleetEvent;

import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * Read side of the append-only event log, with global and entity-scoped subscriptions.
 * Events are written by the store in the same transaction as the change they record.
 * Delivery is best-effort ordered per key; listeners must tolerate duplicates and reordering.
 */
public interface EventLog {

    /**
     * Most recent events, newest last. A null key reads across all entities.
     */
    List<FleetEvent> recent(String key, int limit) throws Exception;

    Subscription subscribeAll(Consumer<FleetEvent> listener);

    Subscription subscribe(String key, Consumer<FleetEvent> listener);

    /**
     * Entity-scoped subscription replaying from {@code fromRevision}, so events committed
     * after a read at {@code fromRevision - 1} are delivered even if the watch registers late.
     */
    Subscription subscribe(String key, long fromRevision, Consumer<FleetEvent> listener);

    /**
     * Delete events older than the cutoff.
     *
     * @return number of events removed
     */
    int pruneOlderThan(Instant cutoff) throws Exception;
}
