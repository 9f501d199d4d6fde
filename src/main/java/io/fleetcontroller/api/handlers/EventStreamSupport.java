package io.fleetcontroller.api.handlers;

import io.fleetcontroller.events.Subscription;
import io.fleetcontroller.models.FleetEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Bridges event log subscriptions to server-sent event streams. The subscription is closed
 * when the client goes away, the emitter times out, or {@code completeOn} matches an event.
 */
@Slf4j
final class EventStreamSupport {

    private EventStreamSupport() {
        // Utility class - prevent instantiation
    }

    /**
     * @param timeoutSeconds 0 keeps the stream open until the client disconnects
     */
    static SseEmitter stream(long timeoutSeconds,
                             Function<Consumer<FleetEvent>, Subscription> subscribe,
                             Predicate<FleetEvent> completeOn) {
        SseEmitter emitter = new SseEmitter(timeoutSeconds * 1000L);
        AtomicReference<Subscription> subscription = new AtomicReference<>();

        Runnable close = () -> {
            Subscription current = subscription.getAndSet(null);
            if (current != null) {
                current.close();
            }
        };
        emitter.onCompletion(close);
        emitter.onTimeout(close);
        emitter.onError(error -> close.run());

        subscription.set(subscribe.apply(event -> {
            try {
                emitter.send(SseEmitter.event().id(event.getId()).name(event.getKind()).data(event));
                if (completeOn.test(event)) {
                    emitter.complete();
                }
            } catch (IOException | IllegalStateException e) {
                log.debug("Event stream closed by client: {}", e.getMessage());
                close.run();
            }
        }));
        return emitter;
    }
}
