package io.fleetcontroller.events;

/**
 * Handle on a live subscription. Closing it stops delivery; closing twice is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
