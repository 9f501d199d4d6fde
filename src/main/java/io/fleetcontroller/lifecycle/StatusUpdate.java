package io.fleetcontroller.lifecycle;

import io.fleetcontroller.enums.BackendStatus;
import io.fleetcontroller.models.Backend;
import lombok.Getter;

/**
 * Result of applying a status to a backend: the stored backend after the attempt and whether
 * the status actually moved.
 */
@Getter
public class StatusUpdate {

    private final Backend backend;
    private final BackendStatus previousStatus;
    private final boolean applied;

    public StatusUpdate(Backend backend, BackendStatus previousStatus, boolean applied) {
        this.backend = backend;
        this.previousStatus = previousStatus;
        this.applied = applied;
    }
}
