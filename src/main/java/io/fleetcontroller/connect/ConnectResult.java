package io.fleetcontroller.connect;

import io.fleetcontroller.enums.BackendStatus;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a successful connect. {@code spawned} is false for an idempotent hit on an existing backend.
 */
@Data
@Builder
public class ConnectResult {
    private final String backendId;
    private final String cluster;
    private final boolean spawned;
    private final BackendStatus status;
    private final String url;
    private final String droneName;
    private final String key;
    private final String tag;
}
