package io.fleetcontroller.connect;

/**
 * Failure kinds of a connect or key release, each with the HTTP status and message shown to callers.
 * Store, serialization and unexpected faults share one opaque message.
 */
public enum ConnectError {
    NO_CLUSTER_PROVIDED(400, "No cluster provided, and no default cluster for this controller."),
    KEY_UNHELD_NO_SPAWN_CONFIG(409, "The key is not held, and no spawn config was provided."),
    KEY_HELD(409, "The key is held by another backend with a different tag."),
    KEY_HELD_UNHEALTHY(500, "The key is held by an unhealthy backend. Retry once it has been terminated."),
    NO_DRONE_AVAILABLE(500, "No active drone available in the cluster."),
    FAILED_TO_ACQUIRE_KEY(500, "Failed to acquire the key."),
    FAILED_TO_REMOVE_KEY(409, "Failed to remove the key."),
    DATABASE_ERROR(500, "Internal error."),
    SERIALIZATION(500, "Internal error."),
    OTHER(500, "Internal error.");

    private final int httpStatus;
    private final String message;

    ConnectError(int httpStatus, String message) {
        this.httpStatus = httpStatus;
        this.message = message;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Whether the underlying cause must stay hidden from the caller.
     */
    public boolean isInternal() {
        return this == DATABASE_ERROR || this == SERIALIZATION || this == OTHER;
    }
}
