package io.fleetcontroller.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Health status of a drone. Terminated is fail-stop: a drone never leaves it.
 */
public enum DroneStatus {
    STARTING("Starting"),
    AVAILABLE("Available"),
    TERMINATED("Terminated");

    private final String value;

    DroneStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == TERMINATED;
    }

    @JsonCreator
    public static DroneStatus fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();
        for (DroneStatus status : DroneStatus.values()) {
            if (status.value.equalsIgnoreCase(trimmed) || status.name().equalsIgnoreCase(trimmed)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown drone status: " + value);
    }
}
