package io.fleetcontroller.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a backend. Declaration order is the status order used by the
 * monotonic apply rule: a report is only applied when its status ranks strictly higher.
 *
 * <ul>
 *   <li><strong>SCHEDULED</strong> - row created by connect, spawn command dispatched</li>
 *   <li><strong>STARTING</strong> - drone acknowledged the spawn</li>
 *   <li><strong>READY</strong> - workload accepts traffic</li>
 *   <li><strong>TERMINATING</strong> - soft terminate in progress</li>
 *   <li><strong>HARD_TERMINATING</strong> - immediate kill requested</li>
 *   <li><strong>TERMINATED</strong> - terminal, key lock released</li>
 * </ul>
 *
 * HARD_TERMINATING ranks above TERMINATING so a soft terminate can be escalated.
 */
public enum BackendStatus {
    SCHEDULED("Scheduled"),
    STARTING("Starting"),
    READY("Ready"),
    TERMINATING("Terminating"),
    HARD_TERMINATING("HardTerminating"),
    TERMINATED("Terminated");

    private final String value;

    BackendStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == TERMINATED;
    }

    /**
     * True once a terminate of either kind has been requested or completed.
     */
    public boolean isTerminating() {
        return this == TERMINATING || this == HARD_TERMINATING || this == TERMINATED;
    }

    public boolean isAfter(BackendStatus other) {
        return compareTo(other) > 0;
    }

    public boolean isAtLeast(BackendStatus other) {
        return compareTo(other) >= 0;
    }

    @JsonCreator
    public static BackendStatus fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();
        for (BackendStatus status : BackendStatus.values()) {
            if (status.value.equalsIgnoreCase(trimmed) || status.name().equalsIgnoreCase(trimmed)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown backend status: " + value);
    }
}
