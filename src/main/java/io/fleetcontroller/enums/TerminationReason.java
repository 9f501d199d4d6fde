package io.fleetcontroller.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why the watchdog selected a backend for termination.
 */
public enum TerminationReason {
    EXPIRED("expired"),
    IDLE("idle"),
    ESCALATION("escalation");

    private final String value;

    TerminationReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
