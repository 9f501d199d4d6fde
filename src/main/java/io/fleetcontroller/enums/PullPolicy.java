package io.fleetcontroller.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Image pull policy forwarded to the drone with a spawn command.
 */
public enum PullPolicy {
    ALWAYS("Always"),
    IF_NOT_PRESENT("IfNotPresent"),
    NEVER("Never");

    private final String value;

    PullPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PullPolicy fromString(String value) {
        if (value == null) return IF_NOT_PRESENT;

        String trimmed = value.trim();
        for (PullPolicy policy : PullPolicy.values()) {
            if (policy.value.equalsIgnoreCase(trimmed) || policy.name().equalsIgnoreCase(trimmed)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown pull policy: " + value);
    }
}
