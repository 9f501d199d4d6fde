package io.fleetcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.fleetcontroller.config.Constants;
import io.fleetcontroller.enums.DroneStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * A worker node in a cluster. Identity is (cluster, name); {@code id} changes with every
 * incarnation so backends of a terminated drone never attach to its successor.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Drone {

    @JsonProperty("id")
    private String id;

    @JsonProperty("cluster")
    private String cluster;

    @JsonProperty("name")
    private String name;

    @JsonProperty("controller")
    private String controller;

    @JsonProperty("version")
    private String version;

    @JsonProperty("hash")
    private String hash;

    @JsonProperty("status")
    private DroneStatus status;

    @JsonProperty("admin_state")
    @Builder.Default
    private String adminState = Constants.ADMIN_STATE_NORMAL; // "NORMAL", "DRAIN"

    @JsonProperty("last_heartbeat")
    private Instant lastHeartbeat;

    @JsonProperty("status_time")
    private Instant statusTime;

    @JsonProperty("registered_at")
    private Instant registeredAt;

    @JsonIgnore
    public boolean isDrained() {
        return Constants.ADMIN_STATE_DRAIN.equals(adminState);
    }

    @JsonIgnore
    public boolean isTerminated() {
        return status != null && status.isTerminal();
    }

    /**
     * Whether the last heartbeat falls within {@code window} of {@code now}.
     */
    @JsonIgnore
    public boolean isHeartbeatFresh(Instant now, Duration window) {
        return lastHeartbeat != null && !lastHeartbeat.isBefore(now.minus(window));
    }
}
