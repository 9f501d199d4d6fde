package io.fleetcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.fleetcontroller.enums.BackendStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * A scheduled or running instance of a client workload, owned by exactly one drone.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Backend {

    @JsonProperty("id")
    private String id;

    @JsonProperty("cluster")
    private String cluster;

    @JsonProperty("drone_id")
    private String droneId;

    @JsonProperty("drone_name")
    private String droneName;

    @JsonProperty("status")
    private BackendStatus status;

    @JsonProperty("status_time")
    private Instant statusTime;

    @JsonProperty("last_keepalive")
    private Instant lastKeepalive;

    @JsonProperty("expiration_time")
    private Instant expirationTime;

    @JsonProperty("allowed_idle_seconds")
    private Long allowedIdleSeconds;

    @JsonProperty("spawn_config")
    private SpawnConfig spawnConfig;

    @JsonProperty("key")
    private String key;

    @JsonProperty("tag")
    private String tag;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonIgnore
    public boolean isTerminated() {
        return status != null && status.isTerminal();
    }

    /**
     * Time since the last keepalive, measured at {@code asOf}. Falls back to the creation
     * time when the backend has never sent a keepalive.
     */
    @JsonIgnore
    public Duration idleTime(Instant asOf) {
        Instant since = lastKeepalive != null ? lastKeepalive : createdAt;
        return since == null ? Duration.ZERO : Duration.between(since, asOf);
    }
}
