package io.fleetcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Binding of (cluster, key) to the backend currently holding it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class KeyLock {

    @JsonProperty("cluster")
    private String cluster;

    @JsonProperty("key")
    private String key;

    @JsonProperty("backend_id")
    private String backendId;

    @JsonProperty("tag")
    private String tag;

    @JsonProperty("acquired_at")
    private Instant acquiredAt;
}
