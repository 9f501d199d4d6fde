package io.fleetcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Spawn configuration supplied on connect.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpawnConfig {

    @JsonProperty("executable")
    private ExecutorConfig executable;

    @JsonProperty("lifetime_limit_seconds")
    private Long lifetimeLimitSeconds;

    @JsonProperty("max_idle_seconds")
    private Long maxIdleSeconds;
}
