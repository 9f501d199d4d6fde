package io.fleetcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.fleetcontroller.enums.PullPolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * What the drone runs: image reference, environment and pull policy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecutorConfig {

    @JsonProperty("image")
    private String image;

    @JsonProperty("env")
    @Builder.Default
    private Map<String, String> env = new HashMap<>();

    @JsonProperty("pull_policy")
    @Builder.Default
    private PullPolicy pullPolicy = PullPolicy.IF_NOT_PRESENT;
}
