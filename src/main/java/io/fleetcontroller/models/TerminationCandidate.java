package io.fleetcontroller.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.fleetcontroller.enums.BackendStatus;
import io.fleetcontroller.enums.TerminationReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Backend selected by the watchdog, with how far past its budget it is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TerminationCandidate {

    @JsonProperty("backend_id")
    private String backendId;

    @JsonProperty("cluster")
    private String cluster;

    @JsonProperty("drone_id")
    private String droneId;

    @JsonProperty("status")
    private BackendStatus status;

    @JsonProperty("reason")
    private TerminationReason reason;

    @JsonProperty("overage_seconds")
    private long overageSeconds;
}
