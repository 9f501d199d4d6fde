package io.fleetcontroller.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.fleetcontroller.enums.BackendStatus;
import io.fleetcontroller.lifecycle.StatusUpdate;
import io.fleetcontroller.models.Backend;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response model for backend status reads and terminate requests.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BackendStatusResponse {

    private String backendId;
    private String cluster;
    private BackendStatus status;
    private Instant statusTime;
    private String drone;
    private BackendStatus previousStatus;
    private Boolean applied;

    public static BackendStatusResponse from(Backend backend) {
        return BackendStatusResponse.builder()
            .backendId(backend.getId())
            .cluster(backend.getCluster())
            .status(backend.getStatus())
            .statusTime(backend.getStatusTime())
            .drone(backend.getDroneName())
            .build();
    }

    public static BackendStatusResponse from(StatusUpdate update) {
        BackendStatusResponse response = from(update.getBackend());
        response.setPreviousStatus(update.getPreviousStatus());
        response.setApplied(update.isApplied());
        return response;
    }
}
