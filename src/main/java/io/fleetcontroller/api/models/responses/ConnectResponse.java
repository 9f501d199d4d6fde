package io.fleetcontroller.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.fleetcontroller.connect.ConnectResult;
import io.fleetcontroller.enums.BackendStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response model for connect operations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConnectResponse {

    private String backendId;
    private boolean spawned;
    private BackendStatus status;
    private String url;
    private String cluster;
    private String drone;
    private String key;
    private String tag;

    public static ConnectResponse from(ConnectResult result) {
        return ConnectResponse.builder()
            .backendId(result.getBackendId())
            .spawned(result.isSpawned())
            .status(result.getStatus())
            .url(result.getUrl())
            .cluster(result.getCluster())
            .drone(result.getDroneName())
            .key(result.getKey())
            .tag(result.getTag())
            .build();
    }
}
