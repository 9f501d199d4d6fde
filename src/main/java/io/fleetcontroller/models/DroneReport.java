package io.fleetcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.fleetcontroller.enums.BackendStatus;
import io.fleetcontroller.enums.DroneReportType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Message published by a drone. Backend fields are only set for backend reports.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DroneReport {

    @JsonProperty("id")
    private String id;

    @JsonProperty("type")
    private DroneReportType type;

    @JsonProperty("cluster")
    private String cluster;

    @JsonProperty("drone_name")
    private String droneName;

    @JsonProperty("version")
    private String version;

    @JsonProperty("hash")
    private String hash;

    @JsonProperty("backend_id")
    private String backendId;

    @JsonProperty("status")
    private BackendStatus status;

    @JsonProperty("timestamp")
    private Instant timestamp;
}
