package io.fleetcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.fleetcontroller.enums.DroneCommandType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Fire-and-forget command addressed to one drone. Drones treat commands as idempotent
 * by backend id since delivery is at-least-once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DroneCommand {

    @JsonProperty("id")
    private String id;

    @JsonProperty("type")
    private DroneCommandType type;

    @JsonProperty("cluster")
    private String cluster;

    @JsonProperty("drone_name")
    private String droneName;

    @JsonProperty("drone_id")
    private String droneId;

    @JsonProperty("backend_id")
    private String backendId;

    @JsonProperty("spawn_config")
    private SpawnConfig spawnConfig;

    @JsonProperty("hard")
    private boolean hard;

    @JsonProperty("issued_at")
    private Instant issuedAt;
}
