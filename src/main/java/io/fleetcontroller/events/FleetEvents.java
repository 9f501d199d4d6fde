package io.fleetcontroller.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fleetcontroller.enums.BackendStatus;
import io.fleetcontroller.enums.DroneStatus;
import io.fleetcontroller.models.Backend;
import io.fleetcontroller.models.Drone;
import io.fleetcontroller.models.FleetEvent;
import io.fleetcontroller.util.IdGenerator;
import io.fleetcontroller.util.JsonUtils;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.fleetcontroller.config.Constants.*;

/**
 * Factory methods for the events written alongside state changes.
 * Backend events are keyed by backend id, drone events by drone id.
 */
public final class FleetEvents {

    private static final ObjectMapper MAPPER = JsonUtils.newObjectMapper();

    private FleetEvents() {
        // Utility class - prevent instantiation
    }

    public static FleetEvent of(String key, String kind, Instant timestamp, Map<String, Object> payload) {
        return FleetEvent.builder()
            .id(IdGenerator.timeOrderedId(timestamp))
            .timestamp(timestamp)
            .key(key)
            .kind(kind)
            .payload(MAPPER.valueToTree(payload))
            .build();
    }

    public static FleetEvent backendCreated(Backend backend, Instant timestamp) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("cluster", backend.getCluster());
        payload.put("drone_id", backend.getDroneId());
        payload.put("status", backend.getStatus().getValue());
        if (backend.getKey() != null) {
            payload.put("key", backend.getKey());
            payload.put("tag", backend.getTag());
        }
        return of(backend.getId(), EVENT_BACKEND_CREATED, timestamp, payload);
    }

    public static FleetEvent backendStatus(Backend backend, BackendStatus status, Instant timestamp) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("cluster", backend.getCluster());
        payload.put("drone_id", backend.getDroneId());
        payload.put("status", status.getValue());
        return of(backend.getId(), EVENT_BACKEND_STATUS, timestamp, payload);
    }

    public static FleetEvent keyReleased(String cluster, String key, String backendId, Instant timestamp) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("cluster", cluster);
        payload.put("key", key);
        payload.put("backend_id", backendId);
        return of(backendId, EVENT_KEY_RELEASED, timestamp, payload);
    }

    public static FleetEvent droneRegistered(Drone drone, Instant timestamp) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("cluster", drone.getCluster());
        payload.put("name", drone.getName());
        payload.put("version", drone.getVersion());
        return of(drone.getId(), EVENT_DRONE_REGISTERED, timestamp, payload);
    }

    public static FleetEvent droneStatus(Drone drone, DroneStatus status, Instant timestamp) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("cluster", drone.getCluster());
        payload.put("name", drone.getName());
        payload.put("status", status.getValue());
        return of(drone.getId(), EVENT_DRONE_STATUS, timestamp, payload);
    }

    public static FleetEvent droneDrained(Drone drone, Instant timestamp) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("cluster", drone.getCluster());
        payload.put("name", drone.getName());
        return of(drone.getId(), EVENT_DRONE_DRAINED, timestamp, payload);
    }

    /**
     * Status carried by a backend event, or null for events without one.
     */
    public static BackendStatus statusOf(FleetEvent event) {
        if (event.getPayload() == null || !event.getPayload().hasNonNull("status")) {
            return null;
        }
        if (!EVENT_BACKEND_STATUS.equals(event.getKind()) && !EVENT_BACKEND_CREATED.equals(event.getKind())) {
            return null;
        }
        return BackendStatus.fromString(event.getPayload().get("status").asText());
    }
}
