package io.fleetcontroller.api.handlers;

import io.fleetcontroller.api.models.requests.ConnectRequest;
import io.fleetcontroller.api.models.responses.ConnectResponse;
import io.fleetcontroller.api.models.responses.ErrorResponse;
import io.fleetcontroller.connect.ConnectException;
import io.fleetcontroller.connect.ConnectProtocol;
import io.fleetcontroller.connect.ConnectResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API handler for the connect protocol.
 *
 * Supported operations:
 * - POST /connect - connect, cluster taken from the body or the controller default
 * - POST /{cluster}/connect - connect in the given cluster
 * - DELETE /{cluster}/key/{key} - release a key lock explicitly
 */
@Slf4j
@RestController
public class ConnectHandler {

    private final ConnectProtocol connectProtocol;

    public ConnectHandler(ConnectProtocol connectProtocol) {
        this.connectProtocol = connectProtocol;
    }

    /**
     * Connect using the cluster named in the body, or the default cluster.
     * POST /connect
     */
    @PostMapping("/connect")
    public ResponseEntity<Object> connect(@RequestBody ConnectRequest request) {
        return doConnect(request.getCluster(), request);
    }

    /**
     * Connect in a specific cluster.
     * POST /{cluster}/connect
     */
    @PostMapping("/{cluster}/connect")
    public ResponseEntity<Object> connectInCluster(
            @PathVariable String cluster,
            @RequestBody ConnectRequest request) {
        return doConnect(cluster, request);
    }

    /**
     * Release a key lock.
     * DELETE /{cluster}/key/{key}
     */
    @DeleteMapping("/{cluster}/key/{key}")
    public ResponseEntity<Object> releaseKey(
            @PathVariable String cluster,
            @PathVariable String key) {
        try {
            log.info("Releasing key '{}' in cluster '{}'", key, cluster);
            if (!connectProtocol.releaseKey(cluster, key)) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Key lock '" + key + "'"));
            }
            return ResponseEntity.ok(Map.of("acknowledged", true));
        } catch (ConnectException e) {
            ErrorResponse error = ErrorResponse.fromConnectException(e);
            log.error("Error {} releasing key '{}' in cluster '{}': {}", error.getId(), key, cluster, e.getError(), e);
            return ResponseEntity.status(error.getStatus()).body(error);
        }
    }

    private ResponseEntity<Object> doConnect(String cluster, ConnectRequest request) {
        try {
            log.info("Connect request for cluster '{}' with key '{}'", cluster,
                request.getKey() != null ? request.getKey().getName() : null);
            ConnectResult result = connectProtocol.connect(cluster, request.getKey(), request.getSpawnConfig());
            return ResponseEntity.ok(ConnectResponse.from(result));
        } catch (ConnectException e) {
            ErrorResponse error = ErrorResponse.fromConnectException(e);
            if (e.getError().isInternal()) {
                log.error("Error {} during connect in cluster '{}': {}", error.getId(), cluster, e.getError(), e);
            } else {
                log.info("Connect in cluster '{}' rejected ({}): {}", cluster, error.getId(), e.getError());
            }
            return ResponseEntity.status(error.getStatus()).body(error);
        }
    }
}
