package io.fleetcontroller.api.handlers;

import io.fleetcontroller.api.models.responses.ErrorResponse;
import io.fleetcontroller.enums.BackendStatus;
import io.fleetcontroller.models.Backend;
import io.fleetcontroller.registry.NodeRegistry;
import io.fleetcontroller.store.FleetStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only administrative API used by operator tooling.
 *
 * Supported operations:
 * - GET /admin/drones?cluster=...&all=false
 * - GET /admin/backends?cluster=...&status=...
 * - GET /admin/orphans?cluster=...
 */
@Slf4j
@RestController
@RequestMapping("/admin")
public class AdminHandler {

    private final NodeRegistry nodeRegistry;
    private final FleetStore fleetStore;

    public AdminHandler(NodeRegistry nodeRegistry, FleetStore fleetStore) {
        this.nodeRegistry = nodeRegistry;
        this.fleetStore = fleetStore;
    }

    @GetMapping("/drones")
    public ResponseEntity<Object> listDrones(
            @RequestParam(value = "cluster", required = false) String cluster,
            @RequestParam(value = "all", defaultValue = "false") boolean all) {
        try {
            return ResponseEntity.ok(nodeRegistry.listDrones(cluster, all));
        } catch (Exception e) {
            return internalError("listing drones", e);
        }
    }

    @GetMapping("/backends")
    public ResponseEntity<Object> listBackends(
            @RequestParam(value = "cluster", required = false) String cluster,
            @RequestParam(value = "status", required = false) String status) {
        try {
            BackendStatus filter = status != null ? BackendStatus.fromString(status) : null;
            List<Backend> backends = cluster != null ? fleetStore.getBackends(cluster) : fleetStore.getAllBackends();
            if (filter != null) {
                backends = backends.stream().filter(b -> b.getStatus() == filter).collect(Collectors.toList());
            }
            return ResponseEntity.ok(backends);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage()));
        } catch (Exception e) {
            return internalError("listing backends", e);
        }
    }

    @GetMapping("/orphans")
    public ResponseEntity<Object> listOrphans(@RequestParam(value = "cluster", required = false) String cluster) {
        try {
            return ResponseEntity.ok(nodeRegistry.findOrphanedBackends(cluster));
        } catch (Exception e) {
            return internalError("listing orphaned backends", e);
        }
    }

    private ResponseEntity<Object> internalError(String action, Exception e) {
        ErrorResponse error = ErrorResponse.internalError();
        log.error("Error {} {}: {}", error.getId(), action, e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
