package io.fleetcontroller.api.handlers;

import io.fleetcontroller.api.models.responses.BackendStatusResponse;
import io.fleetcontroller.api.models.responses.ErrorResponse;
import io.fleetcontroller.config.FleetControllerConfig;
import io.fleetcontroller.enums.BackendStatus;
import io.fleetcontroller.events.BackendStatusStreams;
import io.fleetcontroller.events.FleetEvents;
import io.fleetcontroller.lifecycle.BackendLifecycle;
import io.fleetcontroller.lifecycle.StatusUpdate;
import io.fleetcontroller.models.Backend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * REST API handler for backend lifecycle operations.
 *
 * Supported operations:
 * - POST /{cluster}/backend/{backendId}/soft-terminate - drain and stop
 * - POST /{cluster}/backend/{backendId}/hard-terminate - kill immediately
 * - POST /{cluster}/backend/{backendId}/force-terminate - mark an orphaned backend Terminated
 * - GET /{cluster}/backend/{backendId}/status - current status
 * - GET /{cluster}/backend/{backendId}/wait?status=Ready - wait until the status is reached
 * - GET /{cluster}/backend/{backendId}/status-stream - server-sent backend events
 */
@Slf4j
@RestController
@RequestMapping("/{cluster}/backend/{backendId}")
public class BackendHandler {

    private final BackendLifecycle lifecycle;
    private final BackendStatusStreams statusStreams;
    private final FleetControllerConfig config;

    public BackendHandler(BackendLifecycle lifecycle, BackendStatusStreams statusStreams, FleetControllerConfig config) {
        this.lifecycle = lifecycle;
        this.statusStreams = statusStreams;
        this.config = config;
    }

    @PostMapping("/soft-terminate")
    public ResponseEntity<Object> softTerminate(@PathVariable String cluster, @PathVariable String backendId) {
        return terminate(cluster, backendId, false);
    }

    @PostMapping("/hard-terminate")
    public ResponseEntity<Object> hardTerminate(@PathVariable String cluster, @PathVariable String backendId) {
        return terminate(cluster, backendId, true);
    }

    /**
     * Force-terminate an orphaned backend.
     * POST /{cluster}/backend/{backendId}/force-terminate
     */
    @PostMapping("/force-terminate")
    public ResponseEntity<Object> forceTerminate(@PathVariable String cluster, @PathVariable String backendId) {
        try {
            log.info("Force terminating backend '{}' in cluster '{}'", backendId, cluster);
            StatusUpdate update = lifecycle.forceTerminate(cluster, backendId);
            return ResponseEntity.ok(BackendStatusResponse.from(update));
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Backend '" + backendId + "'"));
        } catch (IllegalStateException e) {
            log.warn("Refused force terminate of backend '{}': {}", backendId, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.conflict(e.getMessage()));
        } catch (Exception e) {
            return internalError("force terminating backend '" + backendId + "'", e);
        }
    }

    /**
     * GET /{cluster}/backend/{backendId}/status
     */
    @GetMapping("/status")
    public ResponseEntity<Object> getStatus(@PathVariable String cluster, @PathVariable String backendId) {
        try {
            log.debug("Getting status of backend '{}' in cluster '{}'", backendId, cluster);
            Backend backend = lifecycle.getBackend(cluster, backendId);
            return ResponseEntity.ok(BackendStatusResponse.from(backend));
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Backend '" + backendId + "'"));
        } catch (Exception e) {
            return internalError("getting status of backend '" + backendId + "'", e);
        }
    }

    /**
     * Wait until the backend reaches at least the requested status.
     * GET /{cluster}/backend/{backendId}/wait?status=Ready&timeout_seconds=30
     * <p>
     * The wait is always bounded by {@code stream.max_wait_seconds}: an abandoned request
     * does not cancel the future, so the bound is what releases its subscription.
     */
    @GetMapping("/wait")
    public CompletableFuture<ResponseEntity<Object>> waitForStatus(
            @PathVariable String cluster,
            @PathVariable String backendId,
            @RequestParam(value = "status", defaultValue = "Ready") String status,
            @RequestParam(value = "timeout_seconds", required = false) Long timeoutSeconds) {
        BackendStatus target;
        try {
            target = BackendStatus.fromString(status);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(
                ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage())));
        }

        log.info("Waiting for backend '{}' in cluster '{}' to reach {}", backendId, cluster, target);
        Duration maxWait = config.getMaxWait();
        Duration timeout = timeoutSeconds != null && timeoutSeconds > 0 && timeoutSeconds < maxWait.getSeconds()
            ? Duration.ofSeconds(timeoutSeconds) : maxWait;
        return statusStreams.awaitStatus(cluster, backendId, target, timeout)
            .handle((reached, error) -> {
                if (error == null) {
                    return ResponseEntity.ok((Object) BackendStatusResponse.builder()
                        .backendId(backendId)
                        .cluster(cluster)
                        .status(reached)
                        .build());
                }
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
                if (cause instanceof NoSuchElementException) {
                    return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body((Object) ErrorResponse.notFound("Backend '" + backendId + "'"));
                }
                if (cause instanceof TimeoutException) {
                    return ResponseEntity.status(HttpStatus.REQUEST_TIMEOUT)
                        .body((Object) ErrorResponse.timeout("Backend '" + backendId + "' did not reach " + target.getValue()));
                }
                return internalError("waiting for backend '" + backendId + "'", cause);
            });
    }

    /**
     * Server-sent events for one backend; the stream ends once the backend is Terminated.
     * GET /{cluster}/backend/{backendId}/status-stream
     */
    @GetMapping("/status-stream")
    public SseEmitter streamStatus(@PathVariable String cluster, @PathVariable String backendId) {
        log.info("Opening status stream for backend '{}' in cluster '{}'", backendId, cluster);
        return EventStreamSupport.stream(
            config.getStreamTimeoutSeconds(),
            listener -> statusStreams.streamBackend(backendId, listener),
            event -> {
                BackendStatus status = FleetEvents.statusOf(event);
                return status != null && status.isTerminal();
            });
    }

    private ResponseEntity<Object> terminate(String cluster, String backendId, boolean hard) {
        try {
            log.info("{} terminating backend '{}' in cluster '{}'", hard ? "Hard" : "Soft", backendId, cluster);
            StatusUpdate update = lifecycle.terminate(cluster, backendId, hard);
            return ResponseEntity.ok(BackendStatusResponse.from(update));
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Backend '" + backendId + "'"));
        } catch (Exception e) {
            return internalError("terminating backend '" + backendId + "'", e);
        }
    }

    private ResponseEntity<Object> internalError(String action, Throwable e) {
        ErrorResponse error = ErrorResponse.internalError();
        log.error("Error {} {}: {}", error.getId(), action, e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
