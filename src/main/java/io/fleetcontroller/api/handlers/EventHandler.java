package io.fleetcontroller.api.handlers;

import io.fleetcontroller.api.models.responses.ErrorResponse;
import io.fleetcontroller.config.FleetControllerConfig;
import io.fleetcontroller.events.BackendStatusStreams;
import io.fleetcontroller.events.EventLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST API handler for the event log.
 *
 * Supported operations:
 * - GET /events?key=...&limit=100 - recent events, optionally for one entity
 * - GET /events/stream - server-sent stream of every event
 */
@Slf4j
@RestController
@RequestMapping("/events")
public class EventHandler {

    private static final int MAX_LIMIT = 1000;

    private final EventLog eventLog;
    private final BackendStatusStreams statusStreams;
    private final FleetControllerConfig config;

    public EventHandler(EventLog eventLog, BackendStatusStreams statusStreams, FleetControllerConfig config) {
        this.eventLog = eventLog;
        this.statusStreams = statusStreams;
        this.config = config;
    }

    @GetMapping
    public ResponseEntity<Object> recentEvents(
            @RequestParam(value = "key", required = false) String key,
            @RequestParam(value = "limit", defaultValue = "100") int limit) {
        if (limit <= 0 || limit > MAX_LIMIT) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.badRequest("limit must be between 1 and " + MAX_LIMIT));
        }
        try {
            return ResponseEntity.ok(eventLog.recent(key, limit));
        } catch (Exception e) {
            ErrorResponse error = ErrorResponse.internalError();
            log.error("Error {} reading events for key '{}': {}", error.getId(), key, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
        }
    }

    /**
     * Global tail. Consumers must tolerate duplicates and reordering.
     */
    @GetMapping("/stream")
    public SseEmitter streamEvents() {
        log.info("Opening global event stream");
        return EventStreamSupport.stream(config.getStreamTimeoutSeconds(), statusStreams::streamAll, event -> false);
    }
}
