package io.fleetcontroller.api.handlers;

import io.fleetcontroller.api.models.responses.ErrorResponse;
import io.fleetcontroller.api.models.responses.TerminationCandidatesResponse;
import io.fleetcontroller.models.Drone;
import io.fleetcontroller.models.TerminationCandidate;
import io.fleetcontroller.registry.NodeRegistry;
import io.fleetcontroller.watchdog.TerminationWatchdog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * REST API handler for drone operations.
 *
 * Supported operations:
 * - POST /{cluster}/drone/{drone}/drain - remove the drone from placement
 * - GET /{cluster}/drone/{drone}/termination-candidates?as_of=... - backends the watchdog would terminate
 */
@Slf4j
@RestController
@RequestMapping("/{cluster}/drone/{drone}")
public class DroneHandler {

    private final NodeRegistry nodeRegistry;
    private final TerminationWatchdog watchdog;
    private final Clock clock;

    public DroneHandler(NodeRegistry nodeRegistry, TerminationWatchdog watchdog, Clock clock) {
        this.nodeRegistry = nodeRegistry;
        this.watchdog = watchdog;
        this.clock = clock;
    }

    /**
     * Drain a drone. Running backends are not affected.
     * POST /{cluster}/drone/{drone}/drain
     */
    @PostMapping("/drain")
    public ResponseEntity<Object> drain(@PathVariable String cluster, @PathVariable String drone) {
        try {
            log.info("Draining drone '{}' in cluster '{}'", drone, cluster);
            Drone drained = nodeRegistry.drain(cluster, drone);
            return ResponseEntity.ok(drained);
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Drone '" + drone + "'"));
        } catch (Exception e) {
            ErrorResponse error = ErrorResponse.internalError();
            log.error("Error {} draining drone '{}' in cluster '{}': {}", error.getId(), drone, cluster, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
        }
    }

    /**
     * GET /{cluster}/drone/{drone}/termination-candidates
     */
    @GetMapping("/termination-candidates")
    public ResponseEntity<Object> terminationCandidates(
            @PathVariable String cluster,
            @PathVariable String drone,
            @RequestParam(value = "as_of", required = false) String asOf) {
        try {
            Instant evaluatedAt = asOf != null ? Instant.parse(asOf) : clock.instant();
            log.debug("Getting termination candidates for drone '{}' in cluster '{}' as of {}", drone, cluster, evaluatedAt);
            List<TerminationCandidate> candidates = watchdog.terminationCandidates(cluster, drone, evaluatedAt);
            return ResponseEntity.ok(TerminationCandidatesResponse.builder()
                .cluster(cluster)
                .drone(drone)
                .asOf(evaluatedAt)
                .candidates(candidates)
                .build());
        } catch (DateTimeParseException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.badRequest("Invalid as_of timestamp: " + asOf));
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Drone '" + drone + "'"));
        } catch (Exception e) {
            ErrorResponse error = ErrorResponse.internalError();
            log.error("Error {} getting termination candidates for drone '{}': {}", error.getId(), drone, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
        }
    }
}
