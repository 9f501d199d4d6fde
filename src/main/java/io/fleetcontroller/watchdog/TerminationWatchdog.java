package io.fleetcontroller.watchdog;

import io.fleetcontroller.enums.BackendStatus;
import io.fleetcontroller.enums.TerminationReason;
import io.fleetcontroller.lifecycle.BackendLifecycle;
import io.fleetcontroller.metrics.MetricsProvider;
import io.fleetcontroller.models.Backend;
import io.fleetcontroller.models.TerminationCandidate;
import io.fleetcontroller.store.FleetStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

import static io.fleetcontroller.metrics.MetricsConstants.REASON_TAG;
import static io.fleetcontroller.metrics.MetricsConstants.WATCHDOG_CANDIDATES_METRIC_NAME;
import static io.fleetcontroller.metrics.MetricsConstants.WATCHDOG_TERMINATIONS_METRIC_NAME;

/**
 * Periodic reclamation of expired and idle backends.
 * <p>
 * A backend is a candidate when its expiration time is strictly before {@code asOf}, or when it
 * has been idle strictly longer than its allowed idle time. Candidates get a soft terminate.
 * When a hard-terminate grace is configured, a backend still Terminating that long after its
 * status changed is escalated to a hard terminate.
 */
@Slf4j
public class TerminationWatchdog {

    private final FleetStore fleetStore;
    private final BackendLifecycle lifecycle;
    private final MetricsProvider metricsProvider;
    private final Duration hardTerminateGrace;

    /**
     * @param hardTerminateGrace null disables escalation
     */
    public TerminationWatchdog(FleetStore fleetStore, BackendLifecycle lifecycle,
                               MetricsProvider metricsProvider, Duration hardTerminateGrace) {
        this.fleetStore = fleetStore;
        this.lifecycle = lifecycle;
        this.metricsProvider = metricsProvider;
        this.hardTerminateGrace = hardTerminateGrace;
    }

    /**
     * One sweep over every backend. Failures on one backend are logged and the sweep continues.
     *
     * @return number of terminate requests issued
     */
    public int runOnce(Instant asOf) {
        int issued = 0;
        List<Backend> backends;
        try {
            backends = fleetStore.getAllBackends();
        } catch (Exception e) {
            log.error("Watchdog - Failed to list backends: {}", e.getMessage(), e);
            return 0;
        }

        int candidates = 0;
        for (Backend backend : backends) {
            Optional<TerminationCandidate> candidate = evaluate(backend, asOf);
            if (candidate.isEmpty()) {
                continue;
            }
            candidates++;
            TerminationReason reason = candidate.get().getReason();
            boolean hard = reason == TerminationReason.ESCALATION;
            try {
                log.info("Watchdog - {} terminating backend {} in cluster {}: {} ({}s over)", hard ? "Hard" : "Soft",
                    backend.getId(), backend.getCluster(), reason.getValue(), candidate.get().getOverageSeconds());
                lifecycle.terminate(backend.getCluster(), backend.getId(), hard);
                metricsProvider.counter(WATCHDOG_TERMINATIONS_METRIC_NAME, Map.of(REASON_TAG, reason.getValue()))
                    .increment();
                issued++;
            } catch (Exception e) {
                log.error("Watchdog - Failed to terminate backend {}: {}", backend.getId(), e.getMessage(), e);
            }
        }

        metricsProvider.gauge(WATCHDOG_CANDIDATES_METRIC_NAME, Map.of()).set(candidates);
        log.debug("Watchdog - Sweep as of {} found {} candidates, issued {} terminates", asOf, candidates, issued);
        return issued;
    }

    /**
     * Candidates on the current incarnation of one drone, as reported to operators.
     * Backends left behind by an earlier incarnation with the same name are not included.
     *
     * @param droneName null for every backend in the cluster
     * @throws NoSuchElementException if the drone is not registered in the cluster
     */
    public List<TerminationCandidate> terminationCandidates(String cluster, String droneName, Instant asOf)
            throws Exception {
        String droneId = null;
        if (droneName != null) {
            droneId = fleetStore.getDrone(cluster, droneName)
                .map(drone -> drone.getValue().getId())
                .orElseThrow(() -> new NoSuchElementException("No such drone " + droneName + " in cluster " + cluster));
        }

        List<TerminationCandidate> result = new ArrayList<>();
        for (Backend backend : fleetStore.getBackends(cluster)) {
            if (droneId != null && !droneId.equals(backend.getDroneId())) {
                continue;
            }
            evaluate(backend, asOf).ifPresent(result::add);
        }
        return result;
    }

    /**
     * Decide whether a backend should be terminated as of the given instant.
     */
    public Optional<TerminationCandidate> evaluate(Backend backend, Instant asOf) {
        BackendStatus status = backend.getStatus();
        if (status.isTerminal() || status == BackendStatus.HARD_TERMINATING) {
            return Optional.empty();
        }

        if (status == BackendStatus.TERMINATING) {
            if (hardTerminateGrace == null || backend.getStatusTime() == null) {
                return Optional.empty();
            }
            Instant deadline = backend.getStatusTime().plus(hardTerminateGrace);
            if (deadline.isBefore(asOf)) {
                return Optional.of(candidate(backend, TerminationReason.ESCALATION,
                    Duration.between(deadline, asOf)));
            }
            return Optional.empty();
        }

        if (backend.getExpirationTime() != null && backend.getExpirationTime().isBefore(asOf)) {
            return Optional.of(candidate(backend, TerminationReason.EXPIRED,
                Duration.between(backend.getExpirationTime(), asOf)));
        }

        if (backend.getAllowedIdleSeconds() != null) {
            Duration idle = backend.idleTime(asOf);
            Duration allowed = Duration.ofSeconds(backend.getAllowedIdleSeconds());
            if (idle.compareTo(allowed) > 0) {
                return Optional.of(candidate(backend, TerminationReason.IDLE, idle.minus(allowed)));
            }
        }
        return Optional.empty();
    }

    private TerminationCandidate candidate(Backend backend, TerminationReason reason, Duration overage) {
        return TerminationCandidate.builder()
            .backendId(backend.getId())
            .cluster(backend.getCluster())
            .droneId(backend.getDroneId())
            .status(backend.getStatus())
            .reason(reason)
            .overageSeconds(overage.getSeconds())
            .build();
    }
}
