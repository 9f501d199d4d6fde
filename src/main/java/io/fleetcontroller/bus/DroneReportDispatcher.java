package io.fleetcontroller.bus;

import io.fleetcontroller.events.Subscription;
import io.fleetcontroller.lifecycle.BackendLifecycle;
import io.fleetcontroller.models.DroneReport;
import io.fleetcontroller.registry.NodeRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.NoSuchElementException;

/**
 * Routes drone reports from the bus to the node registry and the lifecycle state machine.
 * Every handler is idempotent, so redelivered reports are harmless.
 */
@Slf4j
@Component
public class DroneReportDispatcher {

    private final DroneBus droneBus;
    private final NodeRegistry nodeRegistry;
    private final BackendLifecycle lifecycle;
    private final Clock clock;

    private Subscription subscription;

    @Autowired
    public DroneReportDispatcher(DroneBus droneBus, NodeRegistry nodeRegistry, BackendLifecycle lifecycle, Clock clock) {
        this.droneBus = droneBus;
        this.nodeRegistry = nodeRegistry;
        this.lifecycle = lifecycle;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        try {
            subscription = droneBus.consumeReports(this::handle);
            log.info("DroneReportDispatcher started");
        } catch (Exception e) {
            log.error("Failed to start consuming drone reports", e);
            throw new RuntimeException("Failed to start consuming drone reports", e);
        }
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
    }

    /**
     * Handle one report. Reports that can never succeed (unknown backend, missing fields) are
     * logged and dropped; any other failure is rethrown so the bus keeps the report.
     */
    public void handle(DroneReport report) {
        try {
            dispatch(report);
        } catch (NoSuchElementException | IllegalArgumentException e) {
            log.warn("Dropping {} report {} from {}/{}: {}", report.getType(), report.getId(), report.getCluster(),
                report.getDroneName(), e.getMessage());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to handle " + report.getType() + " report " + report.getId(), e);
        }
    }

    private void dispatch(DroneReport report) throws Exception {
        if (report.getType() == null || report.getCluster() == null) {
            throw new IllegalArgumentException("report has no type or cluster");
        }
        log.debug("Handling {} report {} from {}/{}", report.getType(), report.getId(), report.getCluster(),
            report.getDroneName());

        switch (report.getType()) {
            case REGISTER -> nodeRegistry.register(report.getCluster(), requireDroneName(report),
                report.getVersion(), report.getHash());
            case HEARTBEAT -> nodeRegistry.heartbeat(report.getCluster(), requireDroneName(report));
            case SHUTDOWN -> nodeRegistry.shutdown(report.getCluster(), requireDroneName(report));
            case BACKEND_STATUS -> {
                if (report.getStatus() == null) {
                    throw new IllegalArgumentException("backend status report without status");
                }
                lifecycle.applyStatus(report.getCluster(), requireBackendId(report), report.getStatus());
            }
            case BACKEND_KEEPALIVE -> lifecycle.recordKeepalive(report.getCluster(), requireBackendId(report),
                keepaliveTime(report));
        }
    }

    /**
     * Drone supplied timestamp, capped at the controller's clock so a skewed drone cannot
     * keep a backend alive into the future.
     */
    private Instant keepaliveTime(DroneReport report) {
        Instant now = clock.instant();
        if (report.getTimestamp() == null || report.getTimestamp().isAfter(now)) {
            return now;
        }
        return report.getTimestamp();
    }

    private static String requireDroneName(DroneReport report) {
        if (report.getDroneName() == null || report.getDroneName().isBlank()) {
            throw new IllegalArgumentException("report has no drone name");
        }
        return report.getDroneName();
    }

    private static String requireBackendId(DroneReport report) {
        if (report.getBackendId() == null || report.getBackendId().isBlank()) {
            throw new IllegalArgumentException("report has no backend id");
        }
        return report.getBackendId();
    }
}
