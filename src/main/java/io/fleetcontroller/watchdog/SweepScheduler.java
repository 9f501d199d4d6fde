package io.fleetcontroller.watchdog;

import io.fleetcontroller.events.EventLog;
import io.fleetcontroller.registry.NodeRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the periodic maintenance sweep: stale drones, termination watchdog and event pruning.
 * Every controller instance runs its own sweep; all writes go through compare-and-set, so
 * overlapping sweeps are harmless.
 */
@Slf4j
public class SweepScheduler {

    private final NodeRegistry nodeRegistry;
    private final TerminationWatchdog watchdog;
    private final EventLog eventLog;
    private final Duration eventRetention;
    private final long intervalSeconds;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private volatile boolean isRunning = false;

    public SweepScheduler(NodeRegistry nodeRegistry,
                          TerminationWatchdog watchdog,
                          EventLog eventLog,
                          Duration eventRetention,
                          long intervalSeconds,
                          Clock clock) {
        this.nodeRegistry = nodeRegistry;
        this.watchdog = watchdog;
        this.eventLog = eventLog;
        this.eventRetention = eventRetention;
        this.intervalSeconds = intervalSeconds;
        this.clock = clock;
        this.scheduler = Executors.newScheduledThreadPool(1);
    }

    public void start() {
        log.info("Starting sweep scheduler with interval {}s", intervalSeconds);
        isRunning = true;
        scheduler.scheduleWithFixedDelay(
                this::runSweep,
                intervalSeconds,
                intervalSeconds,
                TimeUnit.SECONDS
        );
    }

    public void stop() {
        log.info("Stopping sweep scheduler");
        isRunning = false;
        scheduler.shutdown();
    }

    public boolean isRunning() {
        return isRunning;
    }

    /**
     * One maintenance pass. Never throws, so the scheduled loop keeps running.
     */
    void runSweep() {
        Instant now = clock.instant();
        try {
            nodeRegistry.sweepStaleDrones(now);
            watchdog.runOnce(now);
        } catch (Exception e) {
            log.error("Error in sweep loop: {}", e.getMessage(), e);
        }

        try {
            eventLog.pruneOlderThan(now.minus(eventRetention));
        } catch (Exception e) {
            log.error("Failed to prune events: {}", e.getMessage(), e);
        }
    }
}
