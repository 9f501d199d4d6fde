package io.fleetcontroller.metrics;

/**
 * Constants for metrics names and tags used in the Fleet Controller.
 */
public class MetricsConstants {
    public final static String CONNECT_REQUESTS_METRIC_NAME = "connect_requests";
    public final static String CONNECT_LATENCY_METRIC_NAME = "connect_latency";
    public final static String SPAWN_DISPATCH_FAILURES_METRIC_NAME = "spawn_dispatch_failures";
    public final static String BACKEND_STATUS_APPLIED_METRIC_NAME = "backend_status_applied";
    public final static String WATCHDOG_TERMINATIONS_METRIC_NAME = "watchdog_terminations";
    public final static String WATCHDOG_CANDIDATES_METRIC_NAME = "watchdog_candidates";
    public final static String DRONES_TERMINATED_METRIC_NAME = "drones_terminated";
    public final static String ORPHANED_BACKENDS_METRIC_NAME = "orphaned_backends";
    public final static String OUTCOME_TAG = "outcome";
    public final static String STATUS_TAG = "status";
    public final static String REASON_TAG = "reason";
    public final static String CLUSTER_TAG = "cluster";
    public final static String OUTCOME_SPAWNED = "spawned";
    public final static String OUTCOME_EXISTING = "existing";

    private MetricsConstants() {}
}
