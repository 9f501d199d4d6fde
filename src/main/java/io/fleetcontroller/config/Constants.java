package io.fleetcontroller.config;

/**
 * Application constants.
 */
public final class Constants {
    
    private Constants() {
        // Utility class
    }
    
    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final String DEFAULT_CONTROLLER_ID = "controller-1";
    public static final String DEFAULT_URL_SCHEME = "https";
    public static final long DEFAULT_HEARTBEAT_STALENESS_SECONDS = 30L;
    public static final long DEFAULT_DRONE_TERMINATE_AFTER_SECONDS = 60L;
    public static final long DEFAULT_WATCHDOG_INTERVAL_SECONDS = 10L;
    public static final long DEFAULT_EVENT_RETENTION_SECONDS = 24 * 60 * 60L;
    public static final long DEFAULT_COMMAND_TTL_SECONDS = 300L;
    public static final long DEFAULT_STREAM_TIMEOUT_SECONDS = 0L;
    public static final long DEFAULT_REPORT_RESCAN_SECONDS = 10L;
    public static final long DEFAULT_MAX_WAIT_SECONDS = 300L;
    
    // Bounded re-read/re-apply loop for compare-and-set updates outside connect
    public static final int MAX_CAS_ATTEMPTS = 5;
    
    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_FLEET_ROOT = "fleet";
    public static final String PATH_CLUSTERS = "clusters";
    public static final String PATH_DRONES = "drones";
    public static final String PATH_BACKENDS = "backends";
    public static final String PATH_KEYS = "keys";
    public static final String PATH_EVENTS = "events";
    public static final String PATH_GLOBAL_EVENTS = "_global";
    public static final String PATH_BUS = "bus";
    public static final String PATH_COMMANDS = "commands";
    public static final String PATH_REPORTS = "reports";
    
    // Id prefixes
    public static final String BACKEND_ID_PREFIX = "ba-";
    public static final String DRONE_ID_PREFIX = "dr-";
    public static final int GENERATED_ID_LENGTH = 14;
    
    // Admin state values
    public static final String ADMIN_STATE_NORMAL = "NORMAL";
    public static final String ADMIN_STATE_DRAIN = "DRAIN";
    
    // Event kinds
    public static final String EVENT_BACKEND_CREATED = "backend_created";
    public static final String EVENT_BACKEND_STATUS = "backend_status";
    public static final String EVENT_KEY_RELEASED = "key_released";
    public static final String EVENT_DRONE_REGISTERED = "drone_registered";
    public static final String EVENT_DRONE_STATUS = "drone_status";
    public static final String EVENT_DRONE_DRAINED = "drone_drained";
}
