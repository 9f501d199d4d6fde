package io.fleetcontroller.config;

import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.PropertyUtils;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static io.fleetcontroller.config.Constants.*;

/**
 * Configuration for the fleet controller.
 * Loads configuration from application.yml with fallbacks to constants.
 * <p>
 * TODO: Move to Spring's @ConfigurationProperties so environment overrides apply to every key,
 * not only the controller id.
 */
@Slf4j
@Getter
public class FleetControllerConfig {

    private final String controllerId;
    private final String defaultCluster;
    private final String urlScheme;
    private final String[] etcdEndpoints;
    private final long heartbeatStalenessSeconds;
    private final long droneTerminateAfterSeconds;
    private final long watchdogIntervalSeconds;
    private final Long hardTerminateGraceSeconds;
    private final long eventRetentionSeconds;
    private final long commandTtlSeconds;
    private final long reportRescanSeconds;
    private final long streamTimeoutSeconds;
    private final long maxWaitSeconds;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "CONTROLLER_CONFIG_FILE";
    private static final String CONTROLLER_ID_ENV_VAR = "CONTROLLER_ID";

    public FleetControllerConfig() {
        ConfigModel config = loadYamlConfig();

        this.controllerId = parseControllerId(config);
        this.defaultCluster = parseDefaultCluster(config);
        this.urlScheme = parseUrlScheme(config);
        this.etcdEndpoints = parseEndpoints(config);
        this.heartbeatStalenessSeconds = parsePositive(
            config.getDrone() != null ? config.getDrone().getHeartbeat_staleness_seconds() : null,
            DEFAULT_HEARTBEAT_STALENESS_SECONDS, "drone.heartbeat_staleness_seconds");
        this.droneTerminateAfterSeconds = parsePositive(
            config.getDrone() != null ? config.getDrone().getTerminate_after_seconds() : null,
            DEFAULT_DRONE_TERMINATE_AFTER_SECONDS, "drone.terminate_after_seconds");
        this.watchdogIntervalSeconds = parsePositive(
            config.getWatchdog() != null ? config.getWatchdog().getInterval_seconds() : null,
            DEFAULT_WATCHDOG_INTERVAL_SECONDS, "watchdog.interval_seconds");
        this.hardTerminateGraceSeconds = parseOptionalPositive(
            config.getWatchdog() != null ? config.getWatchdog().getHard_terminate_grace_seconds() : null,
            "watchdog.hard_terminate_grace_seconds");
        this.eventRetentionSeconds = parsePositive(
            config.getEvents() != null ? config.getEvents().getRetention_seconds() : null,
            DEFAULT_EVENT_RETENTION_SECONDS, "events.retention_seconds");
        this.commandTtlSeconds = parsePositive(
            config.getBus() != null ? config.getBus().getCommand_ttl_seconds() : null,
            DEFAULT_COMMAND_TTL_SECONDS, "bus.command_ttl_seconds");
        this.reportRescanSeconds = parsePositive(
            config.getBus() != null ? config.getBus().getReport_rescan_seconds() : null,
            DEFAULT_REPORT_RESCAN_SECONDS, "bus.report_rescan_seconds");
        this.streamTimeoutSeconds = config.getStream() != null && config.getStream().getTimeout_seconds() != null
            && config.getStream().getTimeout_seconds() >= 0
            ? config.getStream().getTimeout_seconds() : DEFAULT_STREAM_TIMEOUT_SECONDS;
        this.maxWaitSeconds = parsePositive(
            config.getStream() != null ? config.getStream().getMax_wait_seconds() : null,
            DEFAULT_MAX_WAIT_SECONDS, "stream.max_wait_seconds");

        log.info("Loaded fleet controller config - controller: {}, etcd endpoints: {}, default cluster: {}, "
                + "watchdog interval: {}s, hard terminate grace: {}",
                controllerId, String.join(", ", etcdEndpoints), defaultCluster, watchdogIntervalSeconds,
                hardTerminateGraceSeconds != null ? hardTerminateGraceSeconds + "s" : "disabled");
    }

    @Builder(builderMethodName = "builder")
    private FleetControllerConfig(String controllerId,
                                  String defaultCluster,
                                  String urlScheme,
                                  String[] etcdEndpoints,
                                  long heartbeatStalenessSeconds,
                                  long droneTerminateAfterSeconds,
                                  long watchdogIntervalSeconds,
                                  Long hardTerminateGraceSeconds,
                                  long eventRetentionSeconds,
                                  long commandTtlSeconds,
                                  long reportRescanSeconds,
                                  long streamTimeoutSeconds,
                                  long maxWaitSeconds) {
        this.controllerId = controllerId;
        this.defaultCluster = defaultCluster;
        this.urlScheme = urlScheme;
        this.etcdEndpoints = etcdEndpoints;
        this.heartbeatStalenessSeconds = heartbeatStalenessSeconds;
        this.droneTerminateAfterSeconds = droneTerminateAfterSeconds;
        this.watchdogIntervalSeconds = watchdogIntervalSeconds;
        this.hardTerminateGraceSeconds = hardTerminateGraceSeconds;
        this.eventRetentionSeconds = eventRetentionSeconds;
        this.commandTtlSeconds = commandTtlSeconds;
        this.reportRescanSeconds = reportRescanSeconds;
        this.streamTimeoutSeconds = streamTimeoutSeconds;
        this.maxWaitSeconds = maxWaitSeconds;
    }

    /**
     * Builder pre-populated with the constant defaults, for programmatic construction.
     */
    public static FleetControllerConfigBuilder defaults() {
        return builder()
            .controllerId(DEFAULT_CONTROLLER_ID)
            .urlScheme(DEFAULT_URL_SCHEME)
            .etcdEndpoints(new String[]{DEFAULT_ETCD_ENDPOINT})
            .heartbeatStalenessSeconds(DEFAULT_HEARTBEAT_STALENESS_SECONDS)
            .droneTerminateAfterSeconds(DEFAULT_DRONE_TERMINATE_AFTER_SECONDS)
            .watchdogIntervalSeconds(DEFAULT_WATCHDOG_INTERVAL_SECONDS)
            .eventRetentionSeconds(DEFAULT_EVENT_RETENTION_SECONDS)
            .commandTtlSeconds(DEFAULT_COMMAND_TTL_SECONDS)
            .reportRescanSeconds(DEFAULT_REPORT_RESCAN_SECONDS)
            .streamTimeoutSeconds(DEFAULT_STREAM_TIMEOUT_SECONDS)
            .maxWaitSeconds(DEFAULT_MAX_WAIT_SECONDS);
    }

    public Optional<String> getDefaultCluster() {
        return Optional.ofNullable(defaultCluster);
    }

    public Duration getHeartbeatStaleness() {
        return Duration.ofSeconds(heartbeatStalenessSeconds);
    }

    public Duration getDroneTerminateAfter() {
        return Duration.ofSeconds(droneTerminateAfterSeconds);
    }

    public Optional<Duration> getHardTerminateGrace() {
        return Optional.ofNullable(hardTerminateGraceSeconds).map(Duration::ofSeconds);
    }

    public Duration getReportRescanInterval() {
        return Duration.ofSeconds(reportRescanSeconds);
    }

    public Duration getMaxWait() {
        return Duration.ofSeconds(maxWaitSeconds);
    }

    public Duration getEventRetention() {
        return Duration.ofSeconds(eventRetentionSeconds);
    }

    private ConfigModel loadYamlConfig() {
        LoaderOptions loaderOptions = new LoaderOptions();
        Constructor constructor = new Constructor(ConfigModel.class, loaderOptions);
        // application.yml also carries Spring keys (server, logging, management) that are not modelled here
        PropertyUtils propertyUtils = new PropertyUtils();
        propertyUtils.setSkipMissingProperties(true);
        constructor.setPropertyUtils(propertyUtils);
        Yaml yaml = new Yaml(constructor);
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(EXTERNAL_CONFIG_ENV_VAR);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", DEFAULT_CONFIG_FILE_CLASSPATH);
            inputStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try {
            ConfigModel config = yaml.load(inputStream);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        } finally {
            try {
                inputStream.close();
            } catch (IOException e) {
                log.error("Error closing config file input stream: {}", e.getMessage());
            }
        }
    }

    private String parseControllerId(ConfigModel config) {
        String fromEnv = System.getenv(CONTROLLER_ID_ENV_VAR);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        if (config.getController() != null && config.getController().getId() != null
                && !config.getController().getId().isBlank()) {
            return config.getController().getId().trim();
        }
        return DEFAULT_CONTROLLER_ID;
    }

    private String parseDefaultCluster(ConfigModel config) {
        if (config.getController() != null && config.getController().getDefault_cluster() != null
                && !config.getController().getDefault_cluster().isBlank()) {
            return config.getController().getDefault_cluster().trim();
        }
        return null;
    }

    private String parseUrlScheme(ConfigModel config) {
        if (config.getController() != null && config.getController().getUrl_scheme() != null) {
            String scheme = config.getController().getUrl_scheme().trim();
            if (scheme.equals("http") || scheme.equals("https")) {
                return scheme;
            }
            log.warn("Unsupported url scheme '{}', using default '{}'", scheme, DEFAULT_URL_SCHEME);
        }
        return DEFAULT_URL_SCHEME;
    }

    private String[] parseEndpoints(ConfigModel config) {
        try {
            if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null) {
                var endpoints = config.getEtcd().getEndpoints();
                if (!endpoints.isEmpty()) {
                    return endpoints.toArray(new String[0]);
                }
            }
        } catch (Exception e) {
            log.warn("Failed to parse etcd endpoints from config, using defaults: {}", e.getMessage());
        }

        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private long parsePositive(Long value, long defaultValue, String key) {
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            log.warn("Ignoring non-positive value {} for {}, using default {}", value, key, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private Long parseOptionalPositive(Long value, String key) {
        if (value != null && value <= 0) {
            log.warn("Ignoring non-positive value {} for {}, feature disabled", value, key);
            return null;
        }
        return value;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Controller controller;
        private Etcd etcd;
        private Drone drone;
        private Watchdog watchdog;
        private Events events;
        private Bus bus;
        private Stream stream;
    }

    @Data
    public static class Controller {
        private String id;
        private String default_cluster;
        private String url_scheme;
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
    }

    @Data
    public static class Drone {
        private Long heartbeat_staleness_seconds;
        private Long terminate_after_seconds;
    }

    @Data
    public static class Watchdog {
        private Long interval_seconds;
        private Long hard_terminate_grace_seconds;
    }

    @Data
    public static class Events {
        private Long retention_seconds;
    }

    @Data
    public static class Bus {
        private Long command_ttl_seconds;
        private Long report_rescan_seconds;
    }

    @Data
    public static class Stream {
        private Long timeout_seconds;
        private Long max_wait_seconds;
    }
}
