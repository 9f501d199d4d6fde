package io.fleetcontroller.store;

import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import static io.fleetcontroller.config.Constants.*;

/**
 * Centralized etcd path resolver for the fleet key spaces.
 * User supplied segments (cluster names, keys, drone names) are URL-encoded so they
 * never introduce extra path levels.
 */
@Component
public class EtcdPathResolver {

    // =================================================================
    // CLUSTER TABLES
    // =================================================================

    /**
     * Pattern: /fleet/clusters
     */
    public String getClustersPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_FLEET_ROOT, PATH_CLUSTERS).toString();
    }

    /**
     * Pattern: /fleet/clusters/<cluster>/drones
     */
    public String getDronesPrefix(String cluster) {
        return Paths.get(getClustersPrefix(), encode(cluster), PATH_DRONES).toString();
    }

    /**
     * Pattern: /fleet/clusters/<cluster>/drones/<drone-name>
     */
    public String getDronePath(String cluster, String droneName) {
        return Paths.get(getDronesPrefix(cluster), encode(droneName)).toString();
    }

    /**
     * Pattern: /fleet/clusters/<cluster>/backends
     */
    public String getBackendsPrefix(String cluster) {
        return Paths.get(getClustersPrefix(), encode(cluster), PATH_BACKENDS).toString();
    }

    /**
     * Pattern: /fleet/clusters/<cluster>/backends/<backend-id>
     */
    public String getBackendPath(String cluster, String backendId) {
        return Paths.get(getBackendsPrefix(cluster), encode(backendId)).toString();
    }

    /**
     * Pattern: /fleet/clusters/<cluster>/keys/<key>
     */
    public String getKeyLockPath(String cluster, String key) {
        return Paths.get(getClustersPrefix(), encode(cluster), PATH_KEYS, encode(key)).toString();
    }

    /**
     * Whether a path under {@link #getClustersPrefix()} belongs to the given table.
     * Pattern: /fleet/clusters/<cluster>/<table>/<id>
     */
    public boolean isTablePath(String path, String table) {
        String[] segments = path.split(PATH_DELIMITER);
        return segments.length == 6 && table.equals(segments[4]);
    }

    // =================================================================
    // EVENTS
    // =================================================================

    /**
     * Pattern: /fleet/events
     */
    public String getEventsPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_FLEET_ROOT, PATH_EVENTS).toString();
    }

    /**
     * Events of one entity; a null key selects the global stream.
     * Pattern: /fleet/events/<key | _global>
     */
    public String getEntityEventsPrefix(String key) {
        return Paths.get(getEventsPrefix(), key == null ? PATH_GLOBAL_EVENTS : encode(key)).toString();
    }

    /**
     * Pattern: /fleet/events/<key | _global>/<event-id>
     */
    public String getEventPath(String key, String eventId) {
        return Paths.get(getEntityEventsPrefix(key), eventId).toString();
    }

    // =================================================================
    // DRONE BUS
    // =================================================================

    /**
     * Pattern: /fleet/bus/commands/<cluster>/<drone-name>
     */
    public String getDroneCommandsPrefix(String cluster, String droneName) {
        return Paths.get(PATH_DELIMITER, PATH_FLEET_ROOT, PATH_BUS, PATH_COMMANDS,
                encode(cluster), encode(droneName)).toString();
    }

    /**
     * Pattern: /fleet/bus/commands/<cluster>/<drone-name>/<command-id>
     */
    public String getDroneCommandPath(String cluster, String droneName, String commandId) {
        return Paths.get(getDroneCommandsPrefix(cluster, droneName), commandId).toString();
    }

    /**
     * Pattern: /fleet/bus/reports
     */
    public String getReportsPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_FLEET_ROOT, PATH_BUS, PATH_REPORTS).toString();
    }

    /**
     * Pattern: /fleet/bus/reports/<cluster>/<report-id>
     */
    public String getReportPath(String cluster, String reportId) {
        return Paths.get(getReportsPrefix(), encode(cluster), reportId).toString();
    }

    private static String encode(String segment) {
        if (segment == null || segment.isEmpty()) {
            throw new IllegalArgumentException("Path segment must not be empty");
        }
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }
}
