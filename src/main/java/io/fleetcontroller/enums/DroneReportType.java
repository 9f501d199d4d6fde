package io.fleetcontroller.enums;

/**
 * Messages a drone publishes to the controller.
 * <ul>
 *   <li><strong>REGISTER</strong> - drone process started</li>
 *   <li><strong>HEARTBEAT</strong> - periodic liveness signal</li>
 *   <li><strong>SHUTDOWN</strong> - drone is going away</li>
 *   <li><strong>BACKEND_STATUS</strong> - status change of one of its backends</li>
 *   <li><strong>BACKEND_KEEPALIVE</strong> - backend saw client activity</li>
 * </ul>
 */
public enum DroneReportType {
    REGISTER,
    HEARTBEAT,
    SHUTDOWN,
    BACKEND_STATUS,
    BACKEND_KEEPALIVE
}
