package io.fleetcontroller.enums;

/**
 * Commands the controller sends to a drone.
 */
public enum DroneCommandType {
    SPAWN,
    TERMINATE
}
