package io.fleetcontroller.bus;

import io.fleetcontroller.events.Subscription;
import io.fleetcontroller.models.DroneCommand;
import io.fleetcontroller.models.DroneReport;

import java.util.function.Consumer;

/**
 * Message transport between the controller and drones. Both directions are
 * at-least-once and unordered.
 */
public interface DroneBus {

    void sendCommand(DroneCommand command) throws Exception;

    /**
     * Start consuming drone reports, including any backlog published while no controller was listening.
     */
    Subscription consumeReports(Consumer<DroneReport> handler) throws Exception;
}
