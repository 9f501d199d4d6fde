package io.fleetcontroller.support;

import io.fleetcontroller.bus.DroneBus;
import io.fleetcontroller.enums.DroneCommandType;
import io.fleetcontroller.events.Subscription;
import io.fleetcontroller.models.DroneCommand;
import io.fleetcontroller.models.DroneReport;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Thread-safe DroneBus that records every command sent.
 */
public class RecordingDroneBus implements DroneBus {

    private final List<DroneCommand> commands = new ArrayList<>();
    private volatile boolean failing = false;

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public synchronized void sendCommand(DroneCommand command) throws Exception {
        if (failing) {
            throw new IllegalStateException("bus unavailable");
        }
        commands.add(command);
    }

    @Override
    public Subscription consumeReports(Consumer<DroneReport> handler) {
        return () -> { };
    }

    public synchronized List<DroneCommand> commands() {
        return new ArrayList<>(commands);
    }

    public synchronized List<DroneCommand> commands(DroneCommandType type) {
        return commands.stream().filter(command -> command.getType() == type).collect(Collectors.toList());
    }
}
