package io.fleetcontroller;

import io.etcd.jetcd.Client;
import io.fleetcontroller.bus.DroneBus;
import io.fleetcontroller.bus.EtcdDroneBus;
import io.fleetcontroller.config.FleetControllerConfig;
import io.fleetcontroller.connect.ConnectProtocol;
import io.fleetcontroller.events.BackendStatusStreams;
import io.fleetcontroller.events.EtcdEventLog;
import io.fleetcontroller.events.EventLog;
import io.fleetcontroller.lifecycle.BackendLifecycle;
import io.fleetcontroller.metrics.MetricsProvider;
import io.fleetcontroller.registry.DroneSelector;
import io.fleetcontroller.registry.NodeRegistry;
import io.fleetcontroller.store.EtcdFleetStore;
import io.fleetcontroller.store.EtcdPathResolver;
import io.fleetcontroller.store.FleetStore;
import io.fleetcontroller.watchdog.SweepScheduler;
import io.fleetcontroller.watchdog.TerminationWatchdog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

/**
 * Main Spring Boot application class for the Fleet Controller.
 *
 * The controller schedules session-affine backends onto drones grouped by cluster. It keeps
 * no authoritative state in memory: every decision is an etcd transaction, so any number of
 * controller instances can serve requests side by side.
 */
@Slf4j
@SpringBootApplication
public class FleetControllerApplication {

    public static void main(String[] args) {
        log.info("Starting Fleet Controller Application");

        try {
            SpringApplication.run(FleetControllerApplication.class, args);
            log.info("Fleet Controller started successfully");

        } catch (Exception e) {
            log.error("Failed to start Fleet Controller: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public FleetControllerConfig config() {
        FleetControllerConfig config = new FleetControllerConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared etcd client; closed on shutdown.
     */
    @Bean(destroyMethod = "close")
    public Client etcdClient(FleetControllerConfig config) {
        log.info("Connecting to etcd at {}", String.join(",", config.getEtcdEndpoints()));
        return Client.builder().endpoints(config.getEtcdEndpoints()).build();
    }

    @Bean
    public FleetStore fleetStore(Client etcdClient, EtcdPathResolver pathResolver) {
        log.info("Initializing etcd-backed FleetStore");
        return new EtcdFleetStore(etcdClient.getKVClient(), pathResolver);
    }

    @Bean
    public EventLog eventLog(Client etcdClient, EtcdPathResolver pathResolver) {
        log.info("Initializing etcd-backed EventLog");
        return new EtcdEventLog(etcdClient, pathResolver);
    }

    @Bean
    public DroneBus droneBus(Client etcdClient, EtcdPathResolver pathResolver, FleetControllerConfig config) {
        log.info("Initializing etcd-backed DroneBus");
        return new EtcdDroneBus(etcdClient, pathResolver, config.getCommandTtlSeconds(),
            config.getReportRescanInterval());
    }

    @Bean
    public DroneSelector droneSelector(FleetStore fleetStore, FleetControllerConfig config) {
        log.info("Initializing DroneSelector with heartbeat staleness {}", config.getHeartbeatStaleness());
        return new DroneSelector(fleetStore, config.getHeartbeatStaleness());
    }

    @Bean
    public ConnectProtocol connectProtocol(FleetStore fleetStore, DroneSelector droneSelector, DroneBus droneBus,
                                           FleetControllerConfig config, MetricsProvider metricsProvider, Clock clock) {
        log.info("Initializing ConnectProtocol (default cluster: {})", config.getDefaultCluster().orElse("none"));
        return new ConnectProtocol(fleetStore, droneSelector, droneBus, config, metricsProvider, clock);
    }

    @Bean
    public BackendLifecycle backendLifecycle(FleetStore fleetStore, DroneBus droneBus,
                                             MetricsProvider metricsProvider, Clock clock) {
        log.info("Initializing BackendLifecycle");
        return new BackendLifecycle(fleetStore, droneBus, metricsProvider, clock);
    }

    @Bean
    public NodeRegistry nodeRegistry(FleetStore fleetStore, FleetControllerConfig config,
                                     MetricsProvider metricsProvider, Clock clock) {
        log.info("Initializing NodeRegistry (terminate after {})", config.getDroneTerminateAfter());
        return new NodeRegistry(fleetStore, config.getControllerId(), config.getDroneTerminateAfter(),
            metricsProvider, clock);
    }

    @Bean
    public TerminationWatchdog terminationWatchdog(FleetStore fleetStore, BackendLifecycle lifecycle,
                                                   MetricsProvider metricsProvider, FleetControllerConfig config) {
        log.info("Initializing TerminationWatchdog (hard terminate grace: {})",
            config.getHardTerminateGrace().map(Object::toString).orElse("disabled"));
        return new TerminationWatchdog(fleetStore, lifecycle, metricsProvider, config.getHardTerminateGrace().orElse(null));
    }

    @Bean
    public BackendStatusStreams backendStatusStreams(FleetStore fleetStore, EventLog eventLog) {
        return new BackendStatusStreams(fleetStore, eventLog);
    }

    @Bean(destroyMethod = "stop")
    public SweepScheduler sweepScheduler(NodeRegistry nodeRegistry, TerminationWatchdog watchdog, EventLog eventLog,
                                         FleetControllerConfig config, Clock clock) {
        SweepScheduler scheduler = new SweepScheduler(nodeRegistry, watchdog, eventLog, config.getEventRetention(),
            config.getWatchdogIntervalSeconds(), clock);
        scheduler.start();
        log.info("SweepScheduler started");
        return scheduler;
    }
}
