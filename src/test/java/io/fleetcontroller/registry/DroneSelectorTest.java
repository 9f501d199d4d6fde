package io.fleetcontroller.registry;

import io.fleetcontroller.enums.BackendStatus;
import io.fleetcontroller.enums.DroneStatus;
import io.fleetcontroller.models.Drone;
import io.fleetcontroller.store.FleetStore;
import io.fleetcontroller.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static io.fleetcontroller.config.Constants.ADMIN_STATE_DRAIN;
import static io.fleetcontroller.support.Fixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DroneSelectorTest {

    private static final String CLUSTER = "c1";

    @Mock
    private FleetStore fleetStore;

    private DroneSelector selector;

    @BeforeEach
    void setUp() {
        selector = new DroneSelector(fleetStore, Duration.ofSeconds(30));
    }

    @Test
    void testSelect_PrefersFewestLiveBackends() throws Exception {
        // Given
        Drone busy = Fixtures.availableDrone(CLUSTER, "busy", "dr-a", T0);
        Drone idle = Fixtures.availableDrone(CLUSTER, "idle", "dr-b", T0);
        when(fleetStore.getDrones(CLUSTER)).thenReturn(List.of(busy, idle));
        when(fleetStore.getBackends(CLUSTER)).thenReturn(List.of(
            Fixtures.backend(CLUSTER, "ba-1", "busy", "dr-a", BackendStatus.READY),
            Fixtures.backend(CLUSTER, "ba-2", "idle", "dr-b", BackendStatus.TERMINATED),
            Fixtures.backend(CLUSTER, "ba-3", "idle", "dr-b", BackendStatus.TERMINATED)));

        // When
        Optional<Drone> selected = selector.select(CLUSTER, T0);

        // Then
        assertThat(selected).map(Drone::getName).contains("idle");
    }

    @Test
    void testSelect_TieBreaksOnDroneId() throws Exception {
        when(fleetStore.getDrones(CLUSTER)).thenReturn(List.of(
            Fixtures.availableDrone(CLUSTER, "zeta", "dr-2", T0),
            Fixtures.availableDrone(CLUSTER, "alpha", "dr-9", T0),
            Fixtures.availableDrone(CLUSTER, "mid", "dr-1", T0)));
        when(fleetStore.getBackends(CLUSTER)).thenReturn(List.of());

        assertThat(selector.select(CLUSTER, T0)).map(Drone::getId).contains("dr-1");
    }

    @Test
    void testEligibleDrones_FiltersStatusDrainAndStaleness() throws Exception {
        // Given
        Drone starting = Fixtures.availableDrone(CLUSTER, "starting", "dr-1", T0);
        starting.setStatus(DroneStatus.STARTING);
        Drone drained = Fixtures.availableDrone(CLUSTER, "drained", "dr-2", T0);
        drained.setAdminState(ADMIN_STATE_DRAIN);
        Drone stale = Fixtures.availableDrone(CLUSTER, "stale", "dr-3", T0.minusSeconds(31));
        Drone boundary = Fixtures.availableDrone(CLUSTER, "boundary", "dr-4", T0.minusSeconds(30));
        Drone terminated = Fixtures.availableDrone(CLUSTER, "terminated", "dr-5", T0);
        terminated.setStatus(DroneStatus.TERMINATED);
        when(fleetStore.getDrones(CLUSTER)).thenReturn(List.of(starting, drained, stale, boundary, terminated));

        // When
        List<Drone> eligible = selector.eligibleDrones(CLUSTER, T0);

        // Then
        assertThat(eligible).extracting(Drone::getName).containsExactly("boundary");
    }

    @Test
    void testSelect_NoEligibleDrone() throws Exception {
        when(fleetStore.getDrones(CLUSTER)).thenReturn(List.of());

        assertThat(selector.select(CLUSTER, T0)).isEmpty();
    }
}
