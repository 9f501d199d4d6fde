package io.fleetcontroller.lifecycle;

import io.fleetcontroller.enums.BackendStatus;
import io.fleetcontroller.enums.DroneCommandType;
import io.fleetcontroller.enums.DroneStatus;
import io.fleetcontroller.models.Backend;
import io.fleetcontroller.models.Drone;
import io.fleetcontroller.models.DroneCommand;
import io.fleetcontroller.models.KeyLock;
import io.fleetcontroller.store.FleetStore;
import io.fleetcontroller.store.Versioned;
import io.fleetcontroller.support.Fixtures;
import io.fleetcontroller.support.InMemoryFleetStore;
import io.fleetcontroller.support.MutableClock;
import io.fleetcontroller.support.RecordingDroneBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ConcurrentModificationException;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import static io.fleetcontroller.config.Constants.EVENT_BACKEND_STATUS;
import static io.fleetcontroller.config.Constants.EVENT_KEY_RELEASED;
import static io.fleetcontroller.support.Fixtures.T0;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BackendLifecycleTest {

    private static final String CLUSTER = "c1";
    private static final String BACKEND_ID = "ba-00000000000001";

    private InMemoryFleetStore store;
    private RecordingDroneBus bus;
    private MutableClock clock;
    private BackendLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        store = new InMemoryFleetStore();
        bus = new RecordingDroneBus();
        clock = new MutableClock(T0);
        lifecycle = new BackendLifecycle(store, bus, Fixtures.metricsProvider(), clock);
        store.putDrone(Fixtures.availableDrone(CLUSTER, "d1", "dr-1", T0));
    }

    private void givenBackend(BackendStatus status) {
        store.putBackend(Fixtures.backend(CLUSTER, BACKEND_ID, "d1", "dr-1", status));
    }

    private void givenKeyedBackend(BackendStatus status, String key) {
        Backend backend = Fixtures.backend(CLUSTER, BACKEND_ID, "d1", "dr-1", status);
        backend.setKey(key);
        backend.setTag("t1");
        store.putBackend(backend);
        store.putKeyLock(KeyLock.builder().cluster(CLUSTER).key(key).backendId(BACKEND_ID).tag("t1")
            .acquiredAt(T0).build());
    }

    private BackendStatus storedStatus() throws Exception {
        return store.getBackend(CLUSTER, BACKEND_ID).orElseThrow().getValue().getStatus();
    }

    // =================================================================
    // MONOTONIC APPLY
    // =================================================================

    @Test
    void testApplyStatus_ForwardTransitions() throws Exception {
        // Given
        givenBackend(BackendStatus.SCHEDULED);

        // When
        clock.advance(Duration.ofSeconds(5));
        StatusUpdate starting = lifecycle.applyStatus(CLUSTER, BACKEND_ID, BackendStatus.STARTING);
        StatusUpdate ready = lifecycle.applyStatus(CLUSTER, BACKEND_ID, BackendStatus.READY);

        // Then
        assertThat(starting.isApplied()).isTrue();
        assertThat(starting.getPreviousStatus()).isEqualTo(BackendStatus.SCHEDULED);
        assertThat(ready.isApplied()).isTrue();
        assertThat(ready.getBackend().getStatusTime()).isEqualTo(T0.plusSeconds(5));
        assertThat(storedStatus()).isEqualTo(BackendStatus.READY);
        assertThat(store.events(EVENT_BACKEND_STATUS)).hasSize(2);
    }

    @Test
    void testApplyStatus_IgnoresDuplicateAndStaleReports() throws Exception {
        // Given
        givenBackend(BackendStatus.READY);

        // When
        StatusUpdate duplicate = lifecycle.applyStatus(CLUSTER, BACKEND_ID, BackendStatus.READY);
        StatusUpdate stale = lifecycle.applyStatus(CLUSTER, BACKEND_ID, BackendStatus.STARTING);

        // Then
        assertThat(duplicate.isApplied()).isFalse();
        assertThat(stale.isApplied()).isFalse();
        assertThat(stale.getBackend().getStatus()).isEqualTo(BackendStatus.READY);
        assertThat(storedStatus()).isEqualTo(BackendStatus.READY);
        assertThat(store.events()).isEmpty();
    }

    @Test
    void testApplyStatus_SkippingStatesIsAllowed() throws Exception {
        givenBackend(BackendStatus.SCHEDULED);

        StatusUpdate update = lifecycle.applyStatus(CLUSTER, BACKEND_ID, BackendStatus.TERMINATED);

        assertThat(update.isApplied()).isTrue();
        assertThat(storedStatus()).isEqualTo(BackendStatus.TERMINATED);
    }

    @Test
    void testApplyStatus_NothingAppliesAfterTerminated() throws Exception {
        givenBackend(BackendStatus.TERMINATED);

        for (BackendStatus status : BackendStatus.values()) {
            assertThat(lifecycle.applyStatus(CLUSTER, BACKEND_ID, status).isApplied()).isFalse();
        }
        assertThat(storedStatus()).isEqualTo(BackendStatus.TERMINATED);
    }

    @Test
    void testApplyStatus_TerminatedReleasesKeyLock() throws Exception {
        // Given
        givenKeyedBackend(BackendStatus.READY, "u1");

        // When
        lifecycle.applyStatus(CLUSTER, BACKEND_ID, BackendStatus.TERMINATED);

        // Then
        assertThat(store.getKeyLock(CLUSTER, "u1")).isEmpty();
        assertThat(store.events(EVENT_KEY_RELEASED)).hasSize(1);
        assertThat(store.events(EVENT_KEY_RELEASED).get(0).getKey()).isEqualTo(BACKEND_ID);
    }

    @Test
    void testApplyStatus_TerminatedKeepsLockOfAnotherBackend() throws Exception {
        // Given
        Backend backend = Fixtures.backend(CLUSTER, BACKEND_ID, "d1", "dr-1", BackendStatus.READY);
        backend.setKey("u1");
        store.putBackend(backend);
        store.putKeyLock(KeyLock.builder().cluster(CLUSTER).key("u1").backendId("ba-someoneelse000").tag("t9")
            .acquiredAt(T0).build());

        // When
        lifecycle.applyStatus(CLUSTER, BACKEND_ID, BackendStatus.TERMINATED);

        // Then
        assertThat(store.getKeyLock(CLUSTER, "u1")).isPresent();
        assertThat(store.getKeyLock(CLUSTER, "u1").get().getValue().getBackendId()).isEqualTo("ba-someoneelse000");
        assertThat(store.events(EVENT_KEY_RELEASED)).isEmpty();
    }

    @Test
    void testApplyStatus_UnknownBackend() {
        assertThatThrownBy(() -> lifecycle.applyStatus(CLUSTER, "ba-missing", BackendStatus.READY))
            .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void testApplyStatus_GivesUpAfterRepeatedConflicts() throws Exception {
        // Given
        FleetStore conflicting = mock(FleetStore.class);
        Backend backend = Fixtures.backend(CLUSTER, BACKEND_ID, "d1", "dr-1", BackendStatus.SCHEDULED);
        when(conflicting.getBackend(CLUSTER, BACKEND_ID)).thenReturn(Optional.of(new Versioned<>(backend, 7L)));
        when(conflicting.compareAndPutBackend(any(), anyLong(), any(), anyList())).thenReturn(false);
        BackendLifecycle contended = new BackendLifecycle(conflicting, bus, Fixtures.metricsProvider(), clock);

        // When & Then
        assertThatThrownBy(() -> contended.applyStatus(CLUSTER, BACKEND_ID, BackendStatus.STARTING))
            .isInstanceOf(ConcurrentModificationException.class);
        verify(conflicting, times(5)).compareAndPutBackend(any(), eq(7L), isNull(), anyList());
    }

    // =================================================================
    // TERMINATE
    // =================================================================

    @Test
    void testTerminate_SoftSendsCommand() throws Exception {
        // Given
        givenBackend(BackendStatus.READY);

        // When
        StatusUpdate update = lifecycle.terminate(CLUSTER, BACKEND_ID, false);

        // Then
        assertThat(update.getBackend().getStatus()).isEqualTo(BackendStatus.TERMINATING);
        List<DroneCommand> commands = bus.commands(DroneCommandType.TERMINATE);
        assertThat(commands).hasSize(1);
        assertThat(commands.get(0).isHard()).isFalse();
        assertThat(commands.get(0).getDroneName()).isEqualTo("d1");
        assertThat(commands.get(0).getDroneId()).isEqualTo("dr-1");
        assertThat(commands.get(0).getBackendId()).isEqualTo(BACKEND_ID);
    }

    @Test
    void testTerminate_HardEscalatesSoft() throws Exception {
        // Given
        givenBackend(BackendStatus.READY);
        lifecycle.terminate(CLUSTER, BACKEND_ID, false);

        // When
        StatusUpdate update = lifecycle.terminate(CLUSTER, BACKEND_ID, true);

        // Then
        assertThat(update.isApplied()).isTrue();
        assertThat(storedStatus()).isEqualTo(BackendStatus.HARD_TERMINATING);
        assertThat(bus.commands(DroneCommandType.TERMINATE)).extracting(DroneCommand::isHard)
            .containsExactly(false, true);
    }

    @Test
    void testTerminate_SoftAfterHardIsNoop() throws Exception {
        givenBackend(BackendStatus.HARD_TERMINATING);

        StatusUpdate update = lifecycle.terminate(CLUSTER, BACKEND_ID, false);

        assertThat(update.isApplied()).isFalse();
        assertThat(storedStatus()).isEqualTo(BackendStatus.HARD_TERMINATING);
        assertThat(bus.commands()).isEmpty();
    }

    @Test
    void testTerminate_RepeatedSoftResendsCommand() throws Exception {
        givenBackend(BackendStatus.TERMINATING);

        lifecycle.terminate(CLUSTER, BACKEND_ID, false);

        assertThat(storedStatus()).isEqualTo(BackendStatus.TERMINATING);
        assertThat(bus.commands(DroneCommandType.TERMINATE)).hasSize(1);
    }

    @Test
    void testTerminate_TerminatedBackendIsNoop() throws Exception {
        givenBackend(BackendStatus.TERMINATED);

        StatusUpdate update = lifecycle.terminate(CLUSTER, BACKEND_ID, true);

        assertThat(update.isApplied()).isFalse();
        assertThat(storedStatus()).isEqualTo(BackendStatus.TERMINATED);
        assertThat(bus.commands()).isEmpty();
    }

    // =================================================================
    // FORCE TERMINATE
    // =================================================================

    @Test
    void testForceTerminate_RejectedWhileOwnerIsAlive() {
        givenBackend(BackendStatus.READY);

        assertThatThrownBy(() -> lifecycle.forceTerminate(CLUSTER, BACKEND_ID))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testForceTerminate_OrphanIsTerminatedAndKeyReleased() throws Exception {
        // Given
        givenKeyedBackend(BackendStatus.READY, "u1");
        Drone dead = Fixtures.availableDrone(CLUSTER, "d1", "dr-1", T0);
        dead.setStatus(DroneStatus.TERMINATED);
        store.putDrone(dead);

        // When
        StatusUpdate update = lifecycle.forceTerminate(CLUSTER, BACKEND_ID);

        // Then
        assertThat(update.isApplied()).isTrue();
        assertThat(storedStatus()).isEqualTo(BackendStatus.TERMINATED);
        assertThat(store.getKeyLock(CLUSTER, "u1")).isEmpty();
        assertThat(bus.commands()).isEmpty();
    }

    @Test
    void testForceTerminate_OwnerReplacedByNewIncarnation() throws Exception {
        givenBackend(BackendStatus.STARTING);
        store.putDrone(Fixtures.availableDrone(CLUSTER, "d1", "dr-2", T0));

        StatusUpdate update = lifecycle.forceTerminate(CLUSTER, BACKEND_ID);

        assertThat(update.getBackend().getStatus()).isEqualTo(BackendStatus.TERMINATED);
    }

    // =================================================================
    // KEEPALIVE
    // =================================================================

    @Test
    void testRecordKeepalive_OnlyMovesForward() throws Exception {
        // Given
        givenBackend(BackendStatus.READY);

        // When
        boolean newer = lifecycle.recordKeepalive(CLUSTER, BACKEND_ID, T0.plusSeconds(30));
        boolean older = lifecycle.recordKeepalive(CLUSTER, BACKEND_ID, T0.plusSeconds(10));

        // Then
        assertThat(newer).isTrue();
        assertThat(older).isFalse();
        assertThat(store.getBackend(CLUSTER, BACKEND_ID).orElseThrow().getValue().getLastKeepalive())
            .isEqualTo(T0.plusSeconds(30));
        assertThat(store.events()).isEmpty();
    }

    @Test
    void testRecordKeepalive_IgnoredWhenTerminated() throws Exception {
        givenBackend(BackendStatus.TERMINATED);

        assertThat(lifecycle.recordKeepalive(CLUSTER, BACKEND_ID, T0.plusSeconds(30))).isFalse();
    }
}
