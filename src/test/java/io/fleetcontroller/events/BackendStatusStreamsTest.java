package io.fleetcontroller.events;

import io.fleetcontroller.enums.BackendStatus;
import io.fleetcontroller.models.Backend;
import io.fleetcontroller.models.FleetEvent;
import io.fleetcontroller.support.Fixtures;
import io.fleetcontroller.support.InMemoryFleetStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import static io.fleetcontroller.support.Fixtures.T0;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BackendStatusStreamsTest {

    private static final String CLUSTER = "c1";
    private static final String BACKEND_ID = "ba-1";

    @Mock
    private EventLog eventLog;

    @Mock
    private Subscription subscription;

    @Captor
    private ArgumentCaptor<Consumer<FleetEvent>> listener;

    private InMemoryFleetStore store;
    private BackendStatusStreams streams;

    @BeforeEach
    void setUp() {
        store = new InMemoryFleetStore();
        streams = new BackendStatusStreams(store, eventLog);
    }

    private void givenBackend(BackendStatus status) {
        store.putBackend(Fixtures.backend(CLUSTER, BACKEND_ID, "d1", "dr-1", status));
        when(eventLog.subscribe(eq(BACKEND_ID), anyLong(), listener.capture())).thenReturn(subscription);
    }

    private FleetEvent statusEvent(BackendStatus status) {
        Backend backend = Fixtures.backend(CLUSTER, BACKEND_ID, "d1", "dr-1", status);
        return FleetEvents.backendStatus(backend, status, T0);
    }

    @Test
    void testAwaitStatus_AlreadyReached() throws Exception {
        // Given
        store.putBackend(Fixtures.backend(CLUSTER, BACKEND_ID, "d1", "dr-1", BackendStatus.TERMINATING));

        // When
        CompletableFuture<BackendStatus> future = streams.awaitStatus(CLUSTER, BACKEND_ID, BackendStatus.READY, null);

        // Then
        assertThat(future.get(1, TimeUnit.SECONDS)).isEqualTo(BackendStatus.TERMINATING);
        verifyNoInteractions(eventLog);
    }

    @Test
    void testAwaitStatus_SubscribesFromRevisionAfterRead() throws Exception {
        // Given
        givenBackend(BackendStatus.STARTING);
        long readRevision = store.getBackend(CLUSTER, BACKEND_ID).orElseThrow().getRevision();

        // When
        CompletableFuture<BackendStatus> future = streams.awaitStatus(CLUSTER, BACKEND_ID, BackendStatus.READY, null);

        // Then
        assertThat(future).isNotDone();
        verify(eventLog).subscribe(eq(BACKEND_ID), eq(readRevision + 1), any());
    }

    @Test
    void testAwaitStatus_CancelClosesSubscription() {
        givenBackend(BackendStatus.STARTING);
        CompletableFuture<BackendStatus> future = streams.awaitStatus(CLUSTER, BACKEND_ID, BackendStatus.READY, null);

        future.cancel(true);

        verify(subscription).close();
    }

    @Test
    void testAwaitStatus_CompletesOnLaterEvent() throws Exception {
        // Given
        givenBackend(BackendStatus.SCHEDULED);
        CompletableFuture<BackendStatus> future = streams.awaitStatus(CLUSTER, BACKEND_ID, BackendStatus.READY, null);
        assertThat(future).isNotDone();

        // When
        listener.getValue().accept(statusEvent(BackendStatus.STARTING));
        assertThat(future).isNotDone();
        listener.getValue().accept(statusEvent(BackendStatus.READY));

        // Then
        assertThat(future.get(1, TimeUnit.SECONDS)).isEqualTo(BackendStatus.READY);
        verify(subscription).close();
    }

    @Test
    void testAwaitStatus_IgnoresUnrelatedEvents() {
        givenBackend(BackendStatus.SCHEDULED);
        CompletableFuture<BackendStatus> future = streams.awaitStatus(CLUSTER, BACKEND_ID, BackendStatus.READY, null);

        listener.getValue().accept(FleetEvents.keyReleased(CLUSTER, "u1", BACKEND_ID, T0));

        assertThat(future).isNotDone();
        verify(subscription, never()).close();
    }

    @Test
    void testAwaitStatus_UnknownBackend() {
        CompletableFuture<BackendStatus> future = streams.awaitStatus(CLUSTER, BACKEND_ID, BackendStatus.READY, null);

        assertThatThrownBy(() -> future.get(1, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(NoSuchElementException.class);
        verifyNoInteractions(eventLog);
    }

    @Test
    void testAwaitStatus_TimesOut() {
        givenBackend(BackendStatus.STARTING);

        CompletableFuture<BackendStatus> future = streams.awaitStatus(CLUSTER, BACKEND_ID, BackendStatus.READY,
            Duration.ofMillis(50));

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(TimeoutException.class);
        verify(subscription, timeout(1000)).close();
    }
}
