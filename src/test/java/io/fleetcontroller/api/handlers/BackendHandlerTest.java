package io.fleetcontroller.api.handlers;

import io.fleetcontroller.api.models.responses.BackendStatusResponse;
import io.fleetcontroller.api.models.responses.ErrorResponse;
import io.fleetcontroller.config.FleetControllerConfig;
import io.fleetcontroller.enums.BackendStatus;
import io.fleetcontroller.events.BackendStatusStreams;
import io.fleetcontroller.lifecycle.BackendLifecycle;
import io.fleetcontroller.lifecycle.StatusUpdate;
import io.fleetcontroller.models.Backend;
import io.fleetcontroller.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BackendHandlerTest {

    @Mock
    private BackendLifecycle lifecycle;

    @Mock
    private BackendStatusStreams statusStreams;

    @Mock
    private FleetControllerConfig config;

    @InjectMocks
    private BackendHandler backendHandler;

    private static final Duration MAX_WAIT = Duration.ofSeconds(300);

    private final String testClusterId = "test-cluster";
    private final String backendId = "ba-1";

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(config.getMaxWait()).thenReturn(MAX_WAIT);
    }

    private Backend backend(BackendStatus status) {
        return Fixtures.backend(testClusterId, backendId, "d1", "dr-1", status);
    }

    @Test
    void testSoftTerminate_Success() throws Exception {
        // Given
        when(lifecycle.terminate(testClusterId, backendId, false))
            .thenReturn(new StatusUpdate(backend(BackendStatus.TERMINATING), BackendStatus.READY, true));

        // When
        ResponseEntity<Object> response = backendHandler.softTerminate(testClusterId, backendId);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        BackendStatusResponse body = (BackendStatusResponse) response.getBody();
        assertThat(body.getStatus()).isEqualTo(BackendStatus.TERMINATING);
        assertThat(body.getPreviousStatus()).isEqualTo(BackendStatus.READY);
        assertThat(body.getApplied()).isTrue();
    }

    @Test
    void testHardTerminate_NotFound() throws Exception {
        when(lifecycle.terminate(testClusterId, backendId, true)).thenThrow(new NoSuchElementException("gone"));

        ResponseEntity<Object> response = backendHandler.hardTerminate(testClusterId, backendId);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void testHardTerminate_StoreFailure() throws Exception {
        when(lifecycle.terminate(testClusterId, backendId, true)).thenThrow(new RuntimeException("etcd timeout"));

        ResponseEntity<Object> response = backendHandler.hardTerminate(testClusterId, backendId);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(((ErrorResponse) response.getBody()).getReason()).isEqualTo("Internal error.");
    }

    @Test
    void testForceTerminate_OwnerAlive() throws Exception {
        when(lifecycle.forceTerminate(testClusterId, backendId))
            .thenThrow(new IllegalStateException("Backend ba-1 is owned by live drone d1"));

        ResponseEntity<Object> response = backendHandler.forceTerminate(testClusterId, backendId);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void testGetStatus_Success() throws Exception {
        when(lifecycle.getBackend(testClusterId, backendId)).thenReturn(backend(BackendStatus.READY));

        ResponseEntity<Object> response = backendHandler.getStatus(testClusterId, backendId);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        BackendStatusResponse body = (BackendStatusResponse) response.getBody();
        assertThat(body.getStatus()).isEqualTo(BackendStatus.READY);
        assertThat(body.getDrone()).isEqualTo("d1");
    }

    @Test
    void testWaitForStatus_Reached() throws Exception {
        // Given
        when(statusStreams.awaitStatus(testClusterId, backendId, BackendStatus.READY, Duration.ofSeconds(30)))
            .thenReturn(CompletableFuture.completedFuture(BackendStatus.READY));

        // When
        ResponseEntity<Object> response = backendHandler.waitForStatus(testClusterId, backendId, "Ready", 30L)
            .get(1, TimeUnit.SECONDS);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((BackendStatusResponse) response.getBody()).getStatus()).isEqualTo(BackendStatus.READY);
    }

    @Test
    void testWaitForStatus_UnknownStatus() throws Exception {
        ResponseEntity<Object> response = backendHandler.waitForStatus(testClusterId, backendId, "Sleeping", null)
            .get(1, TimeUnit.SECONDS);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verify(statusStreams, never()).awaitStatus(any(), any(), any(), any());
    }

    @Test
    void testWaitForStatus_TimedOut() throws Exception {
        // Given
        when(statusStreams.awaitStatus(eq(testClusterId), eq(backendId), eq(BackendStatus.TERMINATED), eq(MAX_WAIT)))
            .thenReturn(CompletableFuture.failedFuture(new TimeoutException()));

        // When
        ResponseEntity<Object> response = backendHandler.waitForStatus(testClusterId, backendId, "Terminated", null)
            .get(1, TimeUnit.SECONDS);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.REQUEST_TIMEOUT);
    }

    @Test
    void testWaitForStatus_NotFound() throws Exception {
        when(statusStreams.awaitStatus(eq(testClusterId), eq(backendId), eq(BackendStatus.READY), eq(MAX_WAIT)))
            .thenReturn(CompletableFuture.failedFuture(new NoSuchElementException()));

        ResponseEntity<Object> response = backendHandler.waitForStatus(testClusterId, backendId, "Ready", 0L)
            .get(1, TimeUnit.SECONDS);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void testWaitForStatus_RequestedTimeoutIsCappedAtMaxWait() throws Exception {
        // Given
        when(statusStreams.awaitStatus(testClusterId, backendId, BackendStatus.READY, MAX_WAIT))
            .thenReturn(CompletableFuture.completedFuture(BackendStatus.READY));

        // When
        ResponseEntity<Object> response = backendHandler.waitForStatus(testClusterId, backendId, "Ready", 3600L)
            .get(1, TimeUnit.SECONDS);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        verify(statusStreams).awaitStatus(testClusterId, backendId, BackendStatus.READY, MAX_WAIT);
    }
}
