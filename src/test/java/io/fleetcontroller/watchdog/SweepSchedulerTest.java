package io.fleetcontroller.watchdog;

import io.fleetcontroller.events.EventLog;
import io.fleetcontroller.registry.NodeRegistry;
import io.fleetcontroller.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static io.fleetcontroller.support.Fixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SweepSchedulerTest {

    @Mock
    private NodeRegistry nodeRegistry;

    @Mock
    private TerminationWatchdog watchdog;

    @Mock
    private EventLog eventLog;

    private SweepScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new SweepScheduler(nodeRegistry, watchdog, eventLog, Duration.ofHours(1), 10,
            new MutableClock(T0));
    }

    @Test
    void testRunSweep_RunsAllStepsInOrder() throws Exception {
        // When
        scheduler.runSweep();

        // Then
        var inOrder = inOrder(nodeRegistry, watchdog, eventLog);
        inOrder.verify(nodeRegistry).sweepStaleDrones(T0);
        inOrder.verify(watchdog).runOnce(T0);
        inOrder.verify(eventLog).pruneOlderThan(T0.minus(Duration.ofHours(1)));
    }

    @Test
    void testRunSweep_PrunesEvenWhenWatchdogFails() throws Exception {
        // Given
        when(watchdog.runOnce(any())).thenThrow(new IllegalStateException("boom"));

        // When
        scheduler.runSweep();

        // Then
        verify(eventLog).pruneOlderThan(any());
    }

    @Test
    void testRunSweep_PruneFailureIsContained() throws Exception {
        when(eventLog.pruneOlderThan(any())).thenThrow(new RuntimeException("etcd down"));

        scheduler.runSweep();

        verify(nodeRegistry).sweepStaleDrones(T0);
    }

    @Test
    void testStartAndStop() {
        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();

        scheduler.stop();
        assertThat(scheduler.isRunning()).isFalse();
    }
}
