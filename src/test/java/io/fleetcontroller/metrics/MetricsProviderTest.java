package io.fleetcontroller.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static io.fleetcontroller.metrics.MetricsConstants.*;
import static org.assertj.core.api.Assertions.*;

class MetricsProviderTest {

    private static final String TEST_CONTROLLER_ID = "test-controller-01";

    private MeterRegistry registry;
    private MetricsProvider provider;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        provider = new MetricsProvider(registry, TEST_CONTROLLER_ID);
    }

    @Test
    void testCounterIsTaggedWithController() {
        Counter counter = provider.counter(CONNECT_REQUESTS_METRIC_NAME, Map.of(OUTCOME_TAG, OUTCOME_SPAWNED));

        counter.increment();
        provider.counter(CONNECT_REQUESTS_METRIC_NAME, Map.of(OUTCOME_TAG, OUTCOME_SPAWNED)).increment(2.0);

        assertThat(counter.getId().getTag("controller")).isEqualTo(TEST_CONTROLLER_ID);
        assertThat(counter.getId().getTag(OUTCOME_TAG)).isEqualTo(OUTCOME_SPAWNED);
        assertThat(counter.count()).isEqualTo(3.0);
    }

    @Test
    void testGaugeReturnsSameHolderForSameTags() {
        // Given
        AtomicDouble first = provider.gauge(ORPHANED_BACKENDS_METRIC_NAME, Map.of(CLUSTER_TAG, "c1"));
        AtomicDouble second = provider.gauge(ORPHANED_BACKENDS_METRIC_NAME, Map.of(CLUSTER_TAG, "c1"));
        AtomicDouble other = provider.gauge(ORPHANED_BACKENDS_METRIC_NAME, Map.of(CLUSTER_TAG, "c2"));

        // When
        first.set(4);
        other.set(1);

        // Then
        assertThat(second).isSameAs(first);
        Gauge gauge = registry.find(ORPHANED_BACKENDS_METRIC_NAME).tag(CLUSTER_TAG, "c1").gauge();
        assertThat(gauge).isNotNull();
        assertThat(gauge.value()).isEqualTo(4.0);
    }

    @Test
    void testTimerRecords() {
        Timer timer = provider.timer(CONNECT_LATENCY_METRIC_NAME, Map.of());

        timer.record(25, TimeUnit.MILLISECONDS);

        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.getId().getTag("controller")).isEqualTo(TEST_CONTROLLER_ID);
    }
}
