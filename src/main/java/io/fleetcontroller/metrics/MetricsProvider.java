package io.fleetcontroller.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/*
 * MetricsProvider creates counters, gauges and timers tagged with the controller id.
 */
@Component
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String CONTROLLER_TAG = "controller";

    private final MeterRegistry registry;
    private final String controllerId;
    // Gauges hold a reference to their value; keep one per name and tag set
    private final Map<String, AtomicDouble> gauges = new ConcurrentHashMap<>();

    @Autowired
    public MetricsProvider(
        MeterRegistry registry,
        @Value("${controller.id}") String controllerId) {
        this.registry = registry;
        this.controllerId = controllerId;
        log.info("MetricsProvider initialized for the controller: {}", controllerId);
    }

    /**
     * Create or retrieve a Counter metric with the given name and tags.
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(mapToTagArray(tags)).register(registry);
    }

    /**
     * Create or retrieve a Gauge metric with the given name and tags. Repeated calls with
     * the same name and tags return the same value holder.
     *
     * @return the AtomicDouble backing the gauge
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        String gaugeKey = name + new TreeMap<>(tags);
        return gauges.computeIfAbsent(gaugeKey, k -> {
            AtomicDouble value = new AtomicDouble(0);
            Gauge.builder(name, value::get).tags(mapToTagArray(tags)).register(registry);
            return value;
        });
    }

    /**
     * Create or retrieve a Timer metric with the given name and tags.
     */
    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(mapToTagArray(tags))
            .publishPercentileHistogram()
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    /**
     * Convert a map of tags to an array of alternating keys and values, including the controller id.
     */
    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[(tags.size() + 1) * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        tagArray[index++] = CONTROLLER_TAG;
        tagArray[index] = controllerId;
        return tagArray;
    }
}
