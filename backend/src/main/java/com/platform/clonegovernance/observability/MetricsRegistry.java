package com.platform.clonegovernance.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Central registry for governance metrics.
 * Wraps Micrometer so components record counters, timers and gauges by name.
 */
@Slf4j
@Component
public class MetricsRegistry {

    public static final String RECORDING_FAILURES = "clonegovernance.recording.failures";
    public static final String EVALUATIONS = "clonegovernance.evaluations";
    public static final String POLICIES_SKIPPED = "clonegovernance.evaluation.skipped";
    public static final String VIOLATIONS_DETECTED = "clonegovernance.violations.detected";

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final Map<String, AtomicLong> gaugeValues;

    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.gaugeValues = new ConcurrentHashMap<>();
    }

    /**
     * Increment a counter.
     */
    public void incrementCounter(String name) {
        counters.computeIfAbsent(name, k ->
            Counter.builder(name)
                .register(meterRegistry))
            .increment();
    }

    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }

    /**
     * Record the duration of a background job or evaluation.
     */
    public void recordDuration(String name, String operation, Duration duration) {
        String key = name + "." + operation;
        Timer timer = timers.computeIfAbsent(key, k ->
            Timer.builder(name)
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        timer.record(duration);
    }

    /**
     * Set a gauge value, registering the gauge on first use.
     */
    public void setGauge(String name, long value) {
        gaugeValues.computeIfAbsent(name, k -> {
            AtomicLong holder = new AtomicLong();
            Gauge.builder(name, holder, AtomicLong::get).register(meterRegistry);
            log.debug("Registered gauge {}", name);
            return holder;
        }).set(value);
    }
}
