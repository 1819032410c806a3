package com.platform.podset.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Central registry for operator metrics: reconcile outcomes, scaling actions,
 * work queue depth and cluster API latency.
 */
@Component
public class MetricsRegistry {

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;

    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
    }

    /**
     * Expose a gauge backed by {@code valueSupplier}, e.g. the work queue depth.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(name, valueSupplier)
            .description(description)
            .register(meterRegistry);
    }

    /**
     * Record the outcome of one reconcile: {@code done}, {@code requeue}, {@code error} or {@code cancelled}.
     */
    public void recordReconcile(String namespace, String outcome, long durationMs) {
        incrementCounter("podset.reconcile.total", "namespace", namespace, "outcome", outcome);

        Timer timer = timers.computeIfAbsent("reconcile." + outcome, k ->
            Timer.builder("podset.reconcile.duration")
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        timer.record(Duration.ofMillis(durationMs));
    }

    public void recordStatusUpdate(String namespace) {
        incrementCounter("podset.status.updates", "namespace", namespace);
    }

    public void recordScaleUp(String namespace) {
        incrementCounter("podset.pods.created", "namespace", namespace);
    }

    public void recordScaleDown(String namespace, int deleted) {
        counters.computeIfAbsent("podset.pods.deleted." + namespace, k ->
            Counter.builder("podset.pods.deleted")
                .tag("namespace", namespace)
                .register(meterRegistry))
            .increment(deleted);
    }

    public void recordDeleteFailure(String namespace) {
        incrementCounter("podset.pods.delete.failures", "namespace", namespace);
    }

    public void recordAlreadyEnqueued() {
        incrementCounter("podset.queue.deduplicated");
    }

    public void recordQueueRejected() {
        incrementCounter("podset.queue.rejected");
    }

    public void recordOrphanDeleted(String namespace) {
        incrementCounter("podset.orphans.deleted", "namespace", namespace);
    }

    /**
     * Record latency of a cluster API call.
     */
    public void recordLatency(String system, String operation, long latencyMs) {
        String timerKey = system + "." + operation;
        Timer timer = timers.computeIfAbsent(timerKey, k ->
            Timer.builder("podset.cluster.latency")
                .tag("system", system)
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));

        timer.record(Duration.ofMillis(latencyMs));
    }

    public void recordClusterCallFailure(String operation, int statusCode) {
        incrementCounter("podset.cluster.failures",
            "operation", operation,
            "code", String.valueOf(statusCode));
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
}
