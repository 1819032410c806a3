package com.platform.podset.dispatch;

import com.platform.podset.reconcile.ReconcileKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-key exponential backoff with jitter for requeued reconciles.
 * A key's delay keeps growing while it is requeued and resets once a reconcile finishes clean.
 */
@Component
public class RequeueBackoff {

    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double multiplier;
    private final double jitterFactor;
    private final Map<ReconcileKey, AtomicInteger> failures = new ConcurrentHashMap<>();

    public RequeueBackoff(
            @Value("${podset.requeue.initial-delay-ms:5}") long initialDelayMs,
            @Value("${podset.requeue.max-delay-ms:300000}") long maxDelayMs,
            @Value("${podset.requeue.multiplier:2.0}") double multiplier,
            @Value("${podset.requeue.jitter-factor:0.1}") double jitterFactor) {
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.multiplier = multiplier;
        this.jitterFactor = jitterFactor;
    }

    /**
     * Count one more requeue for {@code key} and return how long to wait before the next attempt.
     */
    public Duration nextDelay(ReconcileKey key) {
        int attempt = failures.computeIfAbsent(key, k -> new AtomicInteger(0)).incrementAndGet();
        return Duration.ofMillis(calculateDelay(attempt));
    }

    /**
     * Reset the backoff of {@code key}.
     */
    public void forget(ReconcileKey key) {
        failures.remove(key);
    }

    public int getRequeueCount(ReconcileKey key) {
        AtomicInteger counter = failures.get(key);
        return counter != null ? counter.get() : 0;
    }

    private long calculateDelay(int attempt) {
        double exponentialDelay = initialDelayMs * Math.pow(multiplier, attempt - 1);
        long baseDelay = (long) Math.min(exponentialDelay, (double) maxDelayMs);

        long jitter = (long) (baseDelay * jitterFactor * ThreadLocalRandom.current().nextDouble());
        if (ThreadLocalRandom.current().nextBoolean()) {
            return Math.min(maxDelayMs, baseDelay + jitter);
        } else {
            return Math.max(initialDelayMs, baseDelay - jitter);
        }
    }
}
