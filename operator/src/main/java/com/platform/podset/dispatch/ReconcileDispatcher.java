package com.platform.podset.dispatch;

import com.platform.podset.dispatch.WorkQueue.AddOutcome;
import com.platform.podset.error.OperatorException;
import com.platform.podset.error.ReconcileCancelledException;
import com.platform.podset.observability.LoggingConfig;
import com.platform.podset.observability.MetricsRegistry;
import com.platform.podset.observability.StructuredLogger;
import com.platform.podset.reconcile.ReconcileKey;
import com.platform.podset.reconcile.ReconcileResult;
import com.platform.podset.reconcile.Reconciler;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool of workers pulling PodSet keys off the {@link WorkQueue} and running the {@link Reconciler}.
 *
 * <p>Outcome handling:
 * <ul>
 *   <li>{@code done} - the key's backoff is reset</li>
 *   <li>{@code requeue} or an exception - the key is added back after its backoff delay</li>
 *   <li>cancellation while shutting down - the key is dropped</li>
 * </ul>
 * The reconciler itself never retries.
 */
@Slf4j
@Component
public class ReconcileDispatcher {

    private final Reconciler reconciler;
    private final RequeueBackoff backoff;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Tracer tracer;
    private final WorkQueue<ReconcileKey> queue;
    private final int workers;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private ExecutorService workerPool;
    private ScheduledExecutorService delayScheduler;

    public ReconcileDispatcher(
            Reconciler reconciler,
            RequeueBackoff backoff,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            Tracer tracer,
            @Value("${podset.dispatcher.workers:2}") int workers,
            @Value("${podset.dispatcher.queue-capacity:1000}") int queueCapacity) {
        if (workers < 1) {
            throw new IllegalArgumentException("podset.dispatcher.workers must be positive: " + workers);
        }
        this.reconciler = reconciler;
        this.backoff = backoff;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.tracer = tracer;
        this.workers = workers;
        this.queue = new WorkQueue<>(queueCapacity);

        metricsRegistry.registerGauge("podset.queue.depth", "PodSet keys waiting to be reconciled", queue::size);
        metricsRegistry.registerGauge("podset.queue.processing", "PodSet keys being reconciled", queue::processingCount);
    }

    /**
     * Start the worker threads. Keys enqueued before this are kept and processed once workers run.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.debug("Dispatcher already started");
            return;
        }
        delayScheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("podset-requeue"));
        workerPool = Executors.newFixedThreadPool(workers, namedThreads("podset-worker"));
        for (int i = 0; i < workers; i++) {
            workerPool.execute(this::runWorker);
        }
        log.info("Reconcile dispatcher started with {} workers (queue capacity {})", workers, queue.getCapacity());
    }

    /**
     * Request a reconcile of {@code key}. Rejected when the queue is at capacity.
     */
    public AddOutcome enqueue(ReconcileKey key) {
        AddOutcome outcome = queue.add(key);
        switch (outcome) {
            case QUEUED -> log.debug("Enqueued PodSet {}", key);
            case DEFERRED -> log.debug("PodSet {} is being reconciled, will run again afterwards", key);
            case ALREADY_QUEUED -> {
                metricsRegistry.recordAlreadyEnqueued();
                log.debug("PodSet {} is already enqueued => ignoring", key);
            }
            case REJECTED -> {
                metricsRegistry.recordQueueRejected();
                log.warn("Work queue full ({}), dropping PodSet {} until the next resync", queue.getCapacity(), key);
            }
            case SHUT_DOWN -> log.debug("Dispatcher is shutting down, ignoring PodSet {}", key);
        }
        return outcome;
    }

    /**
     * Add {@code key} back after {@code delay}, regardless of queue capacity.
     */
    public void enqueueAfter(ReconcileKey key, Duration delay) {
        if (delayScheduler == null || queue.isShuttingDown()) {
            return;
        }
        try {
            delayScheduler.schedule(() -> requeue(key), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Requeue of PodSet {} rejected, dispatcher is stopping", key);
        }
    }

    private void requeue(ReconcileKey key) {
        AddOutcome outcome = queue.requeue(key);
        if (outcome == AddOutcome.ALREADY_QUEUED) {
            metricsRegistry.recordAlreadyEnqueued();
        }
        log.debug("Requeued PodSet {}: {}", key, outcome);
    }

    /**
     * Stop taking keys, interrupt in-flight reconciles and wait for the workers to exit.
     *
     * @return {@code true} if all workers exited within {@code timeout}
     */
    public boolean shutdown(Duration timeout) throws InterruptedException {
        queue.shutDown();
        if (!started.get()) {
            return true;
        }
        delayScheduler.shutdownNow();
        workerPool.shutdownNow();
        boolean terminated = workerPool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (terminated) {
            log.info("Reconcile dispatcher stopped");
        } else {
            log.warn("Reconcile workers did not stop within {} ms", timeout.toMillis());
        }
        return terminated;
    }

    public QueueStats getStats() {
        return new QueueStats(queue.size(), queue.processingCount(), queue.getCapacity(), workers);
    }

    private void runWorker() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Optional<ReconcileKey> next = queue.take();
                if (next.isEmpty()) {
                    break;
                }
                ReconcileKey key = next.get();
                try {
                    process(key);
                } finally {
                    queue.done(key);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Worker {} exiting", Thread.currentThread().getName());
    }

    /**
     * Run one reconcile for {@code key} and act on its outcome.
     */
    void process(ReconcileKey key) {
        LoggingConfig.setReconcileContext(key);
        Span span = tracer.spanBuilder("podset.reconcile")
            .setAttribute("podset.namespace", key.namespace())
            .setAttribute("podset.name", key.name())
            .startSpan();
        if (span.getSpanContext().isValid()) {
            MDC.put(LoggingConfig.MDC_TRACE_ID, span.getSpanContext().getTraceId());
        }

        long start = System.currentTimeMillis();
        String outcome;
        try (Scope ignored = span.makeCurrent()) {
            ReconcileResult result = reconciler.reconcile(key);
            if (result.shouldRequeue()) {
                outcome = "requeue";
                enqueueAfter(key, backoff.nextDelay(key));
            } else {
                outcome = "done";
                backoff.forget(key);
            }
        } catch (ReconcileCancelledException e) {
            if (queue.isShuttingDown()) {
                outcome = "cancelled";
                log.info("Reconcile of PodSet {} cancelled by shutdown", key);
            } else {
                outcome = "error";
                onFailure(key, e, span, System.currentTimeMillis() - start);
            }
        } catch (RuntimeException | Error e) {
            outcome = "error";
            onFailure(key, e, span, System.currentTimeMillis() - start);
        } finally {
            span.end();
            LoggingConfig.clearReconcileContext();
        }

        metricsRegistry.recordReconcile(key.namespace(), outcome, System.currentTimeMillis() - start);
    }

    private void onFailure(ReconcileKey key, Throwable e, Span span, long durationMs) {
        span.recordException(e);
        span.setStatus(StatusCode.ERROR, e.getMessage());

        Duration delay = backoff.nextDelay(key);
        String errorCode = e instanceof OperatorException oe ? oe.getErrorCode().getCode() : e.getClass().getSimpleName();
        if (e instanceof OperatorException oe && !oe.isFatal()) {
            log.warn("Reconcile of PodSet {} failed, retrying in {} ms: {}", key, delay.toMillis(), e.getMessage());
        } else {
            log.error("Reconcile of PodSet {} failed, retrying in {} ms", key, delay.toMillis(), e);
        }
        structuredLogger.reconcile().failed(key.namespace(), key.name(), errorCode, e.getMessage(), durationMs);

        enqueueAfter(key, delay);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public record QueueStats(int queued, int processing, int capacity, int workers) {}
}
