package com.platform.podset.dispatch;

import com.platform.podset.dispatch.WorkQueue.AddOutcome;
import com.platform.podset.error.ClusterStoreException;
import com.platform.podset.error.ReconcileCancelledException;
import com.platform.podset.observability.MetricsRegistry;
import com.platform.podset.observability.StructuredLogger;
import com.platform.podset.reconcile.ReconcileKey;
import com.platform.podset.reconcile.ReconcileResult;
import com.platform.podset.reconcile.Reconciler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ReconcileDispatcherTest {

    private static final ReconcileKey KEY = new ReconcileKey("default", "web");

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final RequeueBackoff backoff = new RequeueBackoff(1, 20, 2.0, 0.0);
    private ReconcileDispatcher dispatcher;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (dispatcher != null) {
            dispatcher.shutdown(Duration.ofSeconds(5));
        }
    }

    @Test
    void doneResetsBackoff() throws Exception {
        CountDownLatch reconciled = new CountDownLatch(1);
        dispatcher = dispatcher(key -> {
            reconciled.countDown();
            return ReconcileResult.done();
        }, 1, 10);
        backoff.nextDelay(KEY);

        dispatcher.start();
        dispatcher.enqueue(KEY);

        assertThat(reconciled.await(5, TimeUnit.SECONDS)).isTrue();
        awaitIdle();
        assertThat(backoff.getRequeueCount(KEY)).isZero();
        assertThat(meterRegistry.get("podset.reconcile.total").tag("outcome", "done").counter().count()).isEqualTo(1.0);
    }

    @Test
    void requeueRunsKeyAgain() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch converged = new CountDownLatch(1);
        dispatcher = dispatcher(key -> {
            if (calls.incrementAndGet() < 3) {
                return ReconcileResult.requeue();
            }
            converged.countDown();
            return ReconcileResult.done();
        }, 1, 10);

        dispatcher.start();
        dispatcher.enqueue(KEY);

        assertThat(converged.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void failureIsRetriedWithBackoff() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch recovered = new CountDownLatch(1);
        dispatcher = dispatcher(key -> {
            if (calls.incrementAndGet() == 1) {
                throw ClusterStoreException.unavailable("getPodSet", key.toString());
            }
            recovered.countDown();
            return ReconcileResult.done();
        }, 1, 10);

        dispatcher.start();
        dispatcher.enqueue(KEY);

        assertThat(recovered.await(5, TimeUnit.SECONDS)).isTrue();
        awaitIdle();
        assertThat(meterRegistry.get("podset.reconcile.total").tag("outcome", "error").counter().count()).isEqualTo(1.0);
        assertThat(backoff.getRequeueCount(KEY)).isZero();
    }

    @Test
    void sameKeyNeverReconciledConcurrently() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch secondDone = new CountDownLatch(1);
        dispatcher = dispatcher(key -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                if (calls.incrementAndGet() == 1) {
                    firstStarted.countDown();
                    release.await(5, TimeUnit.SECONDS);
                } else {
                    secondDone.countDown();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            return ReconcileResult.done();
        }, 4, 10);

        dispatcher.start();
        dispatcher.enqueue(KEY);
        assertThat(firstStarted.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(dispatcher.enqueue(KEY)).isEqualTo(AddOutcome.DEFERRED);
        assertThat(dispatcher.getStats().processing()).isEqualTo(1);
        release.countDown();

        assertThat(secondDone.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(maxInFlight.get()).isEqualTo(1);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void distinctKeysRunInParallel() throws Exception {
        CountDownLatch bothRunning = new CountDownLatch(2);
        CountDownLatch finished = new CountDownLatch(2);
        dispatcher = dispatcher(key -> {
            bothRunning.countDown();
            try {
                bothRunning.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            finished.countDown();
            return ReconcileResult.done();
        }, 2, 10);

        dispatcher.start();
        dispatcher.enqueue(new ReconcileKey("a", "one"));
        dispatcher.enqueue(new ReconcileKey("b", "two"));

        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(bothRunning.getCount()).isZero();
    }

    @Test
    void cancellationDuringShutdownIsNotRequeued() throws InterruptedException {
        dispatcher = dispatcher(key -> {
            throw new ReconcileCancelledException("listPods");
        }, 1, 10);
        dispatcher.shutdown(Duration.ofSeconds(1));

        dispatcher.process(KEY);

        assertThat(backoff.getRequeueCount(KEY)).isZero();
        assertThat(meterRegistry.get("podset.reconcile.total").tag("outcome", "cancelled").counter().count()).isEqualTo(1.0);
    }

    @Test
    void cancellationOutsideShutdownCountsAsFailure() {
        dispatcher = dispatcher(key -> {
            throw new ReconcileCancelledException("listPods");
        }, 1, 10);

        dispatcher.process(KEY);

        assertThat(backoff.getRequeueCount(KEY)).isEqualTo(1);
        assertThat(meterRegistry.get("podset.reconcile.total").tag("outcome", "error").counter().count()).isEqualTo(1.0);
    }

    @Test
    void unexpectedExceptionIsRequeued() {
        dispatcher = dispatcher(key -> {
            throw new IllegalStateException("boom");
        }, 1, 10);

        dispatcher.process(KEY);

        assertThat(backoff.getRequeueCount(KEY)).isEqualTo(1);
    }

    @Test
    void errorThrownByReconcileKeepsWorkerAlive() throws Exception {
        ReconcileKey bad = new ReconcileKey("default", "bad");
        ReconcileKey good = new ReconcileKey("default", "good");
        AtomicInteger badCalls = new AtomicInteger();
        CountDownLatch badRetried = new CountDownLatch(1);
        CountDownLatch goodReconciled = new CountDownLatch(1);
        dispatcher = dispatcher(key -> {
            if (key.equals(bad)) {
                if (badCalls.incrementAndGet() == 1) {
                    throw new AssertionError("broken invariant");
                }
                badRetried.countDown();
            } else {
                goodReconciled.countDown();
            }
            return ReconcileResult.done();
        }, 1, 10);

        dispatcher.start();
        dispatcher.enqueue(bad);
        dispatcher.enqueue(good);

        assertThat(goodReconciled.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(badRetried.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(meterRegistry.get("podset.reconcile.total").tag("outcome", "error").counter().count()).isEqualTo(1.0);
    }

    @Test
    void failedKeyIsRequeuedEvenWhenQueueIsFull() throws Exception {
        ReconcileKey blocker = new ReconcileKey("default", "blocker");
        ReconcileKey filler = new ReconcileKey("default", "filler");
        CountDownLatch blockerRunning = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        dispatcher = dispatcher(key -> {
            if (key.equals(KEY)) {
                throw ClusterStoreException.unavailable("get", key.toString());
            }
            if (key.equals(blocker)) {
                blockerRunning.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return ReconcileResult.done();
        }, 1, 1);

        dispatcher.start();
        dispatcher.enqueue(blocker);
        assertThat(blockerRunning.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(dispatcher.enqueue(filler)).isEqualTo(AddOutcome.QUEUED);
        assertThat(dispatcher.enqueue(KEY)).isEqualTo(AddOutcome.REJECTED);

        dispatcher.process(KEY);

        long deadline = System.currentTimeMillis() + 5000;
        while (dispatcher.getStats().queued() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(dispatcher.getStats().queued()).isEqualTo(2);
        release.countDown();
    }

    @Test
    void fullQueueRejectsAndCounts() {
        dispatcher = dispatcher(key -> ReconcileResult.done(), 1, 1);

        assertThat(dispatcher.enqueue(new ReconcileKey("a", "one"))).isEqualTo(AddOutcome.QUEUED);
        assertThat(dispatcher.enqueue(new ReconcileKey("a", "one"))).isEqualTo(AddOutcome.ALREADY_QUEUED);
        assertThat(dispatcher.enqueue(new ReconcileKey("a", "two"))).isEqualTo(AddOutcome.REJECTED);

        assertThat(meterRegistry.get("podset.queue.rejected").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("podset.queue.deduplicated").counter().count()).isEqualTo(1.0);
        assertThat(dispatcher.getStats()).isEqualTo(new ReconcileDispatcher.QueueStats(1, 0, 1, 1));
    }

    @Test
    void keysEnqueuedBeforeStartAreProcessed() throws Exception {
        CountDownLatch reconciled = new CountDownLatch(1);
        dispatcher = dispatcher(key -> {
            reconciled.countDown();
            return ReconcileResult.done();
        }, 1, 10);

        dispatcher.enqueue(KEY);
        dispatcher.start();

        assertThat(reconciled.await(5, TimeUnit.SECONDS)).isTrue();
    }

    private ReconcileDispatcher dispatcher(Reconciler reconciler, int workers, int capacity) {
        return new ReconcileDispatcher(
            reconciler,
            backoff,
            new MetricsRegistry(meterRegistry),
            new StructuredLogger(),
            OpenTelemetry.noop().getTracer("test"),
            workers,
            capacity);
    }

    private void awaitIdle() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            ReconcileDispatcher.QueueStats stats = dispatcher.getStats();
            if (stats.queued() == 0 && stats.processing() == 0) {
                return;
            }
            Thread.sleep(10);
        }
    }
}
