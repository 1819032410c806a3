package com.platform.podset.dispatch;

import com.platform.podset.dispatch.WorkQueue.AddOutcome;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkQueueTest {

    @Test
    void deduplicatesQueuedKeys() throws Exception {
        WorkQueue<String> queue = new WorkQueue<>(10);

        assertThat(queue.add("a")).isEqualTo(AddOutcome.QUEUED);
        assertThat(queue.add("a")).isEqualTo(AddOutcome.ALREADY_QUEUED);
        assertThat(queue.add("b")).isEqualTo(AddOutcome.QUEUED);

        assertThat(queue.size()).isEqualTo(2);
        assertThat(queue.take()).contains("a");
        assertThat(queue.take()).contains("b");
    }

    @Test
    void keyAddedWhileProcessingIsRequeuedOnDone() throws Exception {
        WorkQueue<String> queue = new WorkQueue<>(10);
        queue.add("a");
        assertThat(queue.take()).contains("a");

        assertThat(queue.add("a")).isEqualTo(AddOutcome.DEFERRED);
        assertThat(queue.add("a")).isEqualTo(AddOutcome.DEFERRED);
        assertThat(queue.size()).isZero();

        queue.done("a");

        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.take(1, TimeUnit.SECONDS)).contains("a");
    }

    @Test
    void processingKeyIsNotHandedToSecondTaker() throws Exception {
        WorkQueue<String> queue = new WorkQueue<>(10);
        queue.add("a");
        queue.take();
        queue.add("a");

        assertThat(queue.isProcessing("a")).isTrue();
        assertThat(queue.take(50, TimeUnit.MILLISECONDS)).isEmpty();

        queue.done("a");
        assertThat(queue.take(1, TimeUnit.SECONDS)).contains("a");
    }

    @Test
    void doneWithoutReAddReleasesKey() throws Exception {
        WorkQueue<String> queue = new WorkQueue<>(10);
        queue.add("a");
        queue.take();

        queue.done("a");

        assertThat(queue.isProcessing("a")).isFalse();
        assertThat(queue.processingCount()).isZero();
        assertThat(queue.size()).isZero();
    }

    @Test
    void rejectsNewKeysAtCapacity() {
        WorkQueue<String> queue = new WorkQueue<>(2);
        queue.add("a");
        queue.add("b");

        assertThat(queue.add("c")).isEqualTo(AddOutcome.REJECTED);
        assertThat(queue.add("a")).isEqualTo(AddOutcome.ALREADY_QUEUED);
        assertThat(queue.size()).isEqualTo(2);
    }

    @Test
    void requeueIsNotBoundByCapacity() {
        WorkQueue<String> queue = new WorkQueue<>(1);
        queue.add("a");

        assertThat(queue.add("b")).isEqualTo(AddOutcome.REJECTED);
        assertThat(queue.requeue("b")).isEqualTo(AddOutcome.QUEUED);
        assertThat(queue.requeue("b")).isEqualTo(AddOutcome.ALREADY_QUEUED);
        assertThat(queue.size()).isEqualTo(2);
    }

    @Test
    void shutDownWakesBlockedTakers() throws Exception {
        WorkQueue<String> queue = new WorkQueue<>(10);
        CompletableFuture<Optional<String>> taker = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.take();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(50);
        queue.shutDown();

        assertThat(taker.get(5, TimeUnit.SECONDS)).isEmpty();
        assertThat(queue.add("a")).isEqualTo(AddOutcome.SHUT_DOWN);
        assertThat(queue.isShuttingDown()).isTrue();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new WorkQueue<String>(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
