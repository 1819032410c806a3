package com.platform.podset.dispatch;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, deduplicating work queue with per-key mutual exclusion.
 *
 * <p>A key is in at most one of three places: waiting in the queue, being processed,
 * or both (re-added while processing, in which case it is held back until {@link #done}).
 * A key handed out by {@link #take} is never handed to another taker before {@code done}
 * is called for it.
 *
 * @param <K> key type, must implement equals/hashCode
 */
public class WorkQueue<K> {

    /**
     * Result of {@link #add}.
     */
    public enum AddOutcome {
        QUEUED,
        /** already waiting in the queue */
        ALREADY_QUEUED,
        /** being processed, will be queued again when done */
        DEFERRED,
        /** queue is at capacity, never returned by {@link #requeue} */
        REJECTED,
        SHUT_DOWN
    }

    private final int capacity;
    private final Deque<K> queue = new ArrayDeque<>();
    private final Set<K> dirty = new HashSet<>();
    private final Set<K> processing = new HashSet<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private boolean shuttingDown;

    public WorkQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public AddOutcome add(K key) {
        return add(key, true);
    }

    /**
     * Add back a key that was already admitted once, e.g. after a failed reconcile. Not subject to capacity.
     */
    public AddOutcome requeue(K key) {
        return add(key, false);
    }

    private AddOutcome add(K key, boolean bounded) {
        lock.lock();
        try {
            if (shuttingDown) {
                return AddOutcome.SHUT_DOWN;
            }
            if (dirty.contains(key)) {
                return processing.contains(key) ? AddOutcome.DEFERRED : AddOutcome.ALREADY_QUEUED;
            }
            if (processing.contains(key)) {
                dirty.add(key);
                return AddOutcome.DEFERRED;
            }
            if (bounded && queue.size() >= capacity) {
                return AddOutcome.REJECTED;
            }
            dirty.add(key);
            queue.addLast(key);
            notEmpty.signal();
            return AddOutcome.QUEUED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until a key is available and mark it as processing.
     *
     * @return the key, or empty once the queue is shut down
     */
    public Optional<K> take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty() && !shuttingDown) {
                notEmpty.await();
            }
            return poll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #take} but gives up after {@code timeout}.
     */
    public Optional<K> take(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty() && !shuttingDown) {
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return poll();
        } finally {
            lock.unlock();
        }
    }

    private Optional<K> poll() {
        if (shuttingDown) {
            return Optional.empty();
        }
        K key = queue.pollFirst();
        dirty.remove(key);
        processing.add(key);
        return Optional.of(key);
    }

    /**
     * Release a key taken with {@link #take}. If it was re-added meanwhile it goes back in the queue.
     */
    public void done(K key) {
        lock.lock();
        try {
            processing.remove(key);
            if (dirty.contains(key) && !shuttingDown) {
                queue.addLast(key);
                notEmpty.signal();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop handing out keys and wake every blocked taker.
     */
    public void shutDown() {
        lock.lock();
        try {
            shuttingDown = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isShuttingDown() {
        lock.lock();
        try {
            return shuttingDown;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Keys waiting to be taken.
     */
    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int processingCount() {
        lock.lock();
        try {
            return processing.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isProcessing(K key) {
        lock.lock();
        try {
            return processing.contains(key);
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }
}
