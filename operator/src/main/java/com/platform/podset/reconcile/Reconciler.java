package com.platform.podset.reconcile;

/**
 * One convergence step for one key. Implementations are invoked by
 * {@link com.platform.podset.dispatch.ReconcileDispatcher}, which guarantees that a key
 * is never reconciled by two threads at once.
 */
@FunctionalInterface
public interface Reconciler {

    /**
     * @throws RuntimeException any failure; the dispatcher requeues the key with backoff
     */
    ReconcileResult reconcile(ReconcileKey key);
}
