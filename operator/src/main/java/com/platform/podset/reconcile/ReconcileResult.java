package com.platform.podset.reconcile;

/**
 * What the dispatcher should do after a successful reconcile. Failures are thrown instead.
 */
public record ReconcileResult(boolean shouldRequeue) {

    private static final ReconcileResult DONE = new ReconcileResult(false);
    private static final ReconcileResult REQUEUE = new ReconcileResult(true);

    /**
     * Converged for now; the next watch event will trigger another reconcile.
     */
    public static ReconcileResult done() {
        return DONE;
    }

    /**
     * Work was done and the key should be reconciled again.
     */
    public static ReconcileResult requeue() {
        return REQUEUE;
    }
}
