package com.platform.podset.error;

/**
 * A cluster call observed that its thread was interrupted, normally because the operator is shutting down.
 */
public class ReconcileCancelledException extends OperatorException {

    public ReconcileCancelledException(String operation) {
        super(ErrorCode.RECONCILE_CANCELLED, "Cancelled before " + operation);
    }

    public ReconcileCancelledException(String operation, Throwable cause) {
        super(ErrorCode.RECONCILE_CANCELLED, "Cancelled during " + operation, cause);
    }
}
