package com.platform.podset.observability;

public enum LogEventType {
    RECONCILE_STATUS_UPDATED,
    RECONCILE_SCALED_UP,
    RECONCILE_SCALED_DOWN,
    RECONCILE_FAILED,
    ORPHAN_POD_DELETED,
    OPERATOR_STARTED,
    OPERATOR_STOPPED
}
