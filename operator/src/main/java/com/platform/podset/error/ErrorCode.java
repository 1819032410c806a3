package com.platform.podset.error;

/**
 * Standardized error codes for the operator.
 *
 * Format: PS-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: Cluster API errors
 * - 5xx: Reconciliation errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {

    // ==================== Validation Errors (1xx) ====================

    VALIDATION_ERROR("PS-100", "Validation error", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("PS-102", "Missing required field", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("PS-103", "Invalid field value", ErrorCategory.RECOVERABLE),

    // ==================== Resource Errors (3xx) ====================

    RESOURCE_NOT_FOUND("PS-300", "Resource not found", ErrorCategory.RECOVERABLE),
    PODSET_NOT_FOUND("PS-301", "PodSet not found", ErrorCategory.RECOVERABLE),
    RESOURCE_CONFLICT("PS-310", "Concurrent modification", ErrorCategory.RECOVERABLE),

    // ==================== Cluster API Errors (4xx) ====================

    CLUSTER_API_ERROR("PS-400", "Cluster API request failed", ErrorCategory.RECOVERABLE),
    CLUSTER_API_UNAVAILABLE("PS-401", "Cluster API unavailable", ErrorCategory.RECOVERABLE),

    // ==================== Reconciliation Errors (5xx) ====================

    OWNER_REFERENCE_INVALID("PS-500", "Owner reference cannot be set", ErrorCategory.FATAL),
    RECONCILE_CANCELLED("PS-501", "Reconciliation cancelled", ErrorCategory.RECOVERABLE),
    QUEUE_FULL("PS-502", "Work queue is full", ErrorCategory.RECOVERABLE),

    // ==================== Internal Errors (9xx) ====================

    INTERNAL_ERROR("PS-900", "Internal server error", ErrorCategory.FATAL);

    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;

    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }

    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }

    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - a later reconcile or request may succeed.
         */
        RECOVERABLE,

        /**
         * Fatal errors - retrying will not help without a change to the resource or code.
         */
        FATAL
    }
}
