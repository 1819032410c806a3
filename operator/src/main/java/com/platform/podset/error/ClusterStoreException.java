package com.platform.podset.error;

import io.fabric8.kubernetes.client.KubernetesClientException;

import java.net.HttpURLConnection;

/**
 * Failure of a Cluster API call (fetch, list, create, delete, status update).
 */
public class ClusterStoreException extends OperatorException {

    private final String operation;
    private final int statusCode;

    public ClusterStoreException(ErrorCode errorCode, String operation, int statusCode, String message) {
        super(errorCode, message);
        this.operation = operation;
        this.statusCode = statusCode;
    }

    public ClusterStoreException(ErrorCode errorCode, String operation, int statusCode, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.operation = operation;
        this.statusCode = statusCode;
    }

    /**
     * Translate a fabric8 client failure. Code 0 means the request never got an HTTP answer.
     */
    public static ClusterStoreException from(String operation, String target, KubernetesClientException e) {
        int code = e.getCode();
        ErrorCode errorCode;
        if (code == HttpURLConnection.HTTP_CONFLICT) {
            errorCode = ErrorCode.RESOURCE_CONFLICT;
        } else if (code == HttpURLConnection.HTTP_NOT_FOUND) {
            errorCode = ErrorCode.RESOURCE_NOT_FOUND;
        } else if (code == 0 || code >= HttpURLConnection.HTTP_INTERNAL_ERROR) {
            errorCode = ErrorCode.CLUSTER_API_UNAVAILABLE;
        } else {
            errorCode = ErrorCode.CLUSTER_API_ERROR;
        }
        return new ClusterStoreException(
            errorCode,
            operation,
            code,
            String.format("%s %s failed (HTTP %d): %s", operation, target, code, e.getMessage()),
            e
        );
    }

    public static ClusterStoreException conflict(String operation, String target) {
        return new ClusterStoreException(
            ErrorCode.RESOURCE_CONFLICT,
            operation,
            HttpURLConnection.HTTP_CONFLICT,
            String.format("%s %s failed: object has been modified", operation, target)
        );
    }

    public static ClusterStoreException unavailable(String operation, String target) {
        return new ClusterStoreException(
            ErrorCode.CLUSTER_API_UNAVAILABLE,
            operation,
            HttpURLConnection.HTTP_UNAVAILABLE,
            String.format("%s %s failed: cluster API unavailable", operation, target)
        );
    }

    public String getOperation() {
        return operation;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isConflict() {
        return getErrorCode() == ErrorCode.RESOURCE_CONFLICT;
    }

    public boolean isNotFound() {
        return getErrorCode() == ErrorCode.RESOURCE_NOT_FOUND;
    }
}
