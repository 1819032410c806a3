package com.platform.podset.error;

import com.platform.podset.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Converts exceptions raised by the REST controllers into {@link ErrorResponse} bodies.
 * Every handled error is logged and counted.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final MetricsRegistry metricsRegistry;

    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Resource not found: {} ({})",
            traceId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());

        ErrorResponse response = ErrorResponse.builder()
            .code(ex.getErrorCode().getCode())
            .message(ex.getMessage())
            .fatal(false)
            .status(HttpStatus.NOT_FOUND.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .metadata(Map.of(
                "resourceType", ex.getResourceType(),
                "resourceId", ex.getResourceId()
            ))
            .build();

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    @ExceptionHandler(ClusterStoreException.class)
    public ResponseEntity<ErrorResponse> handleClusterStore(
            ClusterStoreException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();
        HttpStatus status = mapErrorCodeToStatus(ex.getErrorCode());

        log.error("[{}] Cluster API call failed: {} - {}", traceId, ex.getOperation(), ex.getMessage());
        recordMetric(ex.getErrorCode());

        ErrorResponse response = ErrorResponse.builder()
            .code(ex.getErrorCode().getCode())
            .message(ex.getMessage())
            .fatal(ex.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .metadata(Map.of(
                "operation", ex.getOperation(),
                "statusCode", ex.getStatusCode()
            ))
            .build();

        return ResponseEntity.status(status).body(response);
    }

    @ExceptionHandler(OperatorException.class)
    public ResponseEntity<ErrorResponse> handleOperatorException(
            OperatorException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);

        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
        recordMetric(errorCode);

        return ResponseEntity.status(status)
            .body(ErrorResponse.of(errorCode, ex.getMessage(), status.value(), request.getRequestURI(), traceId));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Missing parameter: {}", traceId, ex.getParameterName());
        recordMetric(ErrorCode.MISSING_REQUIRED_FIELD);

        return ResponseEntity.badRequest().body(ErrorResponse.of(
            ErrorCode.MISSING_REQUIRED_FIELD,
            String.format("Missing required parameter: %s", ex.getParameterName()),
            HttpStatus.BAD_REQUEST.value(),
            request.getRequestURI(),
            traceId));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.INTERNAL_ERROR);

        ErrorResponse response = ErrorResponse.builder()
            .code(ErrorCode.INTERNAL_ERROR.getCode())
            .message("An unexpected error occurred")
            .detail(ex.getClass().getSimpleName() + ": " + ex.getMessage())
            .fatal(true)
            .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    private String getOrCreateTraceId() {
        String traceId = MDC.get("traceId");
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
            MDC.put("traceId", traceId);
        }
        return traceId;
    }

    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.incrementCounter("podset.api.errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
    }

    private HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND, PODSET_NOT_FOUND ->
                HttpStatus.NOT_FOUND;
            case RESOURCE_CONFLICT ->
                HttpStatus.CONFLICT;
            case VALIDATION_ERROR, MISSING_REQUIRED_FIELD, INVALID_FIELD_VALUE ->
                HttpStatus.BAD_REQUEST;
            case CLUSTER_API_UNAVAILABLE, QUEUE_FULL, RECONCILE_CANCELLED ->
                HttpStatus.SERVICE_UNAVAILABLE;
            case CLUSTER_API_ERROR ->
                HttpStatus.BAD_GATEWAY;
            default ->
                HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
