package com.platform.podset.observability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Builder;
import lombok.Data;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Map;

/**
 * Structured log event schema.
 *
 * Mandatory fields:
 * - timestamp (RFC3339)
 * - level
 * - service
 * - environment
 * - event_type
 *
 * Optional contextual fields from MDC:
 * - trace_id
 * - reconcile_id
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StructuredLogEvent {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    // Mandatory fields
    private String timestamp;
    private String level;
    private String service;
    private String environment;
    private LogEventType eventType;

    // Trace context (from MDC)
    private String traceId;
    private String reconcileId;

    // Event-specific data
    private String message;
    private String namespace;
    private String podSet;
    private String pod;
    private Integer available;
    private Integer desired;
    private Boolean success;
    private Long durationMs;
    private String errorCode;
    private String errorMessage;

    private Map<String, Object> context;

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            return String.format("{\"event_type\":\"%s\",\"message\":\"%s\",\"error\":\"serialization_failed\"}",
                eventType, message);
        }
    }

    /**
     * Create builder with mandatory fields from context.
     */
    public static StructuredLogEventBuilder fromContext(
            String service, String environment, LogEventType eventType, String level) {

        return StructuredLogEvent.builder()
            .timestamp(Instant.now().toString())
            .level(level)
            .service(service)
            .environment(environment)
            .eventType(eventType)
            .traceId(MDC.get(LoggingConfig.MDC_TRACE_ID))
            .reconcileId(MDC.get(LoggingConfig.MDC_RECONCILE_ID));
    }
}
