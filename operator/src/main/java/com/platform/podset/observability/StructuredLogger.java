package com.platform.podset.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Structured logger for reconcile and lifecycle events.
 * Events are JSON-formatted and written to dedicated {@code structured.*} loggers.
 */
@Component
public class StructuredLogger {

    @Value("${otel.service.name:podset-operator}")
    private String serviceName;

    @Value("${otel.environment:development}")
    private String environment;

    public ReconcileLogger reconcile() {
        return new ReconcileLogger(serviceName, environment);
    }

    public LifecycleLogger lifecycle() {
        return new LifecycleLogger(serviceName, environment);
    }

    // ==================== RECONCILE LOGGER ====================

    public static class ReconcileLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.reconcile");
        private final String service;
        private final String environment;

        ReconcileLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }

        public void statusUpdated(String namespace, String podSet, List<String> podNames) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.RECONCILE_STATUS_UPDATED, "INFO")
                .namespace(namespace)
                .podSet(podSet)
                .available(podNames.size())
                .context(Map.of("pod_names", podNames))
                .build();
            log.info(event.toJson());
        }

        public void scaledUp(String namespace, String podSet, String pod, int available, int desired) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.RECONCILE_SCALED_UP, "INFO")
                .namespace(namespace)
                .podSet(podSet)
                .pod(pod)
                .available(available)
                .desired(desired)
                .success(true)
                .build();
            log.info(event.toJson());
        }

        public void scaledDown(String namespace, String podSet, int deleted, int available, int desired,
                boolean success) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.RECONCILE_SCALED_DOWN, success ? "INFO" : "WARN")
                .namespace(namespace)
                .podSet(podSet)
                .available(available)
                .desired(desired)
                .success(success)
                .context(Map.of("deleted", deleted))
                .build();
            if (success) {
                log.info(event.toJson());
            } else {
                log.warn(event.toJson());
            }
        }

        public void failed(String namespace, String podSet, String errorCode, String errorMessage, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.RECONCILE_FAILED, "ERROR")
                .namespace(namespace)
                .podSet(podSet)
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .durationMs(durationMs)
                .build();
            log.error(event.toJson());
        }

        public void orphanDeleted(String namespace, String pod, String owner) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.ORPHAN_POD_DELETED, "INFO")
                .namespace(namespace)
                .pod(pod)
                .podSet(owner)
                .success(true)
                .build();
            log.info(event.toJson());
        }
    }

    // ==================== LIFECYCLE LOGGER ====================

    public static class LifecycleLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.lifecycle");
        private final String service;
        private final String environment;

        LifecycleLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }

        public void started(String watchNamespace, int workers) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.OPERATOR_STARTED, "INFO")
                .namespace(watchNamespace)
                .context(Map.of("workers", workers))
                .build();
            log.info(event.toJson());
        }

        public void stopped(long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.OPERATOR_STOPPED, "INFO")
                .durationMs(durationMs)
                .build();
            log.info(event.toJson());
        }
    }
}
