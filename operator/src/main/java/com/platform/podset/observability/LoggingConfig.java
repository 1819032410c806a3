package com.platform.podset.observability;

import ch.qos.logback.classic.LoggerContext;
import com.platform.podset.reconcile.ReconcileKey;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

/**
 * Logging setup and the MDC keys attached to every reconcile.
 */
@Slf4j
@Configuration
public class LoggingConfig {

    public static final String MDC_NAMESPACE = "namespace";
    public static final String MDC_PODSET = "podset";
    public static final String MDC_RECONCILE_ID = "reconcileId";
    public static final String MDC_TRACE_ID = "traceId";

    @Value("${spring.application.name:podset-operator}")
    private String applicationName;

    @PostConstruct
    public void init() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.putProperty("application", applicationName);

        log.info("Logging configuration initialized for application: {}", applicationName);
    }

    /**
     * Put the reconcile key and a fresh reconcile id into the MDC.
     */
    public static void setReconcileContext(ReconcileKey key) {
        MDC.put(MDC_NAMESPACE, key.namespace());
        MDC.put(MDC_PODSET, key.name());
        MDC.put(MDC_RECONCILE_ID, UUID.randomUUID().toString().substring(0, 8));
    }

    public static void clearReconcileContext() {
        MDC.remove(MDC_NAMESPACE);
        MDC.remove(MDC_PODSET);
        MDC.remove(MDC_RECONCILE_ID);
        MDC.remove(MDC_TRACE_ID);
    }
}
