package com.platform.podset.lifecycle;

import com.platform.podset.dispatch.PodSetEventSource;
import com.platform.podset.dispatch.ReconcileDispatcher;
import com.platform.podset.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the reconcile workers and the watch informers once the context is up.
 */
@Slf4j
@Component
public class ApplicationStartupListener {

    private final ApplicationLifecycleManager lifecycleManager;
    private final ReconcileDispatcher dispatcher;
    private final PodSetEventSource eventSource;
    private final StructuredLogger structuredLogger;

    public ApplicationStartupListener(
            ApplicationLifecycleManager lifecycleManager,
            ReconcileDispatcher dispatcher,
            PodSetEventSource eventSource,
            StructuredLogger structuredLogger) {
        this.lifecycleManager = lifecycleManager;
        this.dispatcher = dispatcher;
        this.eventSource = eventSource;
        this.structuredLogger = structuredLogger;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        // workers first so that the initial informer list lands in a running queue
        dispatcher.start();
        eventSource.start();

        log.info("Operator startup complete, watching {}", eventSource.describeScope());
        structuredLogger.lifecycle().started(eventSource.describeScope(), dispatcher.getStats().workers());
        lifecycleManager.markReady();
    }
}
