package com.platform.podset.api;

import com.platform.podset.dispatch.ReconcileDispatcher;
import com.platform.podset.dispatch.WorkQueue.AddOutcome;
import com.platform.podset.error.QueueFullException;
import com.platform.podset.error.ValidationException;
import com.platform.podset.reconcile.ReconcileKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST API for manual reconcile triggers and work queue inspection.
 */
@Slf4j
@RestController
@RequestMapping("/api/reconciliation")
public class ReconciliationController {

    private final ReconcileDispatcher dispatcher;

    public ReconciliationController(ReconcileDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * Enqueue a PodSet for reconciliation. The reconcile runs asynchronously.
     */
    @PostMapping("/trigger")
    public ResponseEntity<Map<String, String>> trigger(
            @RequestParam(required = false) String namespace,
            @RequestParam(required = false) String name) {
        if (namespace == null || namespace.isBlank()) {
            throw new ValidationException("namespace", "must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", "must not be blank");
        }

        ReconcileKey key = new ReconcileKey(namespace, name);
        AddOutcome outcome = dispatcher.enqueue(key);
        log.info("Manual reconcile of PodSet {} requested: {}", key, outcome);

        return switch (outcome) {
            case REJECTED -> throw new QueueFullException(key.toString(), dispatcher.getStats().capacity());
            case SHUT_DOWN -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("key", key.toString(), "outcome", outcome.name()));
            default -> ResponseEntity.accepted()
                .body(Map.of("key", key.toString(), "outcome", outcome.name()));
        };
    }

    @GetMapping("/queue")
    public ReconcileDispatcher.QueueStats queue() {
        return dispatcher.getStats();
    }
}
