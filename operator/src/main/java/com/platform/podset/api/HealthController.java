package com.platform.podset.api;

import com.platform.podset.dispatch.PodSetEventSource;
import com.platform.podset.lifecycle.ApplicationLifecycleManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness and readiness probes.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final ApplicationLifecycleManager lifecycleManager;
    private final PodSetEventSource eventSource;

    public HealthController(ApplicationLifecycleManager lifecycleManager, PodSetEventSource eventSource) {
        this.lifecycleManager = lifecycleManager;
        this.eventSource = eventSource;
    }

    @GetMapping("/live")
    public ResponseEntity<Map<String, String>> liveness() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    /**
     * Ready once the operator is started and both informers finished their initial list.
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> readiness() {
        ApplicationLifecycleManager.LifecyclePhase phase = lifecycleManager.getCurrentPhase();
        boolean synced = eventSource.isSynced();

        if (lifecycleManager.isReady() && synced) {
            return ResponseEntity.ok(Map.of("status", "UP", "phase", phase.name()));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
            "status", "DOWN",
            "phase", phase.name(),
            "informersSynced", synced
        ));
    }
}
