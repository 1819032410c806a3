package com.platform.podset.sweep;

import com.platform.podset.crd.PodSet;
import com.platform.podset.observability.MetricsRegistry;
import com.platform.podset.observability.StructuredLogger;
import com.platform.podset.reconcile.PodSelection;
import com.platform.podset.reconcile.PodTemplates;
import com.platform.podset.store.ClusterStore;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Pod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Periodic cleanup of managed pods whose owning PodSet is gone.
 *
 * The cluster garbage collector normally does this through the owner reference, so the sweep
 * is off unless {@code podset.orphan-sweep.enabled=true}. A pod is an orphan when its PodSet
 * controller reference names a PodSet that does not exist, or one with a different UID
 * (deleted and recreated under the same name).
 */
@Slf4j
@Service
public class OrphanPodSweeper {

    private final ClusterStore store;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final boolean enabled;
    private final String watchNamespace;

    public OrphanPodSweeper(
            ClusterStore store,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            @Value("${podset.orphan-sweep.enabled:false}") boolean enabled,
            @Value("${podset.watch-namespace:}") String watchNamespace) {
        this.store = store;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.enabled = enabled;
        this.watchNamespace = watchNamespace == null || watchNamespace.isBlank() ? null : watchNamespace;
    }

    @Scheduled(
        fixedDelayString = "${podset.orphan-sweep.interval-ms:60000}",
        initialDelayString = "${podset.orphan-sweep.interval-ms:60000}")
    public void periodicSweep() {
        if (!enabled) {
            return;
        }
        try {
            SweepResult result = sweep();
            if (result.deleted() > 0 || result.failed() > 0) {
                log.info("Orphan sweep complete: scanned={}, deleted={}, failed={}",
                    result.scanned(), result.deleted(), result.failed());
            }
        } catch (RuntimeException e) {
            log.error("Orphan sweep failed: {}", e.getMessage());
            metricsRegistry.incrementCounter("podset.orphan_sweep.error");
        }
    }

    /**
     * Run one sweep. Listing failures propagate; a failure on a single pod is logged and counted.
     */
    public SweepResult sweep() {
        List<Pod> pods = watchNamespace == null
            ? store.listPodsInAnyNamespace(PodSelection.managedPodLabels())
            : store.listPods(watchNamespace, PodSelection.managedPodLabels());

        // owner lookups cached per sweep, keyed by namespace/name
        Map<String, Optional<PodSet>> owners = new HashMap<>();
        int deleted = 0;
        int failed = 0;

        for (Pod pod : pods) {
            OwnerReference ref = PodTemplates.findPodSetOwner(pod);
            if (ref == null) {
                continue;
            }
            String namespace = pod.getMetadata().getNamespace();
            try {
                Optional<PodSet> owner = owners.computeIfAbsent(namespace + "/" + ref.getName(),
                    k -> store.findPodSet(namespace, ref.getName()));
                if (!isOrphan(ref, owner)) {
                    continue;
                }
                if (store.deletePod(pod)) {
                    deleted++;
                    metricsRegistry.recordOrphanDeleted(namespace);
                    structuredLogger.reconcile().orphanDeleted(namespace, pod.getMetadata().getName(), ref.getName());
                    log.info("Deleted orphaned pod {}/{} (owner {} uid {})",
                        namespace, pod.getMetadata().getName(), ref.getName(), ref.getUid());
                }
            } catch (RuntimeException e) {
                failed++;
                metricsRegistry.incrementCounter("podset.orphan_sweep.pod_failure", "namespace", namespace);
                log.warn("Could not sweep pod {}/{}: {}", namespace, pod.getMetadata().getName(), e.getMessage());
            }
        }
        return new SweepResult(pods.size(), deleted, failed);
    }

    static boolean isOrphan(OwnerReference ref, Optional<PodSet> owner) {
        return owner.map(podSet -> !Objects.equals(podSet.getMetadata().getUid(), ref.getUid())).orElse(true);
    }

    public record SweepResult(int scanned, int deleted, int failed) {}
}
