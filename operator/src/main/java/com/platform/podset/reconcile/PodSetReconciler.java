package com.platform.podset.reconcile;

import com.platform.podset.crd.PodSet;
import com.platform.podset.crd.PodSetStatus;
import com.platform.podset.observability.MetricsRegistry;
import com.platform.podset.observability.StructuredLogger;
import com.platform.podset.store.ClusterStore;
import io.fabric8.kubernetes.api.model.Pod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Converges the live pods of a PodSet toward {@code spec.replicas}.
 *
 * <p>Each call re-derives everything from the cluster: it lists the pods labelled for the
 * PodSet, keeps those that are live (not deleting, Pending or Running), publishes their
 * names as the status, then deletes the surplus or creates a single missing pod.
 * Scale-up creates one pod per call; the pod's creation event brings the
 * PodSet back through the queue.
 *
 * <p>No locking: the dispatcher never runs two reconciles for the same key.
 */
@Slf4j
@Component
public class PodSetReconciler implements Reconciler {

    private final ClusterStore store;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;

    public PodSetReconciler(ClusterStore store, MetricsRegistry metricsRegistry, StructuredLogger structuredLogger) {
        this.store = store;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
    }

    @Override
    public ReconcileResult reconcile(ReconcileKey key) {
        Optional<PodSet> found = store.findPodSet(key.namespace(), key.name());
        if (found.isEmpty()) {
            // owned pods are removed by garbage collection through their owner references
            log.debug("PodSet {} no longer exists, nothing to do", key);
            return ReconcileResult.done();
        }
        PodSet podSet = found.get();

        List<Pod> pods = store.listPods(key.namespace(), PodSelection.labelsFor(key.name()));
        List<Pod> available = PodSelection.livePods(pods);

        updateStatusIfChanged(podSet, available);

        int availableCount = available.size();
        int desired = podSet.desiredReplicas();

        if (availableCount > desired) {
            return scaleDown(podSet, available, availableCount - desired, desired);
        }
        if (availableCount < desired) {
            return scaleUp(podSet, availableCount, desired);
        }

        log.debug("PodSet {} has {} of {} pods available", key, availableCount, desired);
        return ReconcileResult.done();
    }

    private void updateStatusIfChanged(PodSet podSet, List<Pod> available) {
        PodSetStatus status = new PodSetStatus(PodSelection.namesOf(available));
        if (status.equals(podSet.getStatus())) {
            return;
        }

        podSet.setStatus(status);
        try {
            store.updateStatus(podSet);
        } catch (RuntimeException e) {
            log.error("Failed to update status of PodSet {}/{}",
                podSet.getMetadata().getNamespace(), podSet.getMetadata().getName());
            throw e;
        }

        metricsRegistry.recordStatusUpdate(podSet.getMetadata().getNamespace());
        structuredLogger.reconcile().statusUpdated(
            podSet.getMetadata().getNamespace(), podSet.getMetadata().getName(), status.getPodNames());
    }

    /**
     * Delete the first {@code surplus} live pods. Every deletion is attempted; the first failure
     * is rethrown afterwards with the later ones attached as suppressed.
     */
    private ReconcileResult scaleDown(PodSet podSet, List<Pod> available, int surplus, int desired) {
        String namespace = podSet.getMetadata().getNamespace();
        String name = podSet.getMetadata().getName();
        log.info("Scaling down PodSet {}/{}: available={}, desired={}", namespace, name, available.size(), desired);

        RuntimeException firstError = null;
        int deleted = 0;
        for (Pod pod : available.subList(0, surplus)) {
            try {
                if (!store.deletePod(pod)) {
                    log.debug("Pod {} was already gone", pod.getMetadata().getName());
                }
                deleted++;
            } catch (RuntimeException e) {
                log.error("Failed to delete pod {} of PodSet {}/{}: {}",
                    pod.getMetadata().getName(), namespace, name, e.getMessage());
                metricsRegistry.recordDeleteFailure(namespace);
                if (firstError == null) {
                    firstError = e;
                } else {
                    firstError.addSuppressed(e);
                }
            }
        }

        metricsRegistry.recordScaleDown(namespace, deleted);
        structuredLogger.reconcile().scaledDown(namespace, name, deleted, available.size(), desired, firstError == null);

        if (firstError != null) {
            throw firstError;
        }
        return ReconcileResult.requeue();
    }

    private ReconcileResult scaleUp(PodSet podSet, int available, int desired) {
        String namespace = podSet.getMetadata().getNamespace();
        String name = podSet.getMetadata().getName();
        log.info("Scaling up PodSet {}/{}: available={}, desired={}", namespace, name, available, desired);

        Pod pod = PodTemplates.newPodFor(podSet);
        PodTemplates.setControllerReference(podSet, pod);

        Pod created;
        try {
            created = store.createPod(pod);
        } catch (RuntimeException e) {
            log.error("Failed to create a new pod for PodSet {}/{}", namespace, name);
            throw e;
        }

        metricsRegistry.recordScaleUp(namespace);
        structuredLogger.reconcile().scaledUp(namespace, name, created.getMetadata().getName(), available, desired);
        return ReconcileResult.requeue();
    }
}
