package com.platform.podset.dispatch;

import com.platform.podset.crd.PodSet;
import com.platform.podset.reconcile.PodSelection;
import com.platform.podset.reconcile.PodTemplates;
import com.platform.podset.reconcile.ReconcileKey;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Turns PodSet and pod watch events into reconcile requests.
 *
 * <p>PodSet events enqueue the PodSet itself. Pod events (only pods carrying the managed
 * {@code version} label) enqueue the PodSet named by the pod's controller owner reference.
 * The informers resync periodically, which re-enqueues every PodSet and managed pod.
 */
@Slf4j
@Component
public class PodSetEventSource {

    private final KubernetesClient client;
    private final ReconcileDispatcher dispatcher;
    private final String watchNamespace;
    private final long resyncMs;

    private SharedIndexInformer<PodSet> podSetInformer;
    private SharedIndexInformer<Pod> podInformer;

    public PodSetEventSource(
            KubernetesClient client,
            ReconcileDispatcher dispatcher,
            @Value("${podset.watch-namespace:}") String watchNamespace,
            @Value("${podset.informer.resync-ms:300000}") long resyncMs) {
        this.client = client;
        this.dispatcher = dispatcher;
        this.watchNamespace = watchNamespace == null || watchNamespace.isBlank() ? null : watchNamespace;
        this.resyncMs = resyncMs;
    }

    /**
     * Create and start both informers. Does not wait for the initial list.
     */
    public synchronized void start() {
        if (podSetInformer != null) {
            return;
        }
        Map<String, String> managed = PodSelection.managedPodLabels();

        podSetInformer = watchNamespace == null
            ? client.resources(PodSet.class).inAnyNamespace().runnableInformer(resyncMs)
            : client.resources(PodSet.class).inNamespace(watchNamespace).runnableInformer(resyncMs);
        podInformer = watchNamespace == null
            ? client.pods().inAnyNamespace().withLabels(managed).runnableInformer(resyncMs)
            : client.pods().inNamespace(watchNamespace).withLabels(managed).runnableInformer(resyncMs);

        podSetInformer.addEventHandler(new PodSetEventHandler());
        podInformer.addEventHandler(new PodEventHandler());

        podSetInformer.start();
        podInformer.start();
        log.info("Watching PodSets and managed pods in {} (resync every {} ms)", describeScope(), resyncMs);
    }

    public synchronized void stop() {
        if (podSetInformer != null) {
            podSetInformer.stop();
        }
        if (podInformer != null) {
            podInformer.stop();
        }
        log.info("PodSet informers stopped");
    }

    /**
     * @return {@code true} once both informers have completed their initial list
     */
    public synchronized boolean isSynced() {
        return podSetInformer != null && podInformer != null
            && podSetInformer.hasSynced() && podInformer.hasSynced();
    }

    public String getWatchNamespace() {
        return watchNamespace;
    }

    public String describeScope() {
        return watchNamespace == null ? "all namespaces" : "namespace " + watchNamespace;
    }

    void onPodSetEvent(PodSet podSet, String action) {
        log.debug("PodSet {}/{} was {}", podSet.getMetadata().getNamespace(), podSet.getMetadata().getName(), action);
        dispatcher.enqueue(ReconcileKey.of(podSet));
    }

    void onPodEvent(Pod pod, String action) {
        OwnerReference owner = PodTemplates.findPodSetOwner(pod);
        if (owner == null) {
            log.trace("Pod {}/{} has no PodSet controller => ignoring", pod.getMetadata().getNamespace(), pod.getMetadata().getName());
            return;
        }
        log.debug("Pod {}/{} owned by PodSet {} was {}",
            pod.getMetadata().getNamespace(), pod.getMetadata().getName(), owner.getName(), action);
        dispatcher.enqueue(new ReconcileKey(pod.getMetadata().getNamespace(), owner.getName()));
    }

    private class PodSetEventHandler implements ResourceEventHandler<PodSet> {
        @Override
        public void onAdd(PodSet podSet) {
            onPodSetEvent(podSet, "ADDED");
        }

        @Override
        public void onUpdate(PodSet oldPodSet, PodSet newPodSet) {
            onPodSetEvent(newPodSet, "MODIFIED");
        }

        @Override
        public void onDelete(PodSet podSet, boolean deletedFinalStateUnknown) {
            onPodSetEvent(podSet, "DELETED");
        }
    }

    private class PodEventHandler implements ResourceEventHandler<Pod> {
        @Override
        public void onAdd(Pod pod) {
            onPodEvent(pod, "ADDED");
        }

        @Override
        public void onUpdate(Pod oldPod, Pod newPod) {
            onPodEvent(newPod, "MODIFIED");
        }

        @Override
        public void onDelete(Pod pod, boolean deletedFinalStateUnknown) {
            onPodEvent(pod, "DELETED");
        }
    }
}
