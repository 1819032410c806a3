package com.platform.podset.store;

import com.platform.podset.crd.PodSet;
import com.platform.podset.error.ClusterStoreException;
import com.platform.podset.error.ReconcileCancelledException;
import com.platform.podset.observability.MetricsRegistry;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link ClusterStore} backed by the fabric8 Kubernetes client.
 */
@Slf4j
@Component
public class KubernetesClusterStore implements ClusterStore {

    private final KubernetesClient client;
    private final MetricsRegistry metricsRegistry;

    public KubernetesClusterStore(KubernetesClient client, MetricsRegistry metricsRegistry) {
        this.client = client;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public Optional<PodSet> findPodSet(String namespace, String name) {
        return call("get", namespace + "/" + name, () -> Optional.ofNullable(
            client.resources(PodSet.class).inNamespace(namespace).withName(name).get()));
    }

    @Override
    public List<Pod> listPods(String namespace, Map<String, String> labels) {
        return call("list", "pods in " + namespace, () ->
            client.pods().inNamespace(namespace).withLabels(labels).list().getItems());
    }

    @Override
    public List<Pod> listPodsInAnyNamespace(Map<String, String> labels) {
        return call("list", "pods in all namespaces", () ->
            client.pods().inAnyNamespace().withLabels(labels).list().getItems());
    }

    @Override
    public Pod createPod(Pod pod) {
        String namespace = pod.getMetadata().getNamespace();
        return call("create", "pod in " + namespace, () ->
            client.pods().inNamespace(namespace).resource(pod).create());
    }

    @Override
    public boolean deletePod(Pod pod) {
        String namespace = pod.getMetadata().getNamespace();
        String name = pod.getMetadata().getName();
        return call("delete", namespace + "/" + name, () -> {
            List<StatusDetails> details = client.pods().inNamespace(namespace).withName(name).delete();
            return !details.isEmpty();
        });
    }

    @Override
    public PodSet updateStatus(PodSet podSet) {
        String namespace = podSet.getMetadata().getNamespace();
        String name = podSet.getMetadata().getName();
        return call("update-status", namespace + "/" + name, () ->
            client.resources(PodSet.class).inNamespace(namespace).resource(podSet).updateStatus());
    }

    private <T> T call(String operation, String target, Supplier<T> request) {
        if (Thread.currentThread().isInterrupted()) {
            throw new ReconcileCancelledException(operation + " " + target);
        }

        long start = System.currentTimeMillis();
        try {
            T result = request.get();
            metricsRegistry.recordLatency("kubernetes", operation, System.currentTimeMillis() - start);
            return result;
        } catch (KubernetesClientException e) {
            if (isInterruption(e)) {
                throw new ReconcileCancelledException(operation + " " + target, e);
            }
            metricsRegistry.recordClusterCallFailure(operation, e.getCode());
            log.debug("{} {} failed with HTTP {}: {}", operation, target, e.getCode(), e.getMessage());
            throw ClusterStoreException.from(operation, target, e);
        }
    }

    private static boolean isInterruption(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException
                    || (t instanceof InterruptedIOException && !(t instanceof SocketTimeoutException))) {
                return true;
            }
        }
        return Thread.currentThread().isInterrupted();
    }
}
