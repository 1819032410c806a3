package com.platform.podset.store;

import com.platform.podset.crd.PodSet;
import io.fabric8.kubernetes.api.model.Pod;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The subset of the cluster API the operator reads and writes.
 *
 * Every method is a blocking round trip. Implementations throw
 * {@link com.platform.podset.error.ClusterStoreException} on failure and
 * {@link com.platform.podset.error.ReconcileCancelledException} when the calling thread is interrupted.
 * None of them retry.
 */
public interface ClusterStore {

    /**
     * @return the PodSet, or empty if it does not exist
     */
    Optional<PodSet> findPodSet(String namespace, String name);

    /**
     * Pods in {@code namespace} carrying all of {@code labels}, in the order the API returned them.
     */
    List<Pod> listPods(String namespace, Map<String, String> labels);

    /**
     * Pods carrying all of {@code labels} in every namespace.
     */
    List<Pod> listPodsInAnyNamespace(Map<String, String> labels);

    /**
     * Create a pod. The name may be left to the server through {@code generateName}.
     *
     * @return the pod as stored, with its assigned name
     */
    Pod createPod(Pod pod);

    /**
     * @return {@code true} if the pod was deleted, {@code false} if it was already gone
     */
    boolean deletePod(Pod pod);

    /**
     * Write only the status of {@code podSet}. Fails with a conflict if the object's
     * resourceVersion is no longer current.
     *
     * @return the updated PodSet
     */
    PodSet updateStatus(PodSet podSet);
}
