package com.platform.podset.reconcile;

import io.fabric8.kubernetes.api.model.Pod;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Label contract between a PodSet and its pods, and the notion of a live pod.
 * Changing these labels orphans every pod already running.
 */
public final class PodSelection {

    public static final String APP_LABEL = "app";
    public static final String VERSION_LABEL = "version";
    public static final String VERSION = "v0.1";

    private static final Set<String> LIVE_PHASES = Set.of("Pending", "Running");

    private PodSelection() {
    }

    public static Map<String, String> labelsFor(String podSetName) {
        return Map.of(APP_LABEL, podSetName, VERSION_LABEL, VERSION);
    }

    /**
     * Selector matching every pod managed by any PodSet.
     */
    public static Map<String, String> managedPodLabels() {
        return Map.of(VERSION_LABEL, VERSION);
    }

    /**
     * A pod is live when it is not being deleted and is Pending or Running.
     */
    public static boolean isLive(Pod pod) {
        if (pod.getMetadata() != null && pod.getMetadata().getDeletionTimestamp() != null) {
            return false;
        }
        return pod.getStatus() != null && LIVE_PHASES.contains(pod.getStatus().getPhase());
    }

    /**
     * Live pods, keeping the order of {@code pods}.
     */
    public static List<Pod> livePods(List<Pod> pods) {
        return pods.stream()
            .filter(PodSelection::isLive)
            .toList();
    }

    public static List<String> namesOf(List<Pod> pods) {
        return pods.stream()
            .map(pod -> pod.getMetadata().getName())
            .toList();
    }
}
