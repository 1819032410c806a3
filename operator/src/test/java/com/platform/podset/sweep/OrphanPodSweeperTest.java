package com.platform.podset.sweep;

import com.platform.podset.crd.PodSet;
import com.platform.podset.error.ClusterStoreException;
import com.platform.podset.observability.MetricsRegistry;
import com.platform.podset.observability.StructuredLogger;
import com.platform.podset.reconcile.PodSelection;
import com.platform.podset.reconcile.PodTemplates;
import com.platform.podset.store.InMemoryClusterStore;
import io.fabric8.kubernetes.api.model.Pod;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OrphanPodSweeperTest {

    private InMemoryClusterStore store;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        store = new InMemoryClusterStore();
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    void deletesPodsWhoseOwnerIsGone() {
        PodSet web = store.putPodSet("apps", "web", 1);
        ownedPod(web, "web-pod-1");
        store.removePodSet("apps", "web");

        OrphanPodSweeper.SweepResult result = sweeper(true, "").sweep();

        assertThat(result.deleted()).isEqualTo(1);
        assertThat(store.allPods()).isEmpty();
        assertThat(meterRegistry.get("podset.orphans.deleted").counter().count()).isEqualTo(1.0);
    }

    @Test
    void deletesPodsOwnedByAnEarlierIncarnation() {
        PodSet old = store.putPodSet("apps", "web", 1);
        ownedPod(old, "web-pod-1");
        store.removePodSet("apps", "web");
        PodSet current = store.putPodSet("apps", "web", 1);
        ownedPod(current, "web-pod-2");

        OrphanPodSweeper.SweepResult result = sweeper(true, "").sweep();

        assertThat(result.deleted()).isEqualTo(1);
        assertThat(PodSelection.namesOf(store.allPods())).containsExactly("web-pod-2");
    }

    @Test
    void keepsPodsWithLiveOwnerOrNoPodSetOwner() {
        PodSet web = store.putPodSet("apps", "web", 1);
        ownedPod(web, "web-pod-1");
        store.addPod("apps", "unowned", PodSelection.labelsFor("web"), "Running");

        OrphanPodSweeper.SweepResult result = sweeper(true, "").sweep();

        assertThat(result.scanned()).isEqualTo(2);
        assertThat(result.deleted()).isZero();
        assertThat(store.allPods()).hasSize(2);
    }

    @Test
    void onlySweepsWatchedNamespace() {
        PodSet a = store.putPodSet("a", "web", 1);
        PodSet b = store.putPodSet("b", "web", 1);
        ownedPod(a, "web-pod-a");
        ownedPod(b, "web-pod-b");
        store.removePodSet("a", "web");
        store.removePodSet("b", "web");

        OrphanPodSweeper.SweepResult result = sweeper(true, "a").sweep();

        assertThat(result.deleted()).isEqualTo(1);
        assertThat(PodSelection.namesOf(store.allPods())).containsExactly("web-pod-b");
    }

    @Test
    void failureOnOnePodDoesNotStopTheSweep() {
        PodSet web = store.putPodSet("apps", "web", 2);
        ownedPod(web, "web-pod-1");
        ownedPod(web, "web-pod-2");
        store.removePodSet("apps", "web");
        store.failDeletionOf("web-pod-1", ClusterStoreException.unavailable("delete", "apps/web-pod-1"));

        OrphanPodSweeper.SweepResult result = sweeper(true, "").sweep();

        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.deleted()).isEqualTo(1);
        assertThat(PodSelection.namesOf(store.allPods())).containsExactly("web-pod-1");
    }

    @Test
    void disabledSweeperDoesNothing() {
        PodSet web = store.putPodSet("apps", "web", 1);
        ownedPod(web, "web-pod-1");
        store.removePodSet("apps", "web");

        sweeper(false, "").periodicSweep();

        assertThat(store.allPods()).hasSize(1);
    }

    private OrphanPodSweeper sweeper(boolean enabled, String watchNamespace) {
        return new OrphanPodSweeper(store, new MetricsRegistry(meterRegistry), new StructuredLogger(), enabled, watchNamespace);
    }

    private void ownedPod(PodSet owner, String name) {
        Pod pod = PodTemplates.newPodFor(owner);
        PodTemplates.setControllerReference(owner, pod);
        pod.getMetadata().setGenerateName(null);
        pod.getMetadata().setName(name);
        store.putPod(pod);
    }
}
