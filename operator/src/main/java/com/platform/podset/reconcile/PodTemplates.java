package com.platform.podset.reconcile;

import com.platform.podset.crd.PodSet;
import com.platform.podset.error.OwnerReferenceException;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the pods a PodSet scales up with.
 */
public final class PodTemplates {

    static final String CONTAINER_NAME = "busybox";
    static final String CONTAINER_IMAGE = "busybox";
    static final List<String> CONTAINER_COMMAND = List.of("sleep", "3600");

    private PodTemplates() {
    }

    /**
     * A new pod for {@code podSet}. The server completes the {@code <name>-pod-} prefix with a unique suffix.
     */
    public static Pod newPodFor(PodSet podSet) {
        String name = podSet.getMetadata().getName();
        return new PodBuilder()
            .withNewMetadata()
                .withGenerateName(name + "-pod-")
                .withNamespace(podSet.getMetadata().getNamespace())
                .withLabels(PodSelection.labelsFor(name))
            .endMetadata()
            .withNewSpec()
                .withContainers(new ContainerBuilder()
                    .withName(CONTAINER_NAME)
                    .withImage(CONTAINER_IMAGE)
                    .withCommand(CONTAINER_COMMAND)
                    .build())
            .endSpec()
            .build();
    }

    /**
     * Controller owner reference pointing at {@code podSet}.
     *
     * @throws OwnerReferenceException if the PodSet lacks identity fields
     */
    public static OwnerReference controllerReference(PodSet podSet) {
        String uid = podSet.getMetadata().getUid();
        if (isBlank(uid) || isBlank(podSet.getMetadata().getName())) {
            throw new OwnerReferenceException("PodSet " + podSet.getMetadata().getName() + " has no uid or name");
        }
        if (isBlank(podSet.getApiVersion()) || isBlank(podSet.getKind())) {
            throw new OwnerReferenceException("PodSet " + podSet.getMetadata().getName() + " has no apiVersion or kind");
        }
        return new OwnerReferenceBuilder()
            .withApiVersion(podSet.getApiVersion())
            .withKind(podSet.getKind())
            .withName(podSet.getMetadata().getName())
            .withUid(uid)
            .withController(true)
            .withBlockOwnerDeletion(true)
            .build();
    }

    /**
     * Make {@code podSet} the controller of {@code pod}.
     *
     * @throws OwnerReferenceException if the namespaces differ or another owner already controls the pod
     */
    public static void setControllerReference(PodSet podSet, Pod pod) {
        OwnerReference reference = controllerReference(podSet);

        if (!Objects.equals(podSet.getMetadata().getNamespace(), pod.getMetadata().getNamespace())) {
            throw new OwnerReferenceException(String.format(
                "PodSet %s/%s cannot own a pod in namespace %s",
                podSet.getMetadata().getNamespace(), reference.getName(), pod.getMetadata().getNamespace()));
        }

        List<OwnerReference> references = new ArrayList<>();
        if (pod.getMetadata().getOwnerReferences() != null) {
            for (OwnerReference existing : pod.getMetadata().getOwnerReferences()) {
                if (Objects.equals(existing.getUid(), reference.getUid())) {
                    continue;
                }
                if (Boolean.TRUE.equals(existing.getController())) {
                    throw new OwnerReferenceException(String.format(
                        "Pod is already controlled by %s %s", existing.getKind(), existing.getName()));
                }
                references.add(existing);
            }
        }
        references.add(reference);
        pod.getMetadata().setOwnerReferences(references);
    }

    /**
     * The PodSet controller reference of {@code pod}, or null if it has none.
     */
    public static OwnerReference findPodSetOwner(Pod pod) {
        if (pod.getMetadata() == null || pod.getMetadata().getOwnerReferences() == null) {
            return null;
        }
        return pod.getMetadata().getOwnerReferences().stream()
            .filter(ref -> PodSet.KIND.equals(ref.getKind()))
            .filter(ref -> ref.getApiVersion() != null && ref.getApiVersion().startsWith(PodSet.GROUP + "/"))
            .filter(ref -> Boolean.TRUE.equals(ref.getController()))
            .findFirst()
            .orElse(null);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
