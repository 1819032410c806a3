package com.platform.podset.crd;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Desired-state resource: the number of busybox pods a user wants running.
 * Pods are correlated to a PodSet only through the {@code app}/{@code version} labels.
 */
@Group(PodSet.GROUP)
@Version(PodSet.VERSION)
@Kind(PodSet.KIND)
@Plural("podsets")
public class PodSet extends CustomResource<PodSetSpec, PodSetStatus> implements Namespaced {

    public static final String GROUP = "app.github.com";
    public static final String VERSION = "v1alpha1";
    public static final String KIND = "PodSet";

    /**
     * Desired replica count, zero when the spec is missing or negative.
     */
    public int desiredReplicas() {
        return getSpec() != null ? Math.max(0, getSpec().getReplicas()) : 0;
    }
}
