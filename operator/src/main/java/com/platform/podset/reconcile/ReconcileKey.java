package com.platform.podset.reconcile;

import io.fabric8.kubernetes.api.model.HasMetadata;

import java.util.Objects;

/**
 * Identity of a PodSet, used as the work queue key.
 */
public record ReconcileKey(String namespace, String name) {

    public ReconcileKey {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
    }

    public static ReconcileKey of(HasMetadata resource) {
        return new ReconcileKey(resource.getMetadata().getNamespace(), resource.getMetadata().getName());
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
