package com.platform.podset.api;

import com.platform.podset.crd.PodSet;
import com.platform.podset.error.ErrorCode;
import com.platform.podset.error.ResourceNotFoundException;
import com.platform.podset.store.ClusterStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of a PodSet as stored in the cluster.
 */
@RestController
@RequestMapping("/api/podsets")
public class PodSetController {

    private final ClusterStore store;

    public PodSetController(ClusterStore store) {
        this.store = store;
    }

    @GetMapping("/{namespace}/{name}")
    public PodSetView get(@PathVariable String namespace, @PathVariable String name) {
        PodSet podSet = store.findPodSet(namespace, name)
            .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.PODSET_NOT_FOUND, "PodSet", namespace + "/" + name));
        List<String> podNames = podSet.getStatus() != null && podSet.getStatus().getPodNames() != null
            ? List.copyOf(podSet.getStatus().getPodNames())
            : List.of();
        return new PodSetView(namespace, name, podSet.desiredReplicas(), podNames);
    }

    public record PodSetView(String namespace, String name, int replicas, List<String> podNames) {}
}
