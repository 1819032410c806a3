package com.platform.podset.crd;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Observed state of a PodSet: names of the live pods, in the order the API server listed them.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
public class PodSetStatus {

    private List<String> podNames = new ArrayList<>();

    public PodSetStatus(List<String> podNames) {
        this.podNames = new ArrayList<>(podNames);
    }

    /**
     * Field-by-field comparison. Pod names are compared as an ordered sequence,
     * and a null list is treated as empty.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PodSetStatus other)) {
            return false;
        }
        return namesOf(this).equals(namesOf(other));
    }

    @Override
    public int hashCode() {
        return Objects.hash(namesOf(this));
    }

    private static List<String> namesOf(PodSetStatus status) {
        return status.podNames != null ? status.podNames : List.of();
    }
}
