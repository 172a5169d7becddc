package com.conductor.dto;

import lombok.*;

/**
 * Scope of a List call.
 *
 * - source:      namespace tag ("kube", "maestro") or null/blank for every backend
 * - clusterName: only resources addressed to this cluster; null/blank for all
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ListOptions {

    private String source;
    private String clusterName;

    public boolean hasSource() {
        return source != null && !source.isBlank();
    }

    public boolean hasClusterName() {
        return clusterName != null && !clusterName.isBlank();
    }
}
