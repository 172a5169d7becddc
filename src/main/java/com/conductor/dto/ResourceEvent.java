package com.conductor.dto;

import lombok.*;

import java.time.Instant;
import java.util.Map;

/**
 * The spec of one resource as handed to the transport layer and broadcast to agents.
 *
 * Example JSON:
 * {
 *   "id": "7d0c...",
 *   "source": "conductor",
 *   "type": "io.open-cluster-management.works.v1alpha1.manifestbundles.spec.create_request",
 *   "resourceId": "maestro::3a1e...",
 *   "resourceVersion": 2,
 *   "clusterName": "cluster1",
 *   "originalSource": "maestro",
 *   "deletionTimestamp": null,
 *   "data": { "manifests": [ ... ] }
 * }
 *
 * originalSource is echoed back by agents on status updates, which is how the
 * router finds the owning backend again.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ResourceEvent {

    public static final String SOURCE = "conductor";
    public static final String MANIFEST_BUNDLE_TYPE = "io.open-cluster-management.works.v1alpha1.manifestbundles";

    private String id;
    private String source;
    private String type;
    private String resourceId;
    private long resourceVersion;
    private String clusterName;
    private String originalSource;
    private Instant deletionTimestamp;
    private Map<String, Object> data;

    public static String specType(String action) {
        return MANIFEST_BUNDLE_TYPE + ".spec." + action;
    }
}
