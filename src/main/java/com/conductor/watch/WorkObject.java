package com.conductor.watch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.time.Instant;
import java.util.Map;

/**
 * A natively orchestrated work object as the watch source reports it.
 *
 * Example JSON:
 * {
 *   "namespace": "cluster1",
 *   "name": "nginx-work",
 *   "resourceVersion": 42,
 *   "spec": { "workload": { "manifests": [ ... ] } },
 *   "status": { "conditions": [ ... ] },
 *   "deletionTimestamp": null
 * }
 *
 * The namespace is the cluster the work is addressed to.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class WorkObject {

    private String namespace;
    private String name;
    private long resourceVersion;
    private Map<String, Object> spec;
    private Map<String, Object> status;
    private Instant deletionTimestamp;

    /**
     * Cache key, "namespace/name".
     */
    @JsonIgnore
    public String key() {
        return namespace + "/" + name;
    }
}
