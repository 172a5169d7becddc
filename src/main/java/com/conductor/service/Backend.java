package com.conductor.service;

import java.util.Optional;

/**
 * The two systems of record a resource id can belong to.
 */
public enum Backend {
    /** natively orchestrated objects delivered by the watch source */
    WATCH("kube"),
    /** changefeed-backed records in the resources table */
    CHANGEFEED("maestro");

    private final String namespace;

    Backend(String namespace) {
        this.namespace = namespace;
    }

    public String namespace() {
        return namespace;
    }

    public String resourceId(String localKey) {
        return ResourceIds.generate(namespace, localKey);
    }

    public String localKey(String resourceId) {
        return ResourceIds.localKey(resourceId, namespace);
    }

    public static Optional<Backend> classify(String resourceId) {
        for (Backend backend : values()) {
            if (ResourceIds.belongsTo(resourceId, backend.namespace)) {
                return Optional.of(backend);
            }
        }
        return Optional.empty();
    }
}
