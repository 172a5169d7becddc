package com.conductor.service;

/**
 * Helpers for namespaced resource identifiers of the form "namespace::local-key".
 *
 *   "kube::ns/name"   → namespace "kube",    local key "ns/name"
 *   "maestro::3a1e"   → namespace "maestro", local key "3a1e"
 *
 * A namespace matches only as an exact prefix followed by the separator, or as the
 * whole id. "kubernetes::a" and "prefixkube::a" do not belong to "kube".
 */
public final class ResourceIds {

    public static final String SEPARATOR = "::";

    private ResourceIds() {
    }

    public static String generate(String namespace, String localKey) {
        return namespace + SEPARATOR + localKey;
    }

    public static String generate(String namespace, String objectNamespace, String objectName) {
        return generate(namespace, objectNamespace + "/" + objectName);
    }

    public static boolean belongsTo(String resourceId, String namespace) {
        if (resourceId == null || resourceId.isEmpty()) {
            return false;
        }
        return resourceId.equals(namespace) || resourceId.startsWith(namespace + SEPARATOR);
    }

    public static boolean isKubeResource(String resourceId) {
        return belongsTo(resourceId, Backend.WATCH.namespace());
    }

    public static boolean isDbResource(String resourceId) {
        return belongsTo(resourceId, Backend.CHANGEFEED.namespace());
    }

    /**
     * Strips "namespace::" when present; ids without it are already local.
     */
    public static String localKey(String resourceId, String namespace) {
        String prefix = namespace + SEPARATOR;
        return resourceId.startsWith(prefix) ? resourceId.substring(prefix.length()) : resourceId;
    }
}
