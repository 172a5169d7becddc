package com.conductor.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A status report from an agent.
 *
 * Example JSON:
 * {
 *   "source": "cluster1-work-agent",
 *   "type": "io.open-cluster-management.works.v1alpha1.manifestbundles.status.update_request",
 *   "metadata": {
 *     "originalsource": "maestro",
 *     "resourceid": "maestro::3a1e...",
 *     "resourceversion": "2",
 *     "clustername": "cluster1"
 *   },
 *   "data": { "conditions": [ {"type": "Applied", "status": "True"} ] }
 * }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class StatusUpdate {

    public static final String ORIGINAL_SOURCE = "originalsource";
    public static final String RESOURCE_ID = "resourceid";
    public static final String RESOURCE_VERSION = "resourceversion";
    public static final String CLUSTER_NAME = "clustername";

    public static final String CONDITION_DELETED = "Deleted";

    private String source;
    private String type;
    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();
    private Map<String, Object> data;

    @JsonIgnore
    public String getOriginalSource() {
        return metadata == null ? null : metadata.get(ORIGINAL_SOURCE);
    }

    public String requireMetadata(String key) {
        String value = metadata == null ? null : metadata.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status update is missing the " + key + " metadata");
        }
        return value;
    }

    public long requireResourceVersion() {
        String raw = requireMetadata(RESOURCE_VERSION);
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid resourceversion " + raw, e);
        }
    }

    /**
     * True when data.conditions holds a condition of the given type whose status is "True".
     */
    public boolean isConditionTrue(String conditionType) {
        Object conditions = data == null ? null : data.get("conditions");
        if (!(conditions instanceof List)) {
            return false;
        }
        for (Object c : (List<?>) conditions) {
            if (!(c instanceof Map)) {
                continue;
            }
            Map<?, ?> condition = (Map<?, ?>) c;
            if (conditionType.equals(condition.get("type"))
                    && "True".equalsIgnoreCase(String.valueOf(condition.get("status")))) {
                return true;
            }
        }
        return false;
    }
}
