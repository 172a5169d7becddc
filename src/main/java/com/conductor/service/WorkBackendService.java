package com.conductor.service;

import com.conductor.config.ConductorProperties;
import com.conductor.dto.ListOptions;
import com.conductor.dto.ResourceEvent;
import com.conductor.dto.StatusUpdate;
import com.conductor.watch.WorkInformer;
import com.conductor.watch.WorkObject;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * The watch backend: natively orchestrated work objects.
 *
 * Reads are served from the WorkInformer cache. Status reports are merged into
 * the cache and published on the work-status topic for the orchestrator side to
 * persist on the real object.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkBackendService implements BackendService {

    private final WorkInformer informer;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final ConductorProperties properties;

    @Override
    public ResourceEvent get(String localKey) {
        return informer.get(localKey)
                .map(this::encodeWork)
                .orElseThrow(() -> new EntityNotFoundException("Work not found: " + localKey));
    }

    @Override
    public List<ResourceEvent> list(ListOptions listOptions) {
        return informer.list().stream()
                .filter(w -> !listOptions.hasClusterName() || listOptions.getClusterName().equals(w.getNamespace()))
                .map(this::encodeWork)
                .collect(Collectors.toList());
    }

    @Override
    public void handleStatusUpdate(StatusUpdate statusUpdate) {
        String key = Backend.WATCH.localKey(statusUpdate.requireMetadata(StatusUpdate.RESOURCE_ID));
        long version = statusUpdate.requireResourceVersion();

        if (informer.get(key).isEmpty()) {
            log.warn("skipping work {} as it is not found", key);
            return;
        }
        if (!informer.updateStatus(key, version, statusUpdate.getData())) {
            log.info("ignoring stale status of work {} (version {})", key, version);
            return;
        }

        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("key", key);
        patch.put("resourceVersion", version);
        patch.put("status", statusUpdate.getData());

        String topic = properties.getTopics().getWorkStatus();
        try {
            kafkaTemplate.send(topic, key, objectMapper.writeValueAsString(patch));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("work status is not serializable: " + e.getMessage(), e);
        }
        log.info("work {} status update was sent to {}", key, topic);
    }

    ResourceEvent encodeWork(WorkObject work) {
        return ResourceEvent.builder()
                .id(UUID.randomUUID().toString())
                .source(ResourceEvent.SOURCE)
                .type(ResourceEvent.specType("create_request"))
                .resourceId(Backend.WATCH.resourceId(work.key()))
                .resourceVersion(work.getResourceVersion())
                .clusterName(work.getNamespace())
                .originalSource(Backend.WATCH.namespace())
                .deletionTimestamp(work.getDeletionTimestamp())
                .data(work.getSpec())
                .build();
    }
}
