package com.conductor.service;

import com.conductor.config.ConductorProperties;
import com.conductor.dto.ResourceEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Broadcasts resource specs to agents on the resource-events topic.
 *
 * FLOW:
 *   changefeed Event / watch notification → RouterService → onCreate/onUpdate/onDelete
 *                                                                ↓
 *                                  re-read the resource through the router
 *                                                                ↓
 *                              publish the ResourceEvent keyed by resource id
 *
 * A create or update for a resource that is already gone is skipped. A delete
 * for one is published as a bare delete request carrying only the id.
 * Publishing the latest state makes replays harmless.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResourceEventPublisher implements EventHandler {

    private final ResourceService resourceService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final ConductorProperties properties;

    @PostConstruct
    void register() {
        resourceService.registerHandler(this);
    }

    @Override
    public void onCreate(String dataType, String resourceId) throws Exception {
        publishCurrent(resourceId, dataType + ".spec.create_request");
    }

    @Override
    public void onUpdate(String dataType, String resourceId) throws Exception {
        publishCurrent(resourceId, dataType + ".spec.update_request");
    }

    @Override
    public void onDelete(String dataType, String resourceId) throws Exception {
        ResourceEvent event;
        try {
            event = resourceService.get(resourceId);
        } catch (EntityNotFoundException e) {
            event = ResourceEvent.builder()
                    .id(UUID.randomUUID().toString())
                    .source(ResourceEvent.SOURCE)
                    .resourceId(resourceId)
                    .build();
        }
        event.setType(dataType + ".spec.delete_request");
        publish(event);
    }

    private void publishCurrent(String resourceId, String type) throws Exception {
        ResourceEvent event;
        try {
            event = resourceService.get(resourceId);
        } catch (EntityNotFoundException e) {
            // removed after its agent confirmed deletion; nothing left to send
            log.info("Skipping {} for {}, the resource no longer exists", type, resourceId);
            return;
        }
        event.setType(type);
        publish(event);
    }

    private void publish(ResourceEvent event) throws Exception {
        String topic = properties.getTopics().getResourceEvents();
        // block so a broker failure surfaces here and the changefeed path retries
        kafkaTemplate.send(topic, event.getResourceId(), objectMapper.writeValueAsString(event)).get();
        log.info("Published {} for {} to {}", event.getType(), event.getResourceId(), topic);
    }
}
