package com.conductor.service;

import com.conductor.dto.ListOptions;
import com.conductor.dto.ResourceEvent;
import com.conductor.dto.StatusUpdate;
import com.conductor.lock.LockFactory;
import com.conductor.lock.LockLease;
import com.conductor.lock.LockNamespace;
import com.conductor.model.Event;
import com.conductor.model.EventType;
import com.conductor.model.Resource;
import com.conductor.model.StatusEvent;
import com.conductor.model.StatusEventType;
import com.conductor.repository.ResourceRepository;
import com.conductor.repository.StatusEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * The changefeed backend: resources stored in the database.
 *
 * Every spec mutation (create / update / markDeleted) writes an Event with
 * source "Resources" in the same transaction, which is what drives the
 * ControllerManager. Status reports from agents come back through
 * handleStatusUpdate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DbResourceService implements BackendService {

    public static final String EVENT_SOURCE = "Resources";

    private final ResourceRepository resourceRepository;
    private final StatusEventRepository statusEventRepository;
    private final EventService eventService;
    private final ConsumerService consumerService;
    private final LockFactory lockFactory;
    private final ObjectMapper objectMapper;

    @Transactional
    public Resource create(String consumerName, Map<String, Object> spec) {
        consumerService.requireRegistered(consumerName);
        Resource resource = Resource.builder()
                .id(UUID.randomUUID().toString())
                .consumerName(consumerName)
                .payload(toJson(spec))
                .build();
        Resource saved = resourceRepository.save(resource);
        recordEvent(saved.getId(), EventType.CREATE);
        log.info("Created resource {} for consumer {}", saved.getId(), consumerName);
        return saved;
    }

    @Transactional
    public Resource update(String id, Map<String, Object> spec) {
        Resource resource = find(id);
        if (resource.getDeletedAt() != null) {
            throw new IllegalArgumentException("Resource " + id + " is being deleted");
        }
        resource.setPayload(toJson(spec));
        resource.setVersion(resource.getVersion() + 1);
        Resource saved = resourceRepository.save(resource);
        recordEvent(saved.getId(), EventType.UPDATE);
        log.info("Updated resource {} to version {}", id, saved.getVersion());
        return saved;
    }

    /**
     * Requests deletion. The row stays until the agent confirms removal through a status update.
     */
    @Transactional
    public Resource markDeleted(String id) {
        Resource resource = find(id);
        if (resource.getDeletedAt() != null) {
            return resource;
        }
        resource.setDeletedAt(Instant.now());
        Resource saved = resourceRepository.save(resource);
        recordEvent(saved.getId(), EventType.DELETE);
        log.info("Marked resource {} for deletion", id);
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public ResourceEvent get(String localKey) {
        return encodeResourceSpec(find(localKey));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ResourceEvent> list(ListOptions listOptions) {
        List<Resource> resources = listOptions.hasClusterName()
                ? resourceRepository.findByConsumerName(listOptions.getClusterName())
                : resourceRepository.findAll();
        return resources.stream()
                .map(this::encodeResourceSpec)
                .collect(Collectors.toList());
    }

    /**
     * Applies an agent's status report.
     *
     *   1. resource gone             → ignore, it was already processed
     *   2. cluster name differs      → reject
     *   3. Deleted condition is True → record STATUS_DELETE and remove the row
     *   4. otherwise                 → store the status if it changed, record STATUS_UPDATE
     *
     * Reports for the same resource are serialized with a RESOURCES lease, held
     * until the surrounding transaction has committed or rolled back.
     */
    @Override
    @Transactional
    public void handleStatusUpdate(StatusUpdate statusUpdate) {
        String resourceId = Backend.CHANGEFEED.localKey(statusUpdate.requireMetadata(StatusUpdate.RESOURCE_ID));
        String clusterName = statusUpdate.requireMetadata(StatusUpdate.CLUSTER_NAME);
        long version = statusUpdate.requireResourceVersion();

        LockLease lease = lockFactory.newNonBlockingLock(resourceId, LockNamespace.RESOURCES);
        if (!lease.isAcquired()) {
            lockFactory.unlock(lease);
            throw new ResourceBusyException(
                    "status of resource " + resourceId + " is being updated by another worker");
        }
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            try {
                applyStatus(resourceId, clusterName, version, statusUpdate);
            } finally {
                lockFactory.unlock(lease);
            }
            return;
        }
        // the next report for this resource must see the committed row
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                lockFactory.unlock(lease);
            }
        });
        applyStatus(resourceId, clusterName, version, statusUpdate);
    }

    private void applyStatus(String resourceId, String clusterName, long version, StatusUpdate statusUpdate) {
        log.info("handle resource status update {} by the current instance", resourceId);

        Resource found = resourceRepository.findById(resourceId).orElse(null);
        if (found == null) {
            log.warn("skipping resource {} as it is not found", resourceId);
            return;
        }

        if (!found.getConsumerName().equals(clusterName)) {
            throw new IllegalArgumentException(String.format(
                    "unmatched consumer name %s for resource %s", clusterName, resourceId));
        }

        String status = toJson(statusUpdate.getData());

        if (statusUpdate.isConditionTrue(StatusUpdate.CONDITION_DELETED)) {
            statusEventRepository.save(StatusEvent.builder()
                    .resourceId(resourceId)
                    .statusEventType(StatusEventType.STATUS_DELETE)
                    .payload(found.getPayload())
                    .status(status)
                    .build());
            resourceRepository.delete(found);
            log.info("resource {} status delete event was sent", resourceId);
            return;
        }

        if (version < found.getVersion()) {
            log.info("ignoring stale status of resource {} (version {} < {})",
                    resourceId, version, found.getVersion());
            return;
        }

        if (Objects.equals(found.getStatus(), status)) {
            log.debug("status of resource {} unchanged", resourceId);
            return;
        }

        found.setStatus(status);
        resourceRepository.save(found);
        statusEventRepository.save(StatusEvent.builder()
                .resourceId(resourceId)
                .statusEventType(StatusEventType.STATUS_UPDATE)
                .build());
        log.info("resource {} status update event was sent", resourceId);
    }

    private Resource find(String id) {
        return resourceRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException("Resource not found: " + id));
    }

    private void recordEvent(String resourceId, EventType eventType) {
        eventService.create(Event.builder()
                .source(EVENT_SOURCE)
                .sourceId(resourceId)
                .eventType(eventType)
                .build());
    }

    ResourceEvent encodeResourceSpec(Resource resource) {
        return ResourceEvent.builder()
                .id(UUID.randomUUID().toString())
                .source(ResourceEvent.SOURCE)
                .type(ResourceEvent.specType("create_request"))
                .resourceId(Backend.CHANGEFEED.resourceId(resource.getId()))
                .resourceVersion(resource.getVersion())
                .clusterName(resource.getConsumerName())
                .originalSource(Backend.CHANGEFEED.namespace())
                .deletionTimestamp(resource.getDeletedAt())
                .data(fromJson(resource.getPayload()))
                .build();
    }

    private String toJson(Map<String, Object> value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("resource document is not serializable: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("stored resource payload is not valid JSON: " + e.getMessage(), e);
        }
    }
}
