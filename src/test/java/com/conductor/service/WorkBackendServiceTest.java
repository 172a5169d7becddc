package com.conductor.service;

import com.conductor.config.ConductorProperties;
import com.conductor.dto.ListOptions;
import com.conductor.dto.ResourceEvent;
import com.conductor.dto.StatusUpdate;
import com.conductor.watch.WatchNotification;
import com.conductor.watch.WatchOp;
import com.conductor.watch.WorkInformer;
import com.conductor.watch.WorkObject;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Runs against a real WorkInformer cache; only the status topic is mocked.
 */
@ExtendWith(MockitoExtension.class)
class WorkBackendServiceTest {

    @Mock private KafkaTemplate<String, String> kafkaTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ConductorProperties properties;
    private WorkInformer informer;
    private WorkBackendService service;

    @BeforeEach
    void setUp() {
        properties = new ConductorProperties();
        informer = new WorkInformer(properties);
        service = new WorkBackendService(informer, kafkaTemplate, objectMapper, properties);

        informer.apply(new WatchNotification(WatchOp.ADDED, work("cluster1", "nginx", 5)));
        informer.apply(new WatchNotification(WatchOp.ADDED, work("cluster2", "redis", 3)));
    }

    private static WorkObject work(String namespace, String name, long version) {
        return WorkObject.builder()
                .namespace(namespace)
                .name(name)
                .resourceVersion(version)
                .spec(Map.of("workload", Map.of("manifests", List.of())))
                .build();
    }

    private static StatusUpdate status(String resourceId, String version) {
        return StatusUpdate.builder()
                .metadata(Map.of(
                        StatusUpdate.ORIGINAL_SOURCE, "kube",
                        StatusUpdate.RESOURCE_ID, resourceId,
                        StatusUpdate.RESOURCE_VERSION, version,
                        StatusUpdate.CLUSTER_NAME, "cluster1"))
                .data(Map.of("conditions", List.of(Map.of("type", "Applied", "status", "True"))))
                .build();
    }

    @Test
    @DisplayName("get() encodes a cached work with a kube:: id")
    void get_shouldEncodeWork() {
        ResourceEvent event = service.get("cluster1/nginx");

        assertEquals("kube::cluster1/nginx", event.getResourceId());
        assertEquals("kube", event.getOriginalSource());
        assertEquals("cluster1", event.getClusterName());
        assertEquals(5, event.getResourceVersion());
    }

    @Test
    @DisplayName("get() of an uncached work is not found")
    void get_missing_shouldThrow() {
        assertThrows(EntityNotFoundException.class, () -> service.get("cluster1/absent"));
    }

    @Test
    @DisplayName("list() filters on the work namespace")
    void list_shouldFilterByCluster() {
        assertEquals(2, service.list(new ListOptions()).size());

        List<ResourceEvent> scoped = service.list(ListOptions.builder().clusterName("cluster2").build());
        assertEquals(1, scoped.size());
        assertEquals("kube::cluster2/redis", scoped.get(0).getResourceId());
    }

    @Test
    @DisplayName("Current status is cached and published as a patch")
    void statusUpdate_shouldPublishPatch() throws Exception {
        service.handleStatusUpdate(status("kube::cluster1/nginx", "5"));

        assertNotNull(informer.get("cluster1/nginx").orElseThrow().getStatus());
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(properties.getTopics().getWorkStatus()), eq("cluster1/nginx"), json.capture());

        JsonNode patch = objectMapper.readTree(json.getValue());
        assertEquals("cluster1/nginx", patch.get("key").asText());
        assertEquals(5, patch.get("resourceVersion").asLong());
        assertEquals("Applied", patch.get("status").get("conditions").get(0).get("type").asText());
    }

    @Test
    @DisplayName("Status for an older version is dropped")
    void statusUpdate_stale_shouldBeIgnored() {
        service.handleStatusUpdate(status("kube::cluster1/nginx", "4"));

        assertNull(informer.get("cluster1/nginx").orElseThrow().getStatus());
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("Status for an unknown work is skipped")
    void statusUpdate_unknown_shouldBeSkipped() {
        service.handleStatusUpdate(status("kube::cluster1/absent", "1"));

        verifyNoInteractions(kafkaTemplate);
    }
}
