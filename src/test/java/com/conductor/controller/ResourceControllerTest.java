package com.conductor.controller;

import com.conductor.dto.ListOptions;
import com.conductor.dto.ResourceEvent;
import com.conductor.dto.StatusUpdate;
import com.conductor.model.Resource;
import com.conductor.service.DbResourceService;
import com.conductor.service.ResourceBusyException;
import com.conductor.service.ResourceService;
import com.conductor.service.UnknownSourceException;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Standalone MockMvc over the controller and its exception advice; services are mocked.
 */
@ExtendWith(MockitoExtension.class)
class ResourceControllerTest {

    @Mock private ResourceService resourceService;
    @Mock private DbResourceService dbResourceService;

    @InjectMocks
    private ResourceController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET by id returns the routed resource")
    void get_shouldReturnResource() throws Exception {
        when(resourceService.get("kube::cluster1/nginx"))
                .thenReturn(ResourceEvent.builder().resourceId("kube::cluster1/nginx").build());

        mockMvc.perform(get("/api/resources/by-id").param("resourceId", "kube::cluster1/nginx"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resourceId").value("kube::cluster1/nginx"));
    }

    @Test
    @DisplayName("Unknown ids map to 404")
    void get_unknown_shouldBeNotFound() throws Exception {
        when(resourceService.get("other::x")).thenThrow(new EntityNotFoundException("Resource not found: other::x"));

        mockMvc.perform(get("/api/resources/by-id").param("resourceId", "other::x"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Resource not found: other::x"));
    }

    @Test
    @DisplayName("List passes source and cluster name through")
    void list_shouldPassOptions() throws Exception {
        when(resourceService.list(any(ListOptions.class))).thenReturn(List.of());

        mockMvc.perform(get("/api/resources").param("source", "maestro").param("clusterName", "cluster1"))
                .andExpect(status().isOk());

        ArgumentCaptor<ListOptions> opts = ArgumentCaptor.forClass(ListOptions.class);
        verify(resourceService).list(opts.capture());
        assertEquals("maestro", opts.getValue().getSource());
        assertEquals("cluster1", opts.getValue().getClusterName());
    }

    @Test
    @DisplayName("List with an unknown source maps to 400")
    void list_unknownSource_shouldBeBadRequest() throws Exception {
        when(resourceService.list(any(ListOptions.class))).thenThrow(new UnknownSourceException("other"));

        mockMvc.perform(get("/api/resources").param("source", "other"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("unrecognized resource source: other"));
    }

    @Test
    @DisplayName("Status reports are accepted and handed to the router")
    void status_shouldBeAccepted() throws Exception {
        mockMvc.perform(post("/api/resources/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"metadata\":{\"originalsource\":\"maestro\",\"resourceid\":\"maestro::3a1e\"}}"))
                .andExpect(status().isAccepted());

        ArgumentCaptor<StatusUpdate> update = ArgumentCaptor.forClass(StatusUpdate.class);
        verify(resourceService).handleStatusUpdate(update.capture());
        assertEquals("maestro", update.getValue().getOriginalSource());
    }

    @Test
    @DisplayName("A busy resource maps to 409")
    void status_busy_shouldConflict() throws Exception {
        doThrow(new ResourceBusyException("busy")).when(resourceService).handleStatusUpdate(any(StatusUpdate.class));

        mockMvc.perform(post("/api/resources/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Create stores the resource and returns its routed view")
    void create_shouldReturnCreated() throws Exception {
        when(dbResourceService.create(eq("cluster1"), anyMap()))
                .thenReturn(Resource.builder().id("3a1e").consumerName("cluster1").payload("{}").build());
        when(resourceService.get("maestro::3a1e"))
                .thenReturn(ResourceEvent.builder().resourceId("maestro::3a1e").build());

        mockMvc.perform(post("/api/resources")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"consumerName\":\"cluster1\",\"spec\":{\"manifests\":[]}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.resourceId").value("maestro::3a1e"));
    }

    @Test
    @DisplayName("Create without a consumer name is rejected")
    void create_invalid_shouldBeBadRequest() throws Exception {
        mockMvc.perform(post("/api/resources")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"spec\":{}}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(dbResourceService);
    }

    @Test
    @DisplayName("Delete marks the resource and answers 202")
    void delete_shouldBeAccepted() throws Exception {
        mockMvc.perform(delete("/api/resources/3a1e"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.resourceId").value("maestro::3a1e"));

        verify(dbResourceService).markDeleted("3a1e");
    }
}
