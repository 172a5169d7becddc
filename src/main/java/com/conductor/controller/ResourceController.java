package com.conductor.controller;

import com.conductor.dto.ListOptions;
import com.conductor.dto.ResourceEvent;
import com.conductor.dto.ResourceRequest;
import com.conductor.dto.StatusUpdate;
import com.conductor.model.Resource;
import com.conductor.service.Backend;
import com.conductor.service.DbResourceService;
import com.conductor.service.ResourceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST surface over the router plus spec mutations for changefeed-backed resources.
 *
 * GET    /api/resources/by-id?resourceId=kube::cluster1/nginx-work
 * GET    /api/resources?source=maestro&clusterName=cluster1
 * POST   /api/resources/status            (agent status report)
 * POST   /api/resources                   {"consumerName": "cluster1", "spec": {...}}
 * PUT    /api/resources/{id}
 * DELETE /api/resources/{id}
 *
 * Writes only reach the changefeed backend; watched objects are owned by the orchestrator.
 */
@RestController
@RequestMapping("/api/resources")
@RequiredArgsConstructor
public class ResourceController {

    private final ResourceService resourceService;
    private final DbResourceService dbResourceService;

    @GetMapping("/by-id")
    public ResponseEntity<ResourceEvent> get(@RequestParam String resourceId) {
        return ResponseEntity.ok(resourceService.get(resourceId));
    }

    @GetMapping
    public ResponseEntity<List<ResourceEvent>> list(
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String clusterName) {
        return ResponseEntity.ok(resourceService.list(new ListOptions(source, clusterName)));
    }

    @PostMapping("/status")
    public ResponseEntity<Void> handleStatusUpdate(@RequestBody StatusUpdate statusUpdate) {
        resourceService.handleStatusUpdate(statusUpdate);
        return ResponseEntity.accepted().build();
    }

    @PostMapping
    public ResponseEntity<ResourceEvent> create(@Valid @RequestBody ResourceRequest request) {
        Resource created = dbResourceService.create(request.getConsumerName(), request.getSpec());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(resourceService.get(Backend.CHANGEFEED.resourceId(created.getId())));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ResourceEvent> update(@PathVariable String id, @Valid @RequestBody ResourceRequest request) {
        Resource updated = dbResourceService.update(id, request.getSpec());
        return ResponseEntity.ok(resourceService.get(Backend.CHANGEFEED.resourceId(updated.getId())));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String id) {
        dbResourceService.markDeleted(id);
        return ResponseEntity.accepted()
                .body(Map.of("status", "deleting", "resourceId", Backend.CHANGEFEED.resourceId(id)));
    }
}
