package com.conductor.service;

import com.conductor.dto.ListOptions;
import com.conductor.dto.ResourceEvent;
import com.conductor.dto.StatusUpdate;
import com.conductor.engine.ControllerConfig;
import com.conductor.engine.ControllerManager;
import com.conductor.model.EventType;
import com.conductor.watch.WatchEventHandler;
import com.conductor.watch.WatchSource;
import com.conductor.watch.WorkObject;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Routes requests to whichever backend owns a resource id.
 *
 *   "kube::ns/name"  → WorkBackendService (watch)
 *   "maestro::uuid"  → DbResourceService  (changefeed)
 *   anything else    → error, never a default backend
 *
 * registerHandler hooks one EventHandler to both change sources, so the transport
 * layer sees a single stream of namespaced create/update/delete calls.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RouterService implements ResourceService {

    private final DbResourceService dbService;
    private final WorkBackendService workService;
    private final ControllerManager controllerManager;
    private final WatchSource watchSource;

    @Override
    public ResourceEvent get(String resourceId) {
        Backend backend = Backend.classify(resourceId)
                .orElseThrow(() -> new EntityNotFoundException(
                        "Resource not found: " + resourceId + " (unknown source)"));
        return backendFor(backend).get(backend.localKey(resourceId));
    }

    /**
     * Scoped lists go to one backend. Unscoped lists concatenate both; callers must
     * not rely on the order between the two.
     */
    @Override
    public List<ResourceEvent> list(ListOptions listOptions) {
        if (!listOptions.hasSource()) {
            List<ResourceEvent> all = new ArrayList<>(workService.list(listOptions));
            all.addAll(dbService.list(listOptions));
            return all;
        }
        Backend backend = Backend.classify(listOptions.getSource())
                .orElseThrow(() -> new UnknownSourceException(listOptions.getSource()));
        return backendFor(backend).list(listOptions);
    }

    @Override
    public void handleStatusUpdate(StatusUpdate statusUpdate) {
        String originalSource = statusUpdate.getOriginalSource();
        Backend backend = Backend.classify(originalSource).orElse(null);
        if (backend == null) {
            log.error("failed to handle status update: unrecognized original source {}", originalSource);
            throw new UnknownSourceException(originalSource);
        }

        try {
            backendFor(backend).handleStatusUpdate(statusUpdate);
        } catch (RuntimeException e) {
            log.error("failed to handle status update for {} resource {}: {}",
                    backend.namespace(), statusUpdate.getMetadata().get(StatusUpdate.RESOURCE_ID), e.getMessage());
            throw e;
        }
    }

    @Override
    public void registerHandler(EventHandler handler) {
        controllerManager.add(ControllerConfig.builder()
                .source(DbResourceService.EVENT_SOURCE)
                .handler(EventType.CREATE, List.of((ctx, sourceId) ->
                        handler.onCreate(ResourceEvent.MANIFEST_BUNDLE_TYPE, Backend.CHANGEFEED.resourceId(sourceId))))
                .handler(EventType.UPDATE, List.of((ctx, sourceId) ->
                        handler.onUpdate(ResourceEvent.MANIFEST_BUNDLE_TYPE, Backend.CHANGEFEED.resourceId(sourceId))))
                .handler(EventType.DELETE, List.of((ctx, sourceId) ->
                        handler.onDelete(ResourceEvent.MANIFEST_BUNDLE_TYPE, Backend.CHANGEFEED.resourceId(sourceId))))
                .build());

        watchSource.addEventHandler(new WatchEventHandler() {
            @Override
            public void onAdd(WorkObject obj) throws Exception {
                handler.onCreate(ResourceEvent.MANIFEST_BUNDLE_TYPE, Backend.WATCH.resourceId(obj.key()));
            }

            @Override
            public void onUpdate(WorkObject oldObj, WorkObject newObj) throws Exception {
                handler.onUpdate(ResourceEvent.MANIFEST_BUNDLE_TYPE, Backend.WATCH.resourceId(newObj.key()));
            }

            @Override
            public void onDelete(WorkObject obj) throws Exception {
                handler.onDelete(ResourceEvent.MANIFEST_BUNDLE_TYPE, Backend.WATCH.resourceId(obj.key()));
            }
        });
        log.info("Registered event handler {} for changefeed and watch sources", handler.getClass().getSimpleName());
    }

    private BackendService backendFor(Backend backend) {
        return switch (backend) {
            case WATCH -> workService;
            case CHANGEFEED -> dbService;
        };
    }
}
