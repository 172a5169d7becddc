package com.conductor.service;

import com.conductor.dto.ListOptions;
import com.conductor.dto.ResourceEvent;
import com.conductor.dto.StatusUpdate;

import java.util.List;

/**
 * What the transport layer talks to.
 */
public interface ResourceService {

    ResourceEvent get(String resourceId);

    List<ResourceEvent> list(ListOptions listOptions);

    void handleStatusUpdate(StatusUpdate statusUpdate);

    void registerHandler(EventHandler handler);
}
