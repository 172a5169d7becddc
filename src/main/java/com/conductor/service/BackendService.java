package com.conductor.service;

import com.conductor.dto.ListOptions;
import com.conductor.dto.ResourceEvent;
import com.conductor.dto.StatusUpdate;

import java.util.List;

/**
 * One system of record. Keys passed in are local, the namespace is already stripped.
 */
public interface BackendService {

    /**
     * @throws jakarta.persistence.EntityNotFoundException when no such resource exists
     */
    ResourceEvent get(String localKey);

    List<ResourceEvent> list(ListOptions listOptions);

    void handleStatusUpdate(StatusUpdate statusUpdate);
}
