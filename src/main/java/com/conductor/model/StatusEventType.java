package com.conductor.model;

/**
 * STATUS_UPDATE → the consumer reported a new status for a live resource
 * STATUS_DELETE → the consumer confirmed the resource is gone
 */
public enum StatusEventType {
    STATUS_UPDATE,
    STATUS_DELETE
}
