package com.conductor.model;

/**
 * The kind of mutation an {@link Event} announces.
 */
public enum EventType {
    CREATE,
    UPDATE,
    DELETE
}
