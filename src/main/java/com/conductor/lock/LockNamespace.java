package com.conductor.lock;

/**
 * Namespaces keep lease keys for different record kinds apart, so an Event
 * and a Resource that happen to share an id never contend for the same lease.
 */
public enum LockNamespace {
    EVENTS("events"),
    RESOURCES("resources");

    private final String tag;

    LockNamespace(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
