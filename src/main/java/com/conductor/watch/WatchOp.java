package com.conductor.watch;

public enum WatchOp {
    ADDED,
    MODIFIED,
    DELETED
}
