package com.conductor.queue;

import java.time.Duration;

/**
 * Decides how long an item waits before it is retried.
 */
public interface RateLimiter<T> {

    /**
     * Records one more failure for the item and returns the delay before its next attempt.
     */
    Duration when(T item);

    /**
     * Drops the failure history of the item, typically after it succeeded.
     */
    void forget(T item);

    int numRequeues(T item);
}
