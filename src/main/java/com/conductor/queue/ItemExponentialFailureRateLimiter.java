package com.conductor.queue;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-item exponential backoff: baseDelay * 2^failures, capped at maxDelay.
 *
 *   failure 1 → 5ms
 *   failure 2 → 10ms
 *   failure 3 → 20ms
 *   ...
 *   failure n → min(5ms * 2^(n-1), 1000s)
 */
public class ItemExponentialFailureRateLimiter<T> implements RateLimiter<T> {

    private final ConcurrentMap<T, Integer> failures = new ConcurrentHashMap<>();
    private final Duration baseDelay;
    private final Duration maxDelay;

    public ItemExponentialFailureRateLimiter(Duration baseDelay, Duration maxDelay) {
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                    "invalid backoff bounds: base=" + baseDelay + ", max=" + maxDelay);
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    @Override
    public Duration when(T item) {
        int exp = failures.merge(item, 1, Integer::sum) - 1;

        // 2^62 already overflows any sane base delay
        if (exp >= 62) {
            return maxDelay;
        }
        long baseNanos = baseDelay.toNanos();
        long factor = 1L << exp;
        if (baseNanos != 0 && factor > Long.MAX_VALUE / baseNanos) {
            return maxDelay;
        }
        Duration backoff = Duration.ofNanos(baseNanos * factor);
        return backoff.compareTo(maxDelay) > 0 ? maxDelay : backoff;
    }

    @Override
    public void forget(T item) {
        failures.remove(item);
    }

    @Override
    public int numRequeues(T item) {
        return failures.getOrDefault(item, 0);
    }
}
