package com.conductor.lock;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of a non-blocking lease attempt. Every lease, acquired or not,
 * must be handed back to {@link LockFactory#unlock(LockLease)}.
 */
@Getter
@AllArgsConstructor
@ToString
public class LockLease {

    private final String key;
    private final String ownerToken;
    private final boolean acquired;
}
