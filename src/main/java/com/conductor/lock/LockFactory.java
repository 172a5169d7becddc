package com.conductor.lock;

/**
 * Fail-fast mutual exclusion keyed by (id, namespace).
 */
public interface LockFactory {

    /**
     * Attempts to take the lease for the given id without waiting.
     *
     * @return a lease whose {@code acquired} flag is false when another owner holds it
     * @throws LockException when the coordinator itself cannot be reached
     */
    LockLease newNonBlockingLock(String id, LockNamespace namespace);

    /**
     * Releases a lease. Safe to call with a lease that was not acquired.
     */
    void unlock(LockLease lease);
}
