package com.conductor.lock;

/**
 * The lock coordinator could not answer, which is different from the lease being held.
 */
public class LockException extends RuntimeException {

    public LockException(String message) {
        super(message);
    }

    public LockException(String message, Throwable cause) {
        super(message, cause);
    }
}
