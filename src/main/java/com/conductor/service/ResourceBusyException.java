package com.conductor.service;

/**
 * Another worker holds the lease for this resource; the caller should retry later.
 */
public class ResourceBusyException extends RuntimeException {

    public ResourceBusyException(String message) {
        super(message);
    }
}
