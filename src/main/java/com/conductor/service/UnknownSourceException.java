package com.conductor.service;

import lombok.Getter;

/**
 * Raised when an id or source marker belongs to no known backend. Such a request
 * cannot be routed at all, so it is never defaulted to a backend.
 */
@Getter
public class UnknownSourceException extends RuntimeException {

    private final String source;

    public UnknownSourceException(String source) {
        super("unrecognized resource source: " + (source == null || source.isEmpty() ? "<empty>" : source));
        this.source = source;
    }
}
