package com.conductor.engine;

import com.conductor.model.EventType;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Map;

/**
 * Wires handlers to one Event source.
 *
 * Example:
 *   ControllerConfig.builder()
 *       .source("Resources")
 *       .handler(EventType.CREATE, List.of(publisher::onCreate))
 *       .handler(EventType.DELETE, List.of(publisher::onDelete))
 *       .build();
 */
@Getter
@Builder
public class ControllerConfig {

    private final String source;

    @Singular
    private final Map<EventType, List<ControllerHandler>> handlers;
}
