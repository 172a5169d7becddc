package com.conductor.engine;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Passed to every handler of one reconciliation attempt; identifies the Event
 * being reconciled for correlation.
 */
@Getter
@AllArgsConstructor
@ToString
public class HandlerContext {

    private final String eventId;
}
