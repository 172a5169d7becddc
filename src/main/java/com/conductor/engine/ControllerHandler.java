package com.conductor.engine;

/**
 * One step of a reconciliation. Receives the id of the affected record
 * (the Event's sourceId).
 *
 * Handlers must be idempotent: a failure anywhere in the chain, or in stamping
 * the Event afterwards, replays the whole chain.
 */
@FunctionalInterface
public interface ControllerHandler {

    void handle(HandlerContext context, String sourceId) throws Exception;
}
