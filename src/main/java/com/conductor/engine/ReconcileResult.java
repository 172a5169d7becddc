package com.conductor.engine;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one handleEvent attempt.
 *
 *   reconciled = true  → nothing left to do for this id (done, or someone else owns it)
 *   reconciled = false → requeue with backoff; error says why, when there is one
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@ToString
public class ReconcileResult {

    private static final ReconcileResult DONE = new ReconcileResult(true, null);

    private final boolean reconciled;
    private final Exception error;

    public static ReconcileResult done() {
        return DONE;
    }

    public static ReconcileResult retry(Exception error) {
        return new ReconcileResult(false, error);
    }
}
