package com.conductor.watch;

/**
 * Callbacks for watch notifications. Exceptions are logged by the dispatcher and
 * do not stop delivery to other handlers or of later notifications.
 */
public interface WatchEventHandler {

    void onAdd(WorkObject obj) throws Exception;

    void onUpdate(WorkObject oldObj, WorkObject newObj) throws Exception;

    void onDelete(WorkObject obj) throws Exception;
}
