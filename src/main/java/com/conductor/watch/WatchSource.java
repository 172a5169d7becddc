package com.conductor.watch;

import java.util.List;
import java.util.Optional;

/**
 * Change notifications plus a local read cache of watched work objects.
 */
public interface WatchSource {

    void addEventHandler(WatchEventHandler handler);

    Optional<WorkObject> get(String key);

    List<WorkObject> list();
}
