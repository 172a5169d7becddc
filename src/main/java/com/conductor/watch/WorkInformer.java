package com.conductor.watch;

import com.conductor.config.ConductorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Local cache of work objects plus ordered delivery of their changes.
 *
 * FLOW:
 *   WatchNotificationListener → apply(notification)
 *                                    ↓
 *                     cache updated, (op, old, new) offered to a bounded queue
 *                                    ↓
 *                     single dispatcher thread → every WatchEventHandler
 *
 * apply() never blocks the caller. When the queue is full the delivery is dropped
 * with a warning; the cache is still current and the next resync re-delivers it.
 *
 * Resync: every resyncPeriod an update notification (old == new) is queued for every
 * cached object, so a handler error on this path is retried at the next resync.
 */
@Component
@Slf4j
public class WorkInformer implements WatchSource, SmartLifecycle {

    private final Map<String, WorkObject> cache = new ConcurrentHashMap<>();
    private final List<WatchEventHandler> handlers = new CopyOnWriteArrayList<>();
    private final BlockingQueue<Delivery> deliveries;
    private final Duration resyncPeriod;

    private volatile boolean running;
    private Thread dispatcher;
    private ScheduledExecutorService resyncer;

    public WorkInformer(ConductorProperties properties) {
        this.deliveries = new ArrayBlockingQueue<>(properties.getWatch().getQueueCapacity());
        this.resyncPeriod = properties.getWatch().getResyncPeriod();
    }

    @Override
    public void addEventHandler(WatchEventHandler handler) {
        handlers.add(handler);
    }

    @Override
    public Optional<WorkObject> get(String key) {
        return Optional.ofNullable(cache.get(key));
    }

    @Override
    public List<WorkObject> list() {
        return new ArrayList<>(cache.values());
    }

    /**
     * Folds one notification into the cache and queues it for the handlers.
     */
    public void apply(WatchNotification notification) {
        WorkObject obj = notification.getObject();
        if (notification.getOp() == null || obj == null || obj.getName() == null) {
            log.warn("Ignoring malformed watch notification");
            return;
        }
        String key = obj.key();

        switch (notification.getOp()) {
            case ADDED, MODIFIED -> {
                WorkObject old = cache.put(key, obj);
                if (old == null) {
                    enqueue(new Delivery(WatchOp.ADDED, null, obj));
                } else {
                    enqueue(new Delivery(WatchOp.MODIFIED, old, obj));
                }
            }
            case DELETED -> {
                WorkObject old = cache.remove(key);
                enqueue(new Delivery(WatchOp.DELETED, null, old != null ? old : obj));
            }
        }
    }

    /**
     * Replaces the cached status of an object. Returns false when the object is
     * unknown or newer than the reported version.
     */
    public boolean updateStatus(String key, long resourceVersion, Map<String, Object> status) {
        boolean[] applied = {false};
        cache.computeIfPresent(key, (k, current) -> {
            if (resourceVersion < current.getResourceVersion()) {
                return current;
            }
            applied[0] = true;
            return current.toBuilder().status(status).build();
        });
        return applied[0];
    }

    void resync() {
        for (WorkObject obj : cache.values()) {
            enqueue(new Delivery(WatchOp.MODIFIED, obj, obj));
        }
    }

    private void enqueue(Delivery delivery) {
        if (!deliveries.offer(delivery)) {
            log.warn("Watch delivery queue is full, dropping {} of {}", delivery.op, delivery.current().key());
        }
    }

    private void dispatchLoop() {
        while (running) {
            Delivery delivery;
            try {
                delivery = deliveries.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            dispatch(delivery);
        }
    }

    void dispatch(Delivery delivery) {
        for (WatchEventHandler handler : handlers) {
            try {
                switch (delivery.op) {
                    case ADDED -> handler.onAdd(delivery.newObj);
                    case MODIFIED -> handler.onUpdate(delivery.oldObj, delivery.newObj);
                    case DELETED -> handler.onDelete(delivery.newObj);
                }
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                log.error("Watch handler failed on {} of {}: {}",
                        delivery.op, delivery.current().key(), e.getMessage(), e);
            }
        }
    }

    /**
     * Drains whatever is queued on the calling thread.
     */
    int drain() {
        List<Delivery> pending = new ArrayList<>();
        deliveries.drainTo(pending);
        pending.forEach(this::dispatch);
        return pending.size();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        dispatcher = new Thread(this::dispatchLoop, "work-informer-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();

        if (!resyncPeriod.isZero() && !resyncPeriod.isNegative()) {
            resyncer = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "work-informer-resync");
                t.setDaemon(true);
                return t;
            });
            long period = resyncPeriod.toMillis();
            resyncer.scheduleAtFixedRate(this::resync, period, period, TimeUnit.MILLISECONDS);
        }
        log.info("Work informer started (resync every {})", resyncPeriod);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        dispatcher.interrupt();
        if (resyncer != null) {
            resyncer.shutdownNow();
        }
        log.info("Work informer stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    static final class Delivery {
        private final WatchOp op;
        private final WorkObject oldObj;
        private final WorkObject newObj;

        Delivery(WatchOp op, WorkObject oldObj, WorkObject newObj) {
            this.op = op;
            this.oldObj = oldObj;
            this.newObj = newObj;
        }

        WorkObject current() {
            return newObj;
        }
    }
}
