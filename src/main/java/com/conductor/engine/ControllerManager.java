package com.conductor.engine;

import com.conductor.config.ConductorProperties;
import com.conductor.lock.LockFactory;
import com.conductor.lock.LockLease;
import com.conductor.lock.LockNamespace;
import com.conductor.model.Event;
import com.conductor.model.EventType;
import com.conductor.queue.ItemExponentialFailureRateLimiter;
import com.conductor.queue.RateLimitingQueue;
import com.conductor.service.EventService;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reconciles changefeed Events against registered handlers.
 *
 * FLOW:
 *   notification (event id) → addEvent(id) → work queue (deduplicated)
 *                                                 ↓
 *                                  worker: handleEvent(id)
 *                                                 ↓
 *          fail-fast lease on (id, EVENTS) → fetch Event → run handlers for
 *          (source, eventType) in order → stamp reconciledDate
 *                                                 ↓
 *              reconciled → forget backoff      not reconciled → requeue with backoff
 *
 * Many workers, in this process or in other instances, may race for the same id.
 * Only the one holding the lease runs handlers; the others treat the id as done.
 *
 * A jittered periodic sync deletes reconciled Events and re-enqueues every
 * unreconciled one, which recovers notifications lost to crashes or dropped
 * connections.
 *
 * Handler registration happens during startup wiring, before run(). The
 * registry is not synchronized for registration after that.
 */
@Component
@Slf4j
public class ControllerManager implements SmartLifecycle {

    static final String MDC_EVENT_ID = "eventId";

    private final Map<String, Map<EventType, List<ControllerHandler>>> controllers = new HashMap<>();
    private final LockFactory lockFactory;
    private final EventService events;
    private final ConductorProperties.Controller settings;
    private final RateLimitingQueue<String> eventsQueue;

    private volatile boolean running;
    private CountDownLatch stopSignal;
    private ExecutorService syncExecutor;
    private ExecutorService workerExecutor;

    public ControllerManager(LockFactory lockFactory, EventService events, ConductorProperties properties) {
        this.lockFactory = lockFactory;
        this.events = events;
        this.settings = properties.getController();
        this.eventsQueue = new RateLimitingQueue<>("event-controller",
                new ItemExponentialFailureRateLimiter<>(settings.getBaseDelay(), settings.getMaxDelay()));
    }

    RateLimitingQueue<String> queue() {
        return eventsQueue;
    }

    /**
     * Appends the config's handlers. Registering the same (source, eventType) twice adds to the chain.
     */
    public void add(ControllerConfig config) {
        config.getHandlers().forEach((eventType, fns) -> add(config.getSource(), eventType, fns));
    }

    public void addEvent(String id) {
        eventsQueue.add(id);
    }

    /**
     * Starts the sync loop and the workers in the background and returns.
     */
    public synchronized void run() {
        if (running) {
            log.warn("Event controller is already running");
            return;
        }
        log.info("Starting event controller with {} worker(s)", settings.getWorkers());
        running = true;
        stopSignal = new CountDownLatch(1);

        syncExecutor = Executors.newSingleThreadExecutor(namedThreads("event-controller-sync"));
        syncExecutor.execute(this::syncLoop);

        int workers = Math.max(1, settings.getWorkers());
        workerExecutor = Executors.newFixedThreadPool(workers, namedThreads("event-controller-worker"));
        for (int i = 0; i < workers; i++) {
            workerExecutor.execute(this::runWorker);
        }
    }

    /**
     * Stops the loops cooperatively. A handleEvent already in flight runs to completion.
     */
    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        log.info("Shutting down event controller");
        running = false;
        stopSignal.countDown();
        eventsQueue.shutDown();
        syncExecutor.shutdown();
        workerExecutor.shutdown();
    }

    @Override
    public void start() {
        run();
    }

    @Override
    public void stop() {
        shutdown();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void add(String source, EventType eventType, List<ControllerHandler> fns) {
        controllers.computeIfAbsent(source, s -> new EnumMap<>(EventType.class))
                .computeIfAbsent(eventType, t -> new ArrayList<>())
                .addAll(fns);
    }

    ReconcileResult handleEvent(String id) {
        // Fail-fast lease: of many competing workers only the first gets it, the
        // rest move on. Each Event is locked by its own id, so distinct Events
        // proceed concurrently.
        LockLease lease;
        try {
            lease = lockFactory.newNonBlockingLock(id, LockNamespace.EVENTS);
        } catch (RuntimeException e) {
            return ReconcileResult.retry(
                    new IllegalStateException("error obtaining the event lock: " + e.getMessage(), e));
        }

        try {
            if (!lease.isAcquired()) {
                log.info("Event {} is processed by another worker, continue to process the next", id);
                return ReconcileResult.done();
            }
            MDC.put(MDC_EVENT_ID, id);
            return reconcile(id, new HandlerContext(id));
        } finally {
            MDC.remove(MDC_EVENT_ID);
            lockFactory.unlock(lease);
        }
    }

    private ReconcileResult reconcile(String id, HandlerContext context) {
        Event event;
        try {
            event = events.get(id);
        } catch (EntityNotFoundException e) {
            // already handled and purged through another path
            return ReconcileResult.done();
        } catch (RuntimeException e) {
            return ReconcileResult.retry(
                    new IllegalStateException("error getting event with id(" + id + "): " + e.getMessage(), e));
        }

        if (event.isReconciled()) {
            log.info("Event with id ({}) is already reconciled", id);
            return ReconcileResult.done();
        }

        Map<EventType, List<ControllerHandler>> source = controllers.get(event.getSource());
        if (source == null) {
            log.info("No controllers found for '{}'", event.getSource());
            return ReconcileResult.done();
        }

        List<ControllerHandler> handlerFns = source.get(event.getEventType());
        if (handlerFns == null) {
            log.info("No handler functions found for '{}-{}'", event.getSource(), event.getEventType());
            return ReconcileResult.done();
        }

        for (ControllerHandler fn : handlerFns) {
            try {
                fn.handle(context, event.getSourceId());
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                return ReconcileResult.retry(new IllegalStateException(String.format(
                        "error handling event %s, %s, %s: %s",
                        event.getSource(), event.getEventType(), id, e.getMessage()), e));
            }
        }

        event.setReconciledDate(Instant.now());
        try {
            events.replace(event);
        } catch (RuntimeException e) {
            // handlers already ran; they are idempotent, so a full replay is safe
            return ReconcileResult.retry(
                    new IllegalStateException("error updating event with id (" + id + "): " + e.getMessage(), e));
        }
        return ReconcileResult.done();
    }

    private void runWorker() {
        // processNextEvent blocks until there is work, no extra wait needed
        while (processNextEvent()) {
        }
        log.debug("Event controller worker exiting");
    }

    /**
     * Handles one key off the queue. Returns false once the queue is shut down.
     */
    boolean processNextEvent() {
        Optional<String> next;
        try {
            next = eventsQueue.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (next.isEmpty()) {
            return false;
        }

        String key = next.get();
        try {
            ReconcileResult result;
            try {
                result = handleEvent(key);
            } catch (RuntimeException e) {
                result = ReconcileResult.retry(e);
            }

            if (!result.isReconciled()) {
                if (result.getError() != null) {
                    log.error("Failed to handle the event {}: {}", key, result.getError().getMessage(),
                            result.getError());
                }
                // backoff keeps a failing event from hot-looping
                eventsQueue.addRateLimited(key);
                return true;
            }

            eventsQueue.forget(key);
            return true;
        } finally {
            eventsQueue.done(key);
        }
    }

    /**
     * Purges reconciled Events, then re-enqueues every unreconciled one.
     * Errors wait for the next cycle.
     */
    void syncEvents() {
        log.info("purge all reconciled events");
        try {
            int purged = events.deleteAllReconciledEvents();
            log.debug("Purged {} reconciled events", purged);
        } catch (RuntimeException e) {
            log.error("Failed to delete reconciled events from db: {}", e.getMessage(), e);
            return;
        }

        log.info("sync all unreconciled events");
        List<Event> unreconciled;
        try {
            unreconciled = events.findAllUnreconciledEvents();
        } catch (RuntimeException e) {
            log.error("Failed to list unreconciled events from db: {}", e.getMessage(), e);
            return;
        }

        for (Event event : unreconciled) {
            eventsQueue.add(event.getId());
        }
    }

    private void syncLoop() {
        CountDownLatch stopped = stopSignal;
        try {
            do {
                try {
                    syncEvents();
                } catch (RuntimeException e) {
                    log.error("Event sync failed: {}", e.getMessage(), e);
                }
            } while (!stopped.await(jitteredSyncPeriod().toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Event sync loop exiting");
    }

    /**
     * syncPeriod stretched by up to jitterFactor so several instances don't sync in lockstep.
     */
    Duration jitteredSyncPeriod() {
        double jitter = settings.getJitterFactor();
        double spread = jitter <= 0 ? 0 : ThreadLocalRandom.current().nextDouble() * jitter;
        long millis = (long) (settings.getSyncPeriod().toMillis() * (1 + spread));
        return Duration.ofMillis(Math.max(1, millis));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
