package com.conductor.queue;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A deduplicating work queue with delayed and rate-limited re-adds.
 *
 * RULES:
 *   - An item is in the queue at most once. Adding an item that is already waiting is a no-op.
 *   - An item handed out by get() is "processing" until done() is called. Adding it while
 *     it is processing only marks it dirty; done() puts it back in the queue once.
 *   - So the same item is never processed by two workers at the same time.
 *   - After shutDown(), get() drains what is left and then returns empty.
 */
@Slf4j
public class RateLimitingQueue<T> {

    private final String name;
    private final RateLimiter<T> rateLimiter;
    private final ScheduledExecutorService delayer;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    private final Deque<T> queue = new ArrayDeque<>();
    // items that need processing, whether queued or waiting for done()
    private final Set<T> dirty = new HashSet<>();
    private final Set<T> processing = new HashSet<>();
    private boolean shuttingDown;

    public RateLimitingQueue(String name, RateLimiter<T> rateLimiter) {
        this.name = name;
        this.rateLimiter = rateLimiter;
        this.delayer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name + "-delay");
            t.setDaemon(true);
            return t;
        });
    }

    public void add(T item) {
        lock.lock();
        try {
            if (shuttingDown || dirty.contains(item)) {
                return;
            }
            dirty.add(item);
            if (processing.contains(item)) {
                return;
            }
            queue.addLast(item);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until an item is available. Returns empty once the queue is shut down and drained.
     */
    public Optional<T> get() throws InterruptedException {
        lock.lock();
        try {
            while (queue.isEmpty() && !shuttingDown) {
                notEmpty.await();
            }
            if (queue.isEmpty()) {
                return Optional.empty();
            }
            T item = queue.pollFirst();
            processing.add(item);
            dirty.remove(item);
            return Optional.of(item);
        } finally {
            lock.unlock();
        }
    }

    public void done(T item) {
        lock.lock();
        try {
            processing.remove(item);
            if (dirty.contains(item)) {
                queue.addLast(item);
                notEmpty.signal();
            }
        } finally {
            lock.unlock();
        }
    }

    public void addAfter(T item, Duration delay) {
        if (isShuttingDown()) {
            return;
        }
        if (delay.isZero() || delay.isNegative()) {
            add(item);
            return;
        }
        try {
            delayer.schedule(() -> add(item), delay.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Queue {} is shutting down, dropping delayed add of {}", name, item);
        }
    }

    public void addRateLimited(T item) {
        addAfter(item, rateLimiter.when(item));
    }

    public void forget(T item) {
        rateLimiter.forget(item);
    }

    public int numRequeues(T item) {
        return rateLimiter.numRequeues(item);
    }

    public int len() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isShuttingDown() {
        lock.lock();
        try {
            return shuttingDown;
        } finally {
            lock.unlock();
        }
    }

    public void shutDown() {
        lock.lock();
        try {
            shuttingDown = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        delayer.shutdownNow();
        log.info("Work queue {} shut down", name);
    }
}
