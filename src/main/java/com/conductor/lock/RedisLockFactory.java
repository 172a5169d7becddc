package com.conductor.lock;

import com.conductor.config.ConductorProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed advisory leases, shared by every conductor instance.
 *
 * HOW IT WORKS:
 *   1. newNonBlockingLock SETs "conductor:lock:{namespace}:{id}" to a fresh owner token
 *      with NX (only if absent) and a TTL
 *   2. If the SET succeeds → the caller owns the lease
 *   3. If the SET fails   → someone else owns it, the caller moves on immediately
 *   4. While the lease is held, every leaseTtl/3 renew.lua pushes its expiry out by
 *      another leaseTtl, as long as the key still holds the caller's token
 *   5. unlock runs release.lua, which deletes the key only while it still holds
 *      the caller's token, so an expired-and-retaken lease is never released by
 *      its previous owner
 *
 * A handler chain may run longer than leaseTtl; the renewal keeps the key alive.
 * The key expires only when its owner stops renewing it, i.e. the process died or
 * lost Redis for longer than two thirds of the TTL.
 */
@Component
@Slf4j
public class RedisLockFactory implements LockFactory {

    static final String LOCK_PREFIX = "conductor:lock:";

    private final StringRedisTemplate redisTemplate;
    private final Duration leaseTtl;
    private final DefaultRedisScript<Long> releaseScript;
    private final DefaultRedisScript<Long> renewScript;
    private final Map<String, String> held = new ConcurrentHashMap<>();
    private final ScheduledExecutorService renewer;

    public RedisLockFactory(StringRedisTemplate redisTemplate, ConductorProperties properties) {
        this.redisTemplate = redisTemplate;
        this.leaseTtl = properties.getLock().getLeaseTtl();
        this.releaseScript = script("lock/release.lua");
        this.renewScript = script("lock/renew.lua");

        this.renewer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "lease-renewer");
            t.setDaemon(true);
            return t;
        });
        long period = Math.max(1, leaseTtl.toMillis() / 3);
        renewer.scheduleAtFixedRate(this::renewHeld, period, period, TimeUnit.MILLISECONDS);
    }

    private static DefaultRedisScript<Long> script(String path) {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setLocation(new ClassPathResource(path));
        script.setResultType(Long.class);
        return script;
    }

    @Override
    public LockLease newNonBlockingLock(String id, LockNamespace namespace) {
        String key = LOCK_PREFIX + namespace.tag() + ":" + id;
        String token = UUID.randomUUID().toString();

        Boolean wasSet;
        try {
            wasSet = redisTemplate.opsForValue().setIfAbsent(key, token, leaseTtl);
        } catch (RuntimeException e) {
            throw new LockException("failed to acquire lease " + key, e);
        }
        if (wasSet == null) {
            // only happens inside a pipeline/transaction, which we never open
            throw new LockException("no reply from redis for lease " + key);
        }

        if (wasSet) {
            held.put(key, token);
        }
        return new LockLease(key, token, wasSet);
    }

    @Override
    public void unlock(LockLease lease) {
        if (lease == null || !lease.isAcquired()) {
            return;
        }
        held.remove(lease.getKey(), lease.getOwnerToken());
        try {
            Long released = redisTemplate.execute(releaseScript,
                    Collections.singletonList(lease.getKey()), lease.getOwnerToken());
            if (!Long.valueOf(1L).equals(released)) {
                log.warn("Lease {} had already expired or changed owner before release", lease.getKey());
            }
        } catch (RuntimeException e) {
            // the key stops being renewed, the TTL reclaims it
            log.error("Failed to release lease {}: {}", lease.getKey(), e.getMessage(), e);
        }
    }

    /**
     * Extends every lease this instance still holds. A lease whose key no longer
     * carries our token is dropped from renewal.
     */
    void renewHeld() {
        String ttlMillis = String.valueOf(leaseTtl.toMillis());
        held.forEach((key, token) -> {
            try {
                Long renewed = redisTemplate.execute(renewScript, Collections.singletonList(key), token, ttlMillis);
                if (!Long.valueOf(1L).equals(renewed)) {
                    log.warn("Lease {} was lost before renewal, another worker may now own it", key);
                    held.remove(key, token);
                }
            } catch (RuntimeException e) {
                log.error("Failed to renew lease {}: {}", key, e.getMessage(), e);
            }
        });
    }

    int heldCount() {
        return held.size();
    }

    @PreDestroy
    void close() {
        renewer.shutdownNow();
    }
}
