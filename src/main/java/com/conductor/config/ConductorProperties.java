package com.conductor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralizes topic names and reconciliation tuning.
 *
 * Bound from application.yml under "conductor" prefix:
 *   conductor:
 *     topics:
 *       event-notifications: conductor.events
 *       works: conductor.works
 *       resource-events: conductor.resource-events
 *       work-status: conductor.work-status
 *     controller:
 *       sync-period: 10h
 *       jitter-factor: 0.25
 *       workers: 1
 *       base-delay: 5ms
 *       max-delay: 1000s
 *     lock:
 *       lease-ttl: 5m
 *     watch:
 *       queue-capacity: 1024
 *       resync-period: 1h
 */
@Component
@ConfigurationProperties(prefix = "conductor")
@Getter
@Setter
public class ConductorProperties {

    private Topics topics = new Topics();
    private Controller controller = new Controller();
    private Lock lock = new Lock();
    private Watch watch = new Watch();

    @Getter
    @Setter
    public static class Topics {
        private String eventNotifications = "conductor.events";
        private String works = "conductor.works";
        private String resourceEvents = "conductor.resource-events";
        private String workStatus = "conductor.work-status";
    }

    @Getter
    @Setter
    public static class Controller {
        // long on purpose: the work queue handles expected failures, the sync only
        // catches notifications lost to restarts or dropped connections
        private Duration syncPeriod = Duration.ofHours(10);
        private double jitterFactor = 0.25;
        private int workers = 1;
        private Duration baseDelay = Duration.ofMillis(5);
        private Duration maxDelay = Duration.ofSeconds(1000);
    }

    @Getter
    @Setter
    public static class Lock {
        // renewed every leaseTtl/3 while held; bounds how long a dead owner blocks others
        private Duration leaseTtl = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Watch {
        private int queueCapacity = 1024;
        // zero disables the resync
        private Duration resyncPeriod = Duration.ofHours(1);
    }
}
