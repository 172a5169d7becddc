package com.conductor.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for changefeed notifications.
 *
 * FLOW:
 *   EventService.create → commits row → publishes event id on "conductor.events"
 *                                                ↓
 *                               EventNotificationListener reads it
 *                                                ↓
 *                                 ControllerManager.addEvent(id)
 *
 * Every instance uses its own consumer group so that every instance sees every
 * notification; the event lease decides which one does the work.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventNotificationListener {

    private final ControllerManager controllerManager;

    @KafkaListener(topics = "${conductor.topics.event-notifications:conductor.events}",
            groupId = "conductor-events-#{T(java.util.UUID).randomUUID().toString()}")
    public void onNotify(String eventId) {
        if (eventId == null || eventId.isBlank()) {
            log.warn("Ignoring empty event notification");
            return;
        }
        log.debug("Received notification for event {}", eventId);
        controllerManager.addEvent(eventId.trim());
    }
}
