package com.conductor.service;

import com.conductor.config.ConductorProperties;
import com.conductor.model.Event;
import com.conductor.repository.EventRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The changefeed: durable Events plus their change notification.
 *
 * FLOW:
 *   backend mutates a record → create(event) in the same transaction
 *                                   ↓
 *                            row committed to "events"
 *                                   ↓
 *                  event id published to the notifications topic
 *                                   ↓
 *          EventNotificationListener → ControllerManager.addEvent(id)
 *
 * The notification is best effort. If it is lost, the ControllerManager's
 * periodic sync still finds the unreconciled row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventService {

    private final EventRepository eventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ConductorProperties properties;

    @Transactional
    public Event create(Event event) {
        if (event.getId() == null) {
            event.setId(UUID.randomUUID().toString());
        }
        Event saved = eventRepository.save(event);
        notifyAfterCommit(saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public Event get(String id) {
        return eventRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException("Event not found: " + id));
    }

    @Transactional
    public Event replace(Event event) {
        if (!eventRepository.existsById(event.getId())) {
            throw new EntityNotFoundException("Event not found: " + event.getId());
        }
        event.setUpdatedAt(Instant.now());
        return eventRepository.save(event);
    }

    @Transactional
    public int deleteAllReconciledEvents() {
        return eventRepository.deleteAllReconciled();
    }

    @Transactional(readOnly = true)
    public List<Event> findAllUnreconciledEvents() {
        return eventRepository.findByReconciledDateIsNull();
    }

    private void notifyAfterCommit(String eventId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            publish(eventId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                publish(eventId);
            }
        });
    }

    private void publish(String eventId) {
        String topic = properties.getTopics().getEventNotifications();
        try {
            kafkaTemplate.send(topic, eventId, eventId);
            log.debug("Notified {} of event {}", topic, eventId);
        } catch (RuntimeException e) {
            // the row is committed; the periodic sync picks it up
            log.error("Failed to notify {} of event {}: {}", topic, eventId, e.getMessage(), e);
        }
    }
}
