package com.conductor.service;

import com.conductor.config.ConductorProperties;
import com.conductor.model.Event;
import com.conductor.model.EventType;
import com.conductor.repository.EventRepository;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventServiceTest {

    @Mock private EventRepository eventRepository;
    @Mock private KafkaTemplate<String, String> kafkaTemplate;

    private ConductorProperties properties;
    private EventService eventService;

    @BeforeEach
    void setUp() {
        properties = new ConductorProperties();
        eventService = new EventService(eventRepository, kafkaTemplate, properties);
    }

    private static Event event(String id) {
        return Event.builder()
                .id(id)
                .source(DbResourceService.EVENT_SOURCE)
                .sourceId("3a1e")
                .eventType(EventType.CREATE)
                .build();
    }

    @Test
    @DisplayName("create() should assign an id, save, and notify")
    void create_shouldSaveAndNotify() {
        when(eventRepository.save(any(Event.class))).thenAnswer(inv -> inv.getArgument(0));

        Event saved = eventService.create(event(null));

        assertNotNull(saved.getId());
        assertNull(saved.getReconciledDate());
        verify(kafkaTemplate).send(properties.getTopics().getEventNotifications(), saved.getId(), saved.getId());
    }

    @Test
    @DisplayName("create() keeps a caller-assigned id")
    void create_shouldKeepGivenId() {
        when(eventRepository.save(any(Event.class))).thenAnswer(inv -> inv.getArgument(0));

        assertEquals("evt-1", eventService.create(event("evt-1")).getId());
    }

    @Test
    @DisplayName("A failed notification does not fail create()")
    void create_notifyFailure_shouldNotThrow() {
        when(eventRepository.save(any(Event.class))).thenAnswer(inv -> inv.getArgument(0));
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenThrow(new IllegalStateException("broker down"));

        assertDoesNotThrow(() -> eventService.create(event("evt-1")));
        verify(eventRepository).save(any(Event.class));
    }

    @Test
    @DisplayName("get() of a missing event is not found")
    void get_missing_shouldThrow() {
        when(eventRepository.findById("nope")).thenReturn(Optional.empty());

        assertThrows(EntityNotFoundException.class, () -> eventService.get("nope"));
    }

    @Test
    @DisplayName("replace() saves an existing event")
    void replace_shouldSave() {
        Event event = event("evt-1");
        event.setReconciledDate(Instant.now());
        when(eventRepository.existsById("evt-1")).thenReturn(true);
        when(eventRepository.save(event)).thenReturn(event);

        assertTrue(eventService.replace(event).isReconciled());
    }

    @Test
    @DisplayName("replace() of a missing event is not found")
    void replace_missing_shouldThrow() {
        when(eventRepository.existsById("evt-1")).thenReturn(false);

        assertThrows(EntityNotFoundException.class, () -> eventService.replace(event("evt-1")));
        verify(eventRepository, never()).save(any());
    }

    @Test
    @DisplayName("Purge and listing delegate to the repository")
    void purgeAndList_shouldDelegate() {
        when(eventRepository.deleteAllReconciled()).thenReturn(3);
        when(eventRepository.findByReconciledDateIsNull()).thenReturn(List.of(event("evt-2")));

        assertEquals(3, eventService.deleteAllReconciledEvents());
        assertEquals(1, eventService.findAllUnreconciledEvents().size());
    }
}
