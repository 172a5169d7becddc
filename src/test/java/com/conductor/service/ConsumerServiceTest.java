package com.conductor.service;

import com.conductor.model.Consumer;
import com.conductor.repository.ConsumerRepository;
import com.conductor.repository.ResourceRepository;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConsumerServiceTest {

    @Mock private ConsumerRepository consumerRepository;
    @Mock private ResourceRepository resourceRepository;

    @InjectMocks
    private ConsumerService consumerService;

    @Test
    @DisplayName("register() should save a new consumer")
    void register_shouldSave() {
        when(consumerRepository.findById("cluster1")).thenReturn(Optional.empty());
        when(consumerRepository.save(any(Consumer.class))).thenAnswer(inv -> inv.getArgument(0));

        Consumer consumer = consumerService.register("cluster1");

        assertEquals("cluster1", consumer.getName());
        assertNotNull(consumer.getCreatedAt());
    }

    @Test
    @DisplayName("register() of a known consumer returns it unchanged")
    void register_existing_shouldBeIdempotent() {
        Consumer existing = Consumer.builder().name("cluster1").build();
        when(consumerRepository.findById("cluster1")).thenReturn(Optional.of(existing));

        assertSame(existing, consumerService.register("cluster1"));
        verify(consumerRepository, never()).save(any());
    }

    @Test
    @DisplayName("requireRegistered() rejects unknown and missing names")
    void requireRegistered_shouldRejectUnknown() {
        when(consumerRepository.existsById("cluster1")).thenReturn(true);
        when(consumerRepository.existsById("cluster9")).thenReturn(false);

        assertDoesNotThrow(() -> consumerService.requireRegistered("cluster1"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> consumerService.requireRegistered("cluster9"));
        assertTrue(e.getMessage().contains("cluster9"));
        assertThrows(IllegalArgumentException.class, () -> consumerService.requireRegistered(null));
    }

    @Test
    @DisplayName("delete() refuses a consumer that still owns resources")
    void delete_withResources_shouldThrow() {
        when(consumerRepository.findById("cluster1"))
                .thenReturn(Optional.of(Consumer.builder().name("cluster1").build()));
        when(resourceRepository.existsByConsumerName("cluster1")).thenReturn(true);

        assertThrows(IllegalArgumentException.class, () -> consumerService.delete("cluster1"));
        verify(consumerRepository, never()).delete(any());
    }

    @Test
    @DisplayName("delete() removes an idle consumer")
    void delete_idle_shouldRemove() {
        Consumer consumer = Consumer.builder().name("cluster1").build();
        when(consumerRepository.findById("cluster1")).thenReturn(Optional.of(consumer));
        when(resourceRepository.existsByConsumerName("cluster1")).thenReturn(false);

        consumerService.delete("cluster1");

        verify(consumerRepository).delete(consumer);
    }

    @Test
    @DisplayName("get() of an unknown consumer is not found")
    void get_missing_shouldThrow() {
        when(consumerRepository.findById("nope")).thenReturn(Optional.empty());

        assertThrows(EntityNotFoundException.class, () -> consumerService.get("nope"));
    }
}
