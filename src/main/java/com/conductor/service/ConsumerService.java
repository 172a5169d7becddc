package com.conductor.service;

import com.conductor.model.Consumer;
import com.conductor.repository.ConsumerRepository;
import com.conductor.repository.ResourceRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Registry of clusters allowed to receive changefeed-backed resources.
 *
 * A cluster is registered once when it joins. Resources can only be created
 * for a registered consumer, and a consumer that still owns resources cannot
 * be removed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsumerService {

    private final ConsumerRepository consumerRepository;
    private final ResourceRepository resourceRepository;

    /**
     * Registers the consumer, returning the existing record when it is already known.
     */
    @Transactional
    public Consumer register(String name) {
        return consumerRepository.findById(name).orElseGet(() -> {
            Consumer saved = consumerRepository.save(Consumer.builder().name(name).build());
            log.info("Registered consumer {}", name);
            return saved;
        });
    }

    @Transactional(readOnly = true)
    public Consumer get(String name) {
        return consumerRepository.findById(name)
                .orElseThrow(() -> new EntityNotFoundException("Consumer not found: " + name));
    }

    @Transactional(readOnly = true)
    public List<Consumer> list() {
        return consumerRepository.findAll();
    }

    @Transactional
    public void delete(String name) {
        Consumer consumer = get(name);
        if (resourceRepository.existsByConsumerName(name)) {
            throw new IllegalArgumentException("consumer " + name + " still has resources");
        }
        consumerRepository.delete(consumer);
        log.info("Removed consumer {}", name);
    }

    public void requireRegistered(String name) {
        if (name == null || !consumerRepository.existsById(name)) {
            throw new IllegalArgumentException("consumer " + name + " is not registered");
        }
    }
}
