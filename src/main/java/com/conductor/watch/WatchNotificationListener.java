package com.conductor.watch;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer feeding the WorkInformer.
 *
 * Each instance keeps its own cache, so each uses its own consumer group and
 * reads the works topic in full.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WatchNotificationListener {

    private final WorkInformer informer;
    private final ObjectMapper objectMapper;

    @KafkaListener(topics = "${conductor.topics.works:conductor.works}",
            groupId = "conductor-works-#{T(java.util.UUID).randomUUID().toString()}",
            properties = "auto.offset.reset=earliest")
    public void onMessage(String message) {
        try {
            WatchNotification notification = objectMapper.readValue(message, WatchNotification.class);
            informer.apply(notification);
        } catch (Exception e) {
            log.error("Failed to process watch notification: {}", e.getMessage(), e);
        }
    }
}
