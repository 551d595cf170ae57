package com.demo.chatbot.service;

import com.demo.chatbot.domain.ConversationLogEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes conversation events to Kafka (optional).
 *
 * Enable with: spring.kafka.enabled=true
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class EventPublisher {

    static final String CONVERSATION_LOGGED = "CONVERSATION_LOGGED";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MetricsService metricsService;
    private final String chatEventsTopic;

    public EventPublisher(KafkaTemplate<String, Object> kafkaTemplate,
                          MetricsService metricsService,
                          @Value("${kafka.topics.chat-events:chat-events}") String chatEventsTopic) {
        this.kafkaTemplate = kafkaTemplate;
        this.metricsService = metricsService;
        this.chatEventsTopic = chatEventsTopic;
    }

    /**
     * Publish a logged exchange, keyed by user id. Fire-and-forget.
     */
    public void publishConversationLogged(ConversationLogEntity record) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", CONVERSATION_LOGGED);
        event.put("timestamp", Instant.now().toString());
        event.put("userId", record.getUserId());
        event.put("intent", record.getIntent());
        event.put("source", record.getSource());
        event.put("confidence", record.getConfidence());
        event.put("language", record.getLanguage());
        if (record.getSentiment() != null) {
            event.put("compound", record.getSentiment().getCompound());
        }

        publishEvent(chatEventsTopic, record.getUserId(), event, CONVERSATION_LOGGED);
    }

    private void publishEvent(String topic, String key, Object event, String eventType) {
        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Event published: type={}, topic={}, partition={}, offset={}",
                            eventType, topic,
                            result.getRecordMetadata().partition(),
                            result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event: type={}, topic={}", eventType, topic, ex);
                    metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
                }
            });

        } catch (Exception e) {
            log.error("Error publishing event: type={}", eventType, e);
            metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
        }
    }
}
