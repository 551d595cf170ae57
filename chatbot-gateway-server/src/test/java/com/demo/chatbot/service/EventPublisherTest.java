package com.demo.chatbot.service;

import com.demo.chatbot.domain.ConversationLogEntity;
import com.demo.chatbot.domain.SentimentScores;
import io.micrometer.core.instrument.Tags;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventPublisherTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    @Test
    @SuppressWarnings("unchecked")
    void conversationEventIsKeyedByUser() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());
        EventPublisher publisher = new EventPublisher(kafkaTemplate, new MetricsService(), "chat-events");

        publisher.publishConversationLogged(ConversationLogEntity.builder()
                .userId("u1")
                .intent("greet")
                .source("greeting")
                .confidence(1.0)
                .language("en")
                .sentiment(SentimentScores.builder().compound(0.3).build())
                .build());

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("chat-events"), eq("u1"), event.capture());
        assertThat((Map<String, Object>) event.getValue())
                .containsEntry("eventType", EventPublisher.CONVERSATION_LOGGED)
                .containsEntry("source", "greeting")
                .containsEntry("compound", 0.3);
    }

    @Test
    void failedSendIsRecorded() {
        MetricsService metricsService = new MetricsService();
        CompletableFuture<SendResult<String, Object>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("broker down"));
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(failed);

        new EventPublisher(kafkaTemplate, metricsService, "chat-events")
                .publishConversationLogged(ConversationLogEntity.builder().userId("u1").build());

        assertThat(metricsService.getCounterValue("errors",
                Tags.of("type", "KAFKA_PUBLISH_ERROR", "component", "EventPublisher")))
                .isEqualTo(1);
    }
}
