package com.demo.chatbot.service;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConversationContext;
import com.demo.chatbot.domain.ConversationLogEntity;
import com.demo.chatbot.domain.ResponseMetadata;
import com.demo.chatbot.domain.SentimentScores;
import com.demo.chatbot.infrastructure.ContextCache;
import com.demo.chatbot.repository.ConversationLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Records each processed exchange: rewrites the sender's cached context and appends a row to
 * the message log. Neither step ever fails the caller.
 */
@Slf4j
@Service
public class ConversationLogger {

    static final String UNKNOWN_INTENT = "unknown";

    private final ContextCache contextCache;
    private final ConversationLogRepository conversationLogRepository;
    private final Optional<EventPublisher> eventPublisher;
    private final MetricsService metricsService;
    private final Clock clock;

    @Autowired
    public ConversationLogger(ContextCache contextCache,
                              ConversationLogRepository conversationLogRepository,
                              Optional<EventPublisher> eventPublisher,
                              MetricsService metricsService) {
        this(contextCache, conversationLogRepository, eventPublisher, metricsService, Clock.systemUTC());
    }

    ConversationLogger(ContextCache contextCache,
                       ConversationLogRepository conversationLogRepository,
                       Optional<EventPublisher> eventPublisher,
                       MetricsService metricsService,
                       Clock clock) {
        this.contextCache = contextCache;
        this.conversationLogRepository = conversationLogRepository;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Advance the context by one exchange and write it back with a fresh TTL.
     *
     * @return the advanced context, even if the write failed
     */
    public ConversationContext updateContext(String senderId,
                                             String message,
                                             BotResponse response,
                                             ConversationContext current) {
        ConversationContext base = current != null ? current : ConversationContext.empty();
        ConversationContext updated = base.advance(message, response.getText(), response.getIntent(), clock.instant());
        try {
            contextCache.put(senderId, updated);
        } catch (Exception e) {
            log.error("Error updating context: senderId={}", senderId, e);
            metricsService.recordError("CONTEXT_WRITE_FAILED", "ConversationLogger");
        }
        return updated;
    }

    /**
     * Append the exchange to the message log and announce it when event publishing is enabled.
     */
    public void logConversation(String senderId,
                                String message,
                                BotResponse response,
                                Map<String, Object> requestMetadata) {
        try {
            ResponseMetadata metadata = response.getMetadata();
            SentimentScores sentiment = metadata != null && metadata.getSentiment() != null
                    ? metadata.getSentiment()
                    : SentimentScores.neutral();
            String language = metadata != null && metadata.getLanguage() != null
                    ? metadata.getLanguage()
                    : "en";

            ConversationLogEntity record = ConversationLogEntity.builder()
                    .userId(senderId)
                    .userMessage(message)
                    .botResponse(response.getText())
                    .intent(response.getIntent() != null ? response.getIntent() : UNKNOWN_INTENT)
                    .confidence(response.getConfidence())
                    .source(response.getSource().wireName())
                    .timestamp(clock.instant())
                    .metadata(requestMetadata != null ? new LinkedHashMap<>(requestMetadata) : new LinkedHashMap<>())
                    .sentiment(sentiment)
                    .language(language)
                    .build();

            ConversationLogEntity saved = conversationLogRepository.save(record);
            metricsService.incrementCounter("conversations.logged");
            eventPublisher.ifPresent(publisher -> publisher.publishConversationLogged(saved));

        } catch (Exception e) {
            log.error("Error logging conversation: senderId={}", senderId, e);
            metricsService.recordError("CONVERSATION_LOG_FAILED", "ConversationLogger");
        }
    }
}
