package com.demo.chatbot.service;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConversationContext;
import com.demo.chatbot.domain.IncomingMessage;
import com.demo.chatbot.domain.SentimentScores;
import com.demo.chatbot.infrastructure.ContextCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Per-message processing shared by the HTTP and WebSocket entry points.
 *
 * Flow: validate, detect language, analyse sentiment, read context, dispatch, enrich, update
 * context, log. Always returns exactly one reply; unexpected faults become an apology
 * with source {@code error}.
 */
@Slf4j
@Service
public class MessagePipeline {

    static final String EMPTY_MESSAGE = "Empty message received";

    private final LanguageDetectionService languageDetectionService;
    private final SentimentService sentimentService;
    private final ContextCache contextCache;
    private final BackendDispatcher backendDispatcher;
    private final ResponseEnricher responseEnricher;
    private final ConversationLogger conversationLogger;
    private final MetricsService metricsService;

    public MessagePipeline(LanguageDetectionService languageDetectionService,
                           SentimentService sentimentService,
                           ContextCache contextCache,
                           BackendDispatcher backendDispatcher,
                           ResponseEnricher responseEnricher,
                           ConversationLogger conversationLogger,
                           MetricsService metricsService) {
        this.languageDetectionService = languageDetectionService;
        this.sentimentService = sentimentService;
        this.contextCache = contextCache;
        this.backendDispatcher = backendDispatcher;
        this.responseEnricher = responseEnricher;
        this.conversationLogger = conversationLogger;
        this.metricsService = metricsService;
    }

    public BotResponse process(IncomingMessage incoming) {
        String senderId = incoming.getSenderId();
        String text = incoming.getText();
        if (text == null || text.isBlank()) {
            log.debug("Empty message: senderId={}", senderId);
            return BotResponse.error(EMPTY_MESSAGE);
        }

        MetricsService.TimerSample timer = metricsService.startTimer();
        try {
            String message = text.trim();

            String language = languageDetectionService.detect(message);
            SentimentScores sentiment = sentimentService.analyze(message);
            ConversationContext context = readContext(senderId);

            BotResponse base = backendDispatcher.dispatch(message, senderId, incoming.getMetadata(), context);
            BotResponse reply = responseEnricher.enrich(base, message, senderId, language, sentiment, context);

            conversationLogger.updateContext(senderId, message, reply, context);
            conversationLogger.logConversation(senderId, message, reply, incoming.getMetadata());

            log.debug("Message processed: senderId={}, source={}, confidence={}, language={}",
                    senderId, reply.getSource().wireName(), reply.getConfidence(), language);
            return reply;

        } catch (Exception e) {
            log.error("Error processing message: senderId={}", senderId, e);
            metricsService.recordError("PIPELINE_FAILED", "MessagePipeline");
            return BotResponse.error(BackendDispatcher.APOLOGY_TEXT);
        } finally {
            metricsService.stopTimer(timer, "pipeline.latency");
        }
    }

    private ConversationContext readContext(String senderId) {
        try {
            return contextCache.get(senderId).orElseGet(ConversationContext::empty);
        } catch (Exception e) {
            log.warn("Context read failed, starting fresh: senderId={}, error={}", senderId, e.getMessage());
            return ConversationContext.empty();
        }
    }
}
