package com.demo.chatbot.service;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConversationContext;
import com.demo.chatbot.domain.ConversationLogEntity;
import com.demo.chatbot.domain.ResponseMetadata;
import com.demo.chatbot.domain.ResponseSource;
import com.demo.chatbot.domain.SentimentScores;
import com.demo.chatbot.infrastructure.ContextCache;
import com.demo.chatbot.infrastructure.ContextCacheException;
import com.demo.chatbot.repository.ConversationLogRepository;
import com.demo.chatbot.support.InMemoryContextCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversationLoggerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ConversationLogRepository conversationLogRepository;

    @Mock
    private EventPublisher eventPublisher;

    private InMemoryContextCache contextCache;
    private MetricsService metricsService;

    @BeforeEach
    void setUp() {
        contextCache = new InMemoryContextCache();
        metricsService = new MetricsService();
    }

    @Test
    void updateContextAdvancesAndStores() {
        ConversationLogger logger = logger(Optional.empty());
        ConversationContext current = ConversationContext.builder()
                .messageCount(2)
                .userName("Dana")
                .build();
        current.setAttribute("preferred_course", "CS101");

        ConversationContext updated = logger.updateContext("u1", "what about DS201?", reply("It starts in June.", "ask_course"), current);

        assertThat(updated.getMessageCount()).isEqualTo(3);
        assertThat(updated.getLastMessage()).isEqualTo("what about DS201?");
        assertThat(updated.getLastResponse()).isEqualTo("It starts in June.");
        assertThat(updated.getLastIntent()).isEqualTo("ask_course");
        assertThat(updated.getLastUpdated()).isEqualTo(NOW);
        assertThat(updated.getUserName()).isEqualTo("Dana");
        assertThat(updated.getAttributes()).containsEntry("preferred_course", "CS101");
        assertThat(contextCache.get("u1")).contains(updated);
        assertThat(current.getMessageCount()).isEqualTo(2);
    }

    @Test
    void missingIntentIsRecordedAsUnknown() {
        ConversationContext updated = logger(Optional.empty())
                .updateContext("u1", "hmm", reply("Could you rephrase?", null), null);

        assertThat(updated.getLastIntent()).isEqualTo(ConversationLogger.UNKNOWN_INTENT);
        assertThat(updated.getMessageCount()).isEqualTo(1);
    }

    @Test
    void cacheFaultIsSwallowed() {
        ContextCache failing = mock(ContextCache.class);
        doThrow(new ContextCacheException("Failed to write context", new RuntimeException("redis down")))
                .when(failing).put(anyString(), any());
        ConversationLogger logger = new ConversationLogger(failing, conversationLogRepository, Optional.empty(),
                metricsService, Clock.fixed(NOW, ZoneOffset.UTC));

        ConversationContext updated = logger.updateContext("u1", "hi", reply("Hello!", "greet"), null);

        assertThat(updated.getMessageCount()).isEqualTo(1);
    }

    @Test
    void logConversationPersistsRecordAndPublishes() {
        when(conversationLogRepository.save(any(ConversationLogEntity.class))).thenAnswer(inv -> inv.getArgument(0));
        SentimentScores sentiment = SentimentScores.builder().compound(0.4).pos(0.3).neu(0.7).build();
        BotResponse response = reply("Hello!", null).toBuilder()
                .metadata(ResponseMetadata.builder().language("es").sentiment(sentiment).userId("u1").build())
                .build();

        logger(Optional.of(eventPublisher)).logConversation("u1", "hola", response, Map.of("channel", "web"));

        ArgumentCaptor<ConversationLogEntity> captor = ArgumentCaptor.forClass(ConversationLogEntity.class);
        verify(conversationLogRepository).save(captor.capture());
        ConversationLogEntity record = captor.getValue();
        assertThat(record.getUserId()).isEqualTo("u1");
        assertThat(record.getUserMessage()).isEqualTo("hola");
        assertThat(record.getBotResponse()).isEqualTo("Hello!");
        assertThat(record.getIntent()).isEqualTo("unknown");
        assertThat(record.getSource()).isEqualTo("default");
        assertThat(record.getLanguage()).isEqualTo("es");
        assertThat(record.getSentiment()).isEqualTo(sentiment);
        assertThat(record.getMetadata()).containsEntry("channel", "web");
        assertThat(record.getTimestamp()).isEqualTo(NOW);
        verify(eventPublisher).publishConversationLogged(record);
    }

    @Test
    void storageFaultIsSwallowed() {
        when(conversationLogRepository.save(any(ConversationLogEntity.class)))
                .thenThrow(new DataAccessResourceFailureException("database down"));

        logger(Optional.of(eventPublisher)).logConversation("u1", "hi", reply("Hello!", "greet"), null);

        verifyNoInteractions(eventPublisher);
        assertThat(metricsService.getCounterValue("conversations.logged")).isZero();
    }

    private ConversationLogger logger(Optional<EventPublisher> publisher) {
        return new ConversationLogger(contextCache, conversationLogRepository, publisher, metricsService,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static BotResponse reply(String text, String intent) {
        return BotResponse.builder()
                .text(text)
                .intent(intent)
                .source(ResponseSource.DEFAULT)
                .confidence(0.5)
                .build();
    }
}
