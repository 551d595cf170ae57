package com.demo.chatbot.service;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConversationContext;
import com.demo.chatbot.domain.NluFragment;
import com.demo.chatbot.domain.ReplyOption;
import com.demo.chatbot.domain.ResponseSource;
import com.demo.chatbot.infrastructure.NluBackendClient;
import com.demo.chatbot.infrastructure.NluBackendException;
import com.demo.chatbot.repository.CourseRepository;
import com.demo.chatbot.service.rules.BookingRule;
import com.demo.chatbot.service.rules.CourseQueryRule;
import com.demo.chatbot.service.rules.FaqRule;
import com.demo.chatbot.service.rules.GreetingRule;
import com.demo.chatbot.service.rules.RuleBasedResponder;
import io.micrometer.core.instrument.Tags;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackendDispatcherTest {

    @Mock
    private NluBackendClient nluBackendClient;

    @Mock
    private FaqService faqService;

    @Mock
    private CourseRepository courseRepository;

    private MetricsService metricsService;
    private BackendDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        metricsService = new MetricsService();
        RuleBasedResponder responder = new RuleBasedResponder(List.of(
                new GreetingRule(),
                new FaqRule(faqService),
                new BookingRule(new DefaultBookingAssistant(courseRepository)),
                new CourseQueryRule(courseRepository)));
        dispatcher = new BackendDispatcher(nluBackendClient, responder, metricsService);
    }

    @Test
    void degradedModeAnswersGreetingFromRules() {
        when(nluBackendClient.probe()).thenReturn(false);
        assertThat(dispatcher.initialize()).isFalse();

        BotResponse reply = dispatcher.dispatch("hello", "u1", Map.of(), ConversationContext.empty());

        assertThat(reply.getSource()).isEqualTo(ResponseSource.GREETING);
        assertThat(reply.getConfidence()).isEqualTo(1.0);
        assertThat(reply.getQuickReplies()).hasSize(4);
        verify(nluBackendClient, never()).send(anyString(), anyString(), anyMap());
    }

    @Test
    void degradedModeRoutesEnrollmentToBookingAssistant() {
        BotResponse reply = dispatcher.dispatch("enroll me", "u1", Map.of(), ConversationContext.empty());

        assertThat(reply.getSource()).isEqualTo(ResponseSource.BOOKING);
        assertThat(reply.getIntent()).isEqualTo("book_course");
        assertThat(reply.getText()).isEqualTo(DefaultBookingAssistant.NO_COURSES_PROMPT);
        assertThat(metricsService.getCounterValue("dispatch.responses", Tags.of("source", "booking"))).isEqualTo(1);
    }

    @Test
    void readyBackendRepliesAreMerged() {
        when(nluBackendClient.probe()).thenReturn(true);
        dispatcher.initialize();
        when(nluBackendClient.send(eq("what is CS101?"), eq("u1"), any())).thenReturn(List.of(
                NluFragment.builder().text("CS101 is our intro course.").build(),
                NluFragment.builder()
                        .text("Want to enroll?")
                        .buttons(List.of(ReplyOption.of("Yes", "/affirm")))
                        .build()));

        BotResponse reply = dispatcher.dispatch("what is CS101?", "u1", Map.of(), ConversationContext.empty());

        assertThat(reply.getSource()).isEqualTo(ResponseSource.RASA);
        assertThat(reply.getConfidence()).isEqualTo(0.8);
        assertThat(reply.getText()).isEqualTo("CS101 is our intro course. Want to enroll?");
        assertThat(reply.getButtons()).extracting(ReplyOption::getPayload).containsExactly("/affirm");
    }

    @Test
    void emptyBackendReplyFallsBack() {
        when(nluBackendClient.probe()).thenReturn(true);
        dispatcher.initialize();
        when(nluBackendClient.send(anyString(), anyString(), any())).thenReturn(List.of());

        BotResponse reply = dispatcher.dispatch("hmm", "u1", Map.of(), ConversationContext.empty());

        assertThat(reply.getSource()).isEqualTo(ResponseSource.FALLBACK);
        assertThat(reply.getConfidence()).isEqualTo(0.3);
        assertThat(reply.getText()).isEqualTo(BackendDispatcher.FALLBACK_TEXT);
        assertThat(metricsService.getCounterValue("dispatch.fallbacks")).isEqualTo(1);
    }

    @Test
    void backendFailureFallsBackWithoutSwitchingMode() {
        when(nluBackendClient.probe()).thenReturn(true);
        dispatcher.initialize();
        when(nluBackendClient.send(anyString(), anyString(), any()))
                .thenThrow(new NluBackendException("NLU backend timed out"));

        BotResponse reply = dispatcher.dispatch("hello", "u1", Map.of(), ConversationContext.empty());

        assertThat(reply.getSource()).isEqualTo(ResponseSource.FALLBACK);
        assertThat(dispatcher.isReady()).isTrue();
    }

    @Test
    void probeExceptionMeansDegraded() {
        when(nluBackendClient.probe()).thenThrow(new IllegalStateException("connection refused"));

        assertThat(dispatcher.initialize()).isFalse();
        assertThat(dispatcher.isReady()).isFalse();
    }

    @Test
    void reprobeSwitchesMode() {
        when(nluBackendClient.probe()).thenReturn(false, true);
        dispatcher.initialize();

        dispatcher.reprobe();

        assertThat(dispatcher.isReady()).isTrue();
    }

    @Test
    void textlessBackendReplyUsesFallbackMenu() {
        BotResponse merged = BackendDispatcher.merge(List.of(
                NluFragment.builder().custom(Map.of("widget", "calendar")).build()));

        assertThat(merged.getSource()).isEqualTo(ResponseSource.FALLBACK);
        assertThat(merged.getQuickReplies()).extracting(ReplyOption::getTitle)
                .containsExactly("Course Information", "Enrollment", "FAQ", "Human Agent");
    }
}
