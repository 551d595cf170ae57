package com.demo.chatbot.service;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConversationContext;
import com.demo.chatbot.domain.ReplyOption;
import com.demo.chatbot.domain.ResponseMetadata;
import com.demo.chatbot.domain.SentimentScores;
import com.demo.chatbot.service.rules.KeywordMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a dispatcher reply into the reply the user sees: metadata, personal greeting, default
 * quick replies, suggestions and the escalation offer for clearly negative messages.
 */
@Slf4j
@Service
public class ResponseEnricher {

    static final int MAX_QUICK_REPLIES = 4;
    static final int MAX_SUGGESTIONS = 3;
    static final double ESCALATION_THRESHOLD = -0.5;
    static final String ESCALATION_TEXT =
            "\n\nI understand this might be frustrating. Would you like me to connect you with a human agent?";

    private static final KeywordMatcher COURSE_TERMS = KeywordMatcher.of("course");
    private static final KeywordMatcher PRICE_TERMS = KeywordMatcher.of("price", "pricing", "cost");

    private static final List<String> COURSE_SUGGESTIONS = List.of(
            "Browse our complete course catalog",
            "Check course prerequisites",
            "View course schedules");
    private static final List<String> PRICE_SUGGESTIONS = List.of(
            "View payment plans",
            "Check for discounts",
            "Compare course prices");

    private final Clock clock;

    @Autowired
    public ResponseEnricher() {
        this(Clock.systemUTC());
    }

    ResponseEnricher(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param message the trimmed user message the reply answers
     * @return the enriched reply, or {@code base} unchanged if enrichment fails
     */
    public BotResponse enrich(BotResponse base,
                              String message,
                              String senderId,
                              String language,
                              SentimentScores sentiment,
                              ConversationContext context) {
        try {
            SentimentScores scores = sentiment != null ? sentiment : SentimentScores.neutral();
            BotResponse.BotResponseBuilder enriched = base.toBuilder()
                    .metadata(ResponseMetadata.builder()
                            .timestamp(clock.instant())
                            .language(language)
                            .sentiment(scores)
                            .userId(senderId)
                            .build());

            String text = personalize(base.getText(), context);

            if (base.getQuickReplies().isEmpty()) {
                enriched.quickReplies(defaultQuickReplies(base.getText()));
            }

            enriched.suggestions(suggestionsFor(message));

            if (scores.getCompound() < ESCALATION_THRESHOLD && !Boolean.TRUE.equals(base.getEscalationSuggested())) {
                text = text + ESCALATION_TEXT;
                enriched.escalationSuggested(true);
            }

            return enriched.text(text).build();
        } catch (Exception e) {
            log.error("Error enhancing response: senderId={}", senderId, e);
            return base;
        }
    }

    private static String personalize(String text, ConversationContext context) {
        String userName = context != null ? context.getUserName() : null;
        if (userName == null || userName.isBlank()) {
            return text;
        }
        String greeting = "Hi " + userName + ", ";
        return text.startsWith(greeting) ? text : greeting + text;
    }

    static List<ReplyOption> defaultQuickReplies(String responseText) {
        List<ReplyOption> replies = new ArrayList<>();
        replies.add(ReplyOption.of("Help", "/help"));
        replies.add(ReplyOption.of("More Info", "/more_info"));
        if (COURSE_TERMS.matches(responseText)) {
            replies.add(ReplyOption.of("Enroll", "/enroll"));
        }
        if (PRICE_TERMS.matches(responseText)) {
            replies.add(ReplyOption.of("Payment Options", "/payment"));
        }
        return replies.size() > MAX_QUICK_REPLIES ? replies.subList(0, MAX_QUICK_REPLIES) : replies;
    }

    static List<String> suggestionsFor(String message) {
        List<String> suggestions = new ArrayList<>();
        if (COURSE_TERMS.matches(message)) {
            suggestions.addAll(COURSE_SUGGESTIONS);
        }
        if (PRICE_TERMS.matches(message)) {
            suggestions.addAll(PRICE_SUGGESTIONS);
        }
        return suggestions.size() > MAX_SUGGESTIONS ? suggestions.subList(0, MAX_SUGGESTIONS) : suggestions;
    }
}
