package com.demo.chatbot.service.rules;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConversationContext;
import com.demo.chatbot.domain.ReplyOption;
import com.demo.chatbot.domain.ResponseSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Degraded-mode responder: runs the {@link FallbackRule}s in order and falls back to a default
 * menu when none matches.
 */
@Slf4j
@Component
public class RuleBasedResponder {

    static final String DEFAULT_TEXT = "I'm here to help! You can ask me about courses, enrollment, "
            + "schedules, fees, or any other questions related to our educational programs.";
    static final String RULE_ERROR = "I'm having trouble understanding. Could you please rephrase?";

    private static final List<ReplyOption> DEFAULT_MENU = List.of(
            ReplyOption.of("Course Catalog", "/courses"),
            ReplyOption.of("Enrollment Process", "/enrollment"),
            ReplyOption.of("Pricing", "/pricing"),
            ReplyOption.of("Support", "/support"));

    private final List<FallbackRule> rules;

    /**
     * @param rules evaluated in list order; Spring supplies them sorted by {@code @Order}
     */
    public RuleBasedResponder(List<FallbackRule> rules) {
        this.rules = List.copyOf(rules);
        log.info("Fallback cascade: {}", this.rules.stream().map(FallbackRule::name).toList());
    }

    public BotResponse respond(String message, String senderId, ConversationContext context) {
        try {
            for (FallbackRule rule : rules) {
                Optional<BotResponse> reply = rule.apply(message, senderId, context);
                if (reply.isPresent()) {
                    log.debug("Fallback rule matched: rule={}, senderId={}", rule.name(), senderId);
                    return reply.get();
                }
            }
            return defaultResponse();
        } catch (Exception e) {
            log.error("Error in fallback processing: senderId={}", senderId, e);
            return BotResponse.error(RULE_ERROR);
        }
    }

    static BotResponse defaultResponse() {
        return BotResponse.builder()
                .text(DEFAULT_TEXT)
                .quickReplies(DEFAULT_MENU)
                .source(ResponseSource.DEFAULT)
                .confidence(0.5)
                .build();
    }
}
