package com.demo.chatbot.service.rules;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConversationContext;
import com.demo.chatbot.domain.ResponseSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedResponderTest {

    @Test
    void firstMatchingRuleWins() {
        AtomicInteger laterCalls = new AtomicInteger();
        RuleBasedResponder responder = new RuleBasedResponder(List.of(
                new GreetingRule(),
                rule("counting", (message) -> {
                    laterCalls.incrementAndGet();
                    return Optional.empty();
                })));

        BotResponse reply = responder.respond("Hey there", "u1", ConversationContext.empty());

        assertThat(reply.getSource()).isEqualTo(ResponseSource.GREETING);
        assertThat(reply.getText()).isEqualTo(GreetingRule.GREETING_TEXT);
        assertThat(laterCalls).hasValue(0);
    }

    @Test
    void noMatchGivesDefaultMenu() {
        RuleBasedResponder responder = new RuleBasedResponder(List.of(new GreetingRule()));

        BotResponse reply = responder.respond("I want pricing info", "u1", ConversationContext.empty());

        assertThat(reply.getSource()).isEqualTo(ResponseSource.DEFAULT);
        assertThat(reply.getConfidence()).isEqualTo(0.5);
        assertThat(reply.getText()).isEqualTo(RuleBasedResponder.DEFAULT_TEXT);
        assertThat(reply.getQuickReplies()).hasSize(4);
    }

    @Test
    void failingRuleYieldsErrorReply() {
        RuleBasedResponder responder = new RuleBasedResponder(List.of(
                rule("broken", (message) -> {
                    throw new IllegalStateException("rule exploded");
                })));

        BotResponse reply = responder.respond("anything", "u1", ConversationContext.empty());

        assertThat(reply.isError()).isTrue();
        assertThat(reply.getText()).isEqualTo(RuleBasedResponder.RULE_ERROR);
    }

    @Test
    void greetingMatchesCaseInsensitively() {
        assertThat(new GreetingRule().apply("GOOD MORNING team", "u1", ConversationContext.empty()))
                .hasValueSatisfying(reply -> assertThat(reply.getConfidence()).isEqualTo(1.0));
        assertThat(new GreetingRule().apply("enroll me", "u1", ConversationContext.empty())).isEmpty();
    }

    private static FallbackRule rule(String name, java.util.function.Function<String, Optional<BotResponse>> body) {
        return new FallbackRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<BotResponse> apply(String message, String senderId, ConversationContext context) {
                return body.apply(message);
            }
        };
    }
}
