package com.demo.chatbot.service.rules;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConversationContext;
import com.demo.chatbot.domain.ReplyOption;
import com.demo.chatbot.domain.ResponseSource;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@Order(1)
public class GreetingRule implements FallbackRule {

    static final KeywordMatcher GREETINGS =
            KeywordMatcher.of("hello", "hi", "hey", "good morning", "good afternoon", "good evening");

    static final String GREETING_TEXT = "Hello! Welcome to our Education Support Assistant. "
            + "I'm here to help you with course information, enrollments, and answer any questions "
            + "you might have. How can I assist you today?";

    private static final List<ReplyOption> GREETING_MENU = List.of(
            ReplyOption.of("Browse Courses", "/browse_courses"),
            ReplyOption.of("Enrollment Help", "/enrollment_help"),
            ReplyOption.of("FAQ", "/faq"),
            ReplyOption.of("Contact Support", "/contact_support"));

    @Override
    public String name() {
        return "greeting";
    }

    @Override
    public Optional<BotResponse> apply(String message, String senderId, ConversationContext context) {
        if (!GREETINGS.matches(message)) {
            return Optional.empty();
        }
        return Optional.of(BotResponse.builder()
                .text(GREETING_TEXT)
                .quickReplies(GREETING_MENU)
                .source(ResponseSource.GREETING)
                .confidence(1.0)
                .build());
    }
}
