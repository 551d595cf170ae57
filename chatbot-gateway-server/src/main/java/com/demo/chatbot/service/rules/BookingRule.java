package com.demo.chatbot.service.rules;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConversationContext;
import com.demo.chatbot.service.BookingAssistant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Hands booking-flavoured messages to the {@link BookingAssistant}.
 */
@Slf4j
@Component
@Order(3)
public class BookingRule implements FallbackRule {

    static final KeywordMatcher BOOKING_KEYWORDS =
            KeywordMatcher.of("book", "reserve", "enroll", "register", "schedule", "appointment");

    static final String BOOKING_ERROR =
            "I'm having trouble with booking requests right now. Please try again later.";

    private final BookingAssistant bookingAssistant;

    public BookingRule(BookingAssistant bookingAssistant) {
        this.bookingAssistant = bookingAssistant;
    }

    @Override
    public String name() {
        return "booking";
    }

    @Override
    public Optional<BotResponse> apply(String message, String senderId, ConversationContext context) {
        if (!BOOKING_KEYWORDS.matches(message)) {
            return Optional.empty();
        }
        try {
            return Optional.of(bookingAssistant.handle(message, senderId, context));
        } catch (Exception e) {
            log.error("Error handling booking intent: senderId={}", senderId, e);
            return Optional.of(BotResponse.error(BOOKING_ERROR));
        }
    }
}
