package com.demo.chatbot.service;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConversationContext;

/**
 * Answers booking and enrollment requests while the NLU backend is unavailable.
 */
public interface BookingAssistant {

    BotResponse handle(String message, String senderId, ConversationContext context);
}
