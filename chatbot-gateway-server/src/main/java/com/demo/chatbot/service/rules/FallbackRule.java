package com.demo.chatbot.service.rules;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConversationContext;

import java.util.Optional;

/**
 * One step of the degraded-mode cascade. Rules run in a fixed order and the first one that
 * returns a reply wins.
 */
public interface FallbackRule {

    String name();

    /**
     * @param message trimmed user text
     * @return the reply, or empty to let the next rule try
     */
    Optional<BotResponse> apply(String message, String senderId, ConversationContext context);
}
