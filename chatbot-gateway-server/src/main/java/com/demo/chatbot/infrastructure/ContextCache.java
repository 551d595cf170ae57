package com.demo.chatbot.infrastructure;

import com.demo.chatbot.domain.ConversationContext;

import java.util.Optional;

/**
 * Per-sender conversation context store with expiry.
 *
 * Implementations throw {@link ContextCacheException} on storage faults; callers decide whether
 * a fault is fatal.
 */
public interface ContextCache {

    Optional<ConversationContext> get(String senderId);

    /**
     * Overwrite the sender's context and restart its time-to-live.
     */
    void put(String senderId, ConversationContext context);

    void delete(String senderId);

    boolean isAvailable();
}
