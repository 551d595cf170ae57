package com.demo.chatbot.support;

import com.demo.chatbot.domain.ConversationContext;
import com.demo.chatbot.infrastructure.ContextCache;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryContextCache implements ContextCache {

    private final Map<String, ConversationContext> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<ConversationContext> get(String senderId) {
        return Optional.ofNullable(entries.get(senderId));
    }

    @Override
    public void put(String senderId, ConversationContext context) {
        entries.put(senderId, context);
    }

    @Override
    public void delete(String senderId) {
        entries.remove(senderId);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
