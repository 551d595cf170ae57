package com.demo.chatbot.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A chat message as received from either transport. Immutable once built.
 */
@Value
public class IncomingMessage {

    String text;
    String senderId;
    Map<String, Object> metadata;

    @Builder
    private IncomingMessage(String text, String senderId, Map<String, Object> metadata) {
        this.text = text;
        this.senderId = senderId != null && !senderId.isBlank() ? senderId : UUID.randomUUID().toString();
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    public static IncomingMessage of(String text, String senderId, Map<String, Object> metadata) {
        return new IncomingMessage(text, senderId, metadata);
    }
}
