package com.demo.chatbot.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    private String message;

    @JsonProperty("sender_id")
    private String senderId;

    private Map<String, Object> metadata;

    public IncomingMessage toIncomingMessage() {
        return IncomingMessage.of(message, senderId, metadata);
    }
}
