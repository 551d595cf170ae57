package com.demo.chatbot.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /api/v1/chat/message}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    static final String RECIPIENT = "chatbot";
    static final String UNDERSTOOD_NOTHING = "I'm sorry, I didn't understand that.";

    private String response;

    @JsonProperty("sender_id")
    private String senderId;

    @JsonProperty("recipient_id")
    private String recipientId;

    private Instant timestamp;
    private Double confidence;
    private String intent;
    private List<Map<String, Object>> entities;

    public static ChatResponse from(String senderId, BotResponse reply) {
        String text = reply.getText();
        return ChatResponse.builder()
                .response(text == null || text.isEmpty() ? UNDERSTOOD_NOTHING : text)
                .senderId(senderId)
                .recipientId(RECIPIENT)
                .timestamp(Instant.now())
                .confidence(reply.getConfidence())
                .intent(reply.getIntent())
                .entities(reply.getEntities())
                .build();
    }
}
