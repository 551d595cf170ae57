package com.demo.chatbot.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Server-to-client WebSocket frame. Every frame carries {@code type} and {@code timestamp}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutboundFrame {

    private FrameType type;
    private String message;

    @JsonProperty("message_type")
    private String messageType;

    @JsonProperty("is_typing")
    private Boolean typing;

    private String text;
    private List<ReplyOption> buttons;

    @JsonProperty("quick_replies")
    private List<ReplyOption> quickReplies;

    private List<String> suggestions;
    private Map<String, Object> custom;
    private ResponseMetadata metadata;
    private ResponseSource source;
    private Double confidence;

    @JsonProperty("escalation_suggested")
    private Boolean escalationSuggested;

    private String room;
    private String sender;
    private Instant timestamp;

    public enum FrameType {
        SYSTEM,
        TYPING,
        BOT_RESPONSE,
        ERROR,
        ROOM_MESSAGE,
        PONG;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    // Factory methods

    public static OutboundFrame system(String message) {
        return system(message, null);
    }

    public static OutboundFrame system(String message, String messageType) {
        return OutboundFrame.builder()
                .type(FrameType.SYSTEM)
                .message(message)
                .messageType(messageType)
                .timestamp(Instant.now())
                .build();
    }

    public static OutboundFrame typing(boolean isTyping) {
        return OutboundFrame.builder()
                .type(FrameType.TYPING)
                .typing(isTyping)
                .timestamp(Instant.now())
                .build();
    }

    public static OutboundFrame error(String errorMessage) {
        return OutboundFrame.builder()
                .type(FrameType.ERROR)
                .message(errorMessage)
                .timestamp(Instant.now())
                .build();
    }

    public static OutboundFrame botResponse(BotResponse response) {
        return OutboundFrame.builder()
                .type(FrameType.BOT_RESPONSE)
                .text(response.getText())
                .buttons(response.getButtons())
                .quickReplies(response.getQuickReplies())
                .suggestions(response.getSuggestions())
                .custom(response.getCustom().isEmpty() ? null : response.getCustom())
                .metadata(response.getMetadata())
                .source(response.getSource())
                .confidence(response.getConfidence())
                .escalationSuggested(response.getEscalationSuggested())
                .timestamp(Instant.now())
                .build();
    }

    public static OutboundFrame roomMessage(String room, String sender, String message) {
        return OutboundFrame.builder()
                .type(FrameType.ROOM_MESSAGE)
                .room(room)
                .sender(sender)
                .message(message)
                .timestamp(Instant.now())
                .build();
    }

    public static OutboundFrame pong() {
        return OutboundFrame.builder()
                .type(FrameType.PONG)
                .timestamp(Instant.now())
                .build();
    }
}
