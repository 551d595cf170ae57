package com.demo.chatbot.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Short-lived per-sender conversation state, cached as JSON under {@code context:{sender_id}}.
 * Keys this class does not model are kept in {@link #attributes} so a rewrite never drops them.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationContext {

    @JsonProperty("last_message")
    private String lastMessage;

    @JsonProperty("last_response")
    private String lastResponse;

    @JsonProperty("last_intent")
    private String lastIntent;

    @JsonProperty("message_count")
    private long messageCount;

    @JsonProperty("last_updated")
    private Instant lastUpdated;

    @JsonProperty("user_name")
    private String userName;

    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    public static ConversationContext empty() {
        return new ConversationContext();
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @JsonAnySetter
    public void setAttribute(String key, Object value) {
        if (attributes == null) {
            attributes = new LinkedHashMap<>();
        }
        attributes.put(key, value);
    }

    /**
     * Context after one more processed exchange. The receiver is left untouched.
     */
    public ConversationContext advance(String message, String responseText, String intent, Instant now) {
        return toBuilder()
                .lastMessage(message)
                .lastResponse(responseText != null ? responseText : "")
                .lastIntent(intent != null ? intent : "unknown")
                .messageCount(messageCount + 1)
                .lastUpdated(now)
                .attributes(attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>())
                .build();
    }
}
