package com.demo.chatbot.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reply produced by the dispatch pipeline.
 *
 * Instances are validated on construction: confidence must lie in [0, 1] and the text must be
 * non-blank for every source except {@link ResponseSource#ERROR}. Use {@link #toBuilder()} to derive
 * an enriched copy.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BotResponse {

    String text;
    List<ReplyOption> buttons;

    @JsonProperty("quick_replies")
    List<ReplyOption> quickReplies;

    Map<String, Object> custom;
    List<String> suggestions;
    ResponseSource source;
    double confidence;
    String intent;
    List<Map<String, Object>> entities;
    ResponseMetadata metadata;

    @JsonProperty("escalation_suggested")
    Boolean escalationSuggested;

    @JsonProperty("faq_id")
    String faqId;

    @Builder(toBuilder = true)
    private BotResponse(String text,
                        List<ReplyOption> buttons,
                        List<ReplyOption> quickReplies,
                        Map<String, Object> custom,
                        List<String> suggestions,
                        ResponseSource source,
                        double confidence,
                        String intent,
                        List<Map<String, Object>> entities,
                        ResponseMetadata metadata,
                        Boolean escalationSuggested,
                        String faqId) {
        if (source == null) {
            throw new IllegalArgumentException("Response source is required");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of range: " + confidence);
        }
        if (source != ResponseSource.ERROR && (text == null || text.isBlank())) {
            throw new IllegalArgumentException("Text is required for source " + source.wireName());
        }
        this.text = text != null ? text : "";
        this.buttons = buttons != null ? List.copyOf(buttons) : List.of();
        this.quickReplies = quickReplies != null ? List.copyOf(quickReplies) : List.of();
        this.custom = custom != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(custom))
                : Map.of();
        this.suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
        this.source = source;
        this.confidence = confidence;
        this.intent = intent;
        this.entities = entities != null ? List.copyOf(entities) : List.of();
        this.metadata = metadata;
        this.escalationSuggested = escalationSuggested;
        this.faqId = faqId;
    }

    public static BotResponse error(String text) {
        return BotResponse.builder()
                .text(text)
                .source(ResponseSource.ERROR)
                .confidence(0.0)
                .build();
    }

    @JsonIgnore
    public boolean isError() {
        return source == ResponseSource.ERROR;
    }
}
