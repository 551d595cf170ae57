package com.demo.chatbot.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One element of the list returned by the NLU REST webhook.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NluFragment {

    private String text;
    private List<ReplyOption> buttons;

    @JsonProperty("quick_replies")
    private List<ReplyOption> quickReplies;

    private Map<String, Object> custom;
}
