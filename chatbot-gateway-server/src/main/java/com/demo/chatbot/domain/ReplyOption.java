package com.demo.chatbot.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A button or quick reply: label shown to the user plus the payload sent back when chosen.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReplyOption {

    private String title;
    private String payload;

    public static ReplyOption of(String title, String payload) {
        return new ReplyOption(title, payload);
    }
}
