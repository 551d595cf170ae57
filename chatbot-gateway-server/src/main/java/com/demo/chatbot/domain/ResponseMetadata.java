package com.demo.chatbot.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResponseMetadata {

    private Instant timestamp;
    private String language;
    private SentimentScores sentiment;

    @JsonProperty("user_id")
    private String userId;
}
