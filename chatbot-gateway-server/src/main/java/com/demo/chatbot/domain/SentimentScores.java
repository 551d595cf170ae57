package com.demo.chatbot.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Valence scores (compound/pos/neu/neg) plus the optional polarity/subjectivity pair.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SentimentScores {

    private double compound;
    private double pos;
    private double neu;
    private double neg;
    private Double polarity;
    private Double subjectivity;

    public static SentimentScores neutral() {
        return SentimentScores.builder()
                .compound(0.0)
                .pos(0.0)
                .neu(1.0)
                .neg(0.0)
                .build();
    }
}
