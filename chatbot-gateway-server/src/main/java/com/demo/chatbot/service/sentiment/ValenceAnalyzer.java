package com.demo.chatbot.service.sentiment;

import com.vader.sentiment.analyzer.SentimentAnalyzer;
import lombok.Value;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Valence scores from the VADER analyzer: a compound score in [-1, 1] plus the positive, neutral
 * and negative proportions of the text.
 */
public class ValenceAnalyzer {

    private static final String COMPOUND = "compound";
    private static final String POSITIVE = "positive";
    private static final String NEUTRAL = "neutral";
    private static final String NEGATIVE = "negative";

    public ValenceScores score(String text) {
        if (text == null || text.isBlank()) {
            return ValenceScores.NEUTRAL;
        }
        Map<String, Float> polarity;
        try {
            SentimentAnalyzer analyzer = new SentimentAnalyzer(text);
            analyzer.analyze();
            polarity = analyzer.getPolarity();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load VADER lexicon", e);
        }
        if (polarity == null || polarity.isEmpty()) {
            return ValenceScores.NEUTRAL;
        }
        return new ValenceScores(
                round(polarity.getOrDefault(COMPOUND, 0f)),
                round(polarity.getOrDefault(POSITIVE, 0f)),
                round(polarity.getOrDefault(NEUTRAL, 1f)),
                round(polarity.getOrDefault(NEGATIVE, 0f)));
    }

    private static double round(float value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    @Value
    public static class ValenceScores {
        public static final ValenceScores NEUTRAL = new ValenceScores(0.0, 0.0, 1.0, 0.0);

        double compound;
        double pos;
        double neu;
        double neg;
    }
}
