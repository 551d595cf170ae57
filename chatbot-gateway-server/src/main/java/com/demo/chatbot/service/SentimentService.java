package com.demo.chatbot.service;

import com.demo.chatbot.domain.SentimentScores;
import com.demo.chatbot.service.sentiment.PolarityAnalyzer;
import com.demo.chatbot.service.sentiment.ValenceAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Scores a user message with the VADER valence analyzer and the lexicon polarity analyzer. Disabled or
 * failing analysis yields {@link SentimentScores#neutral()}.
 */
@Slf4j
@Service
public class SentimentService {

    private final boolean enabled;
    private final ValenceAnalyzer valenceAnalyzer;
    private final PolarityAnalyzer polarityAnalyzer;

    @Autowired
    public SentimentService(@Value("${chatbot.nlp.sentiment-enabled:true}") boolean enabled) {
        this.enabled = enabled;
        ValenceAnalyzer valence = null;
        PolarityAnalyzer polarity = null;
        if (enabled) {
            try {
                valence = new ValenceAnalyzer();
                polarity = PolarityAnalyzer.loadDefault();
            } catch (IOException | RuntimeException e) {
                log.error("Failed to load sentiment analyzers, analysis disabled", e);
                valence = null;
                polarity = null;
            }
        }
        this.valenceAnalyzer = valence;
        this.polarityAnalyzer = polarity;
    }

    SentimentService(boolean enabled, ValenceAnalyzer valenceAnalyzer, PolarityAnalyzer polarityAnalyzer) {
        this.enabled = enabled;
        this.valenceAnalyzer = valenceAnalyzer;
        this.polarityAnalyzer = polarityAnalyzer;
    }

    public SentimentScores analyze(String text) {
        if (!enabled || valenceAnalyzer == null || polarityAnalyzer == null) {
            return SentimentScores.neutral();
        }
        try {
            ValenceAnalyzer.ValenceScores valence = valenceAnalyzer.score(text);
            PolarityAnalyzer.PolarityScores polarity = polarityAnalyzer.score(text);
            return SentimentScores.builder()
                    .compound(valence.getCompound())
                    .pos(valence.getPos())
                    .neu(valence.getNeu())
                    .neg(valence.getNeg())
                    .polarity(polarity.getPolarity())
                    .subjectivity(polarity.getSubjectivity())
                    .build();
        } catch (Exception e) {
            log.error("Error in sentiment analysis", e);
            return SentimentScores.neutral();
        }
    }
}
