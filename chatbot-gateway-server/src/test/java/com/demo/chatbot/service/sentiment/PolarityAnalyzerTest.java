package com.demo.chatbot.service.sentiment;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PolarityAnalyzerTest {

    private final PolarityAnalyzer analyzer = new PolarityAnalyzer(Map.of(
            "good", new PolarityAnalyzer.Entry(0.7, 0.6),
            "bad", new PolarityAnalyzer.Entry(-0.7, 0.67)));

    @Test
    void averagesMatchedWords() {
        PolarityAnalyzer.PolarityScores scores = analyzer.score("good teachers, bad schedule");

        assertThat(scores.getPolarity()).isCloseTo(0.0, within(1e-9));
        assertThat(scores.getSubjectivity()).isCloseTo(0.635, within(1e-9));
    }

    @Test
    void intensifierAndNegationApply() {
        assertThat(analyzer.score("very good").getPolarity()).isCloseTo(0.91, within(1e-9));
        assertThat(analyzer.score("not good").getPolarity()).isCloseTo(-0.35, within(1e-9));
    }

    @Test
    void noKnownWordsGivesNone() {
        assertThat(analyzer.score("schedule for tomorrow")).isEqualTo(PolarityAnalyzer.PolarityScores.NONE);
    }
}
