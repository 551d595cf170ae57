package com.demo.chatbot.service.sentiment;

import lombok.Value;

import java.io.IOException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Averages per-word polarity in [-1, 1] and subjectivity in [0, 1] over the words found in the
 * lexicon. An intensifier multiplies the next word, a preceding negation halves and flips its
 * polarity.
 */
public class PolarityAnalyzer {

    public static final String DEFAULT_LEXICON = "sentiment/polarity-lexicon.tsv";

    private static final double NEGATION_SCALAR = -0.5;

    private static final Map<String, Double> INTENSIFIERS = Map.of(
            "very", 1.3,
            "really", 1.3,
            "extremely", 1.5,
            "so", 1.2,
            "super", 1.4,
            "quite", 1.1,
            "too", 1.2);
    private static final Set<String> NEGATIONS = Set.of(
            "not", "no", "never", "dont", "doesnt", "didnt", "isnt", "wasnt", "cant", "cannot", "wont");

    private final Map<String, Entry> lexicon;

    public PolarityAnalyzer(Map<String, Entry> lexicon) {
        this.lexicon = Map.copyOf(lexicon);
    }

    public static PolarityAnalyzer loadDefault() throws IOException {
        Map<String, Entry> lexicon = new HashMap<>();
        for (String[] row : LexiconLoader.readRows(DEFAULT_LEXICON, 3)) {
            lexicon.put(row[0].toLowerCase(Locale.ROOT),
                    new Entry(Double.parseDouble(row[1]), Double.parseDouble(row[2])));
        }
        return new PolarityAnalyzer(lexicon);
    }

    public PolarityScores score(String text) {
        if (text == null || text.isBlank()) {
            return PolarityScores.NONE;
        }
        String[] tokens = text.toLowerCase(Locale.ROOT).replace("'", "").split("[^\\p{L}\\p{N}]+");

        double polaritySum = 0.0;
        double subjectivitySum = 0.0;
        int matched = 0;
        for (int i = 0; i < tokens.length; i++) {
            Entry entry = lexicon.get(tokens[i]);
            if (entry == null) {
                continue;
            }
            double polarity = entry.getPolarity();
            double subjectivity = entry.getSubjectivity();
            if (i > 0 && INTENSIFIERS.containsKey(tokens[i - 1])) {
                double factor = INTENSIFIERS.get(tokens[i - 1]);
                polarity *= factor;
                subjectivity *= factor;
            }
            if ((i > 0 && NEGATIONS.contains(tokens[i - 1]))
                    || (i > 1 && NEGATIONS.contains(tokens[i - 2]))) {
                polarity *= NEGATION_SCALAR;
            }
            polaritySum += clamp(polarity, -1.0, 1.0);
            subjectivitySum += clamp(subjectivity, 0.0, 1.0);
            matched++;
        }

        if (matched == 0) {
            return PolarityScores.NONE;
        }
        return new PolarityScores(polaritySum / matched, subjectivitySum / matched);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    @Value
    public static class Entry {
        double polarity;
        double subjectivity;
    }

    @Value
    public static class PolarityScores {
        public static final PolarityScores NONE = new PolarityScores(0.0, 0.0);

        double polarity;
        double subjectivity;
    }
}
