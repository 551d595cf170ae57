package com.demo.chatbot.service.rules;

import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring match against a fixed keyword list.
 */
public final class KeywordMatcher {

    private final List<String> keywords;

    private KeywordMatcher(List<String> keywords) {
        this.keywords = keywords.stream()
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .toList();
    }

    public static KeywordMatcher of(String... keywords) {
        return new KeywordMatcher(List.of(keywords));
    }

    public boolean matches(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
