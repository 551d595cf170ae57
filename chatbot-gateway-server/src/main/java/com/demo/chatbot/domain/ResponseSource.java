package com.demo.chatbot.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Origin of a bot reply. Serialized in lower case ("rasa", "course_query", ...).
 */
public enum ResponseSource {
    RASA,
    GREETING,
    FALLBACK,
    DEFAULT,
    FAQ,
    COURSE_QUERY,
    BOOKING,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResponseSource fromWireName(String value) {
        return ResponseSource.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
