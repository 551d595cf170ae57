package com.demo.chatbot.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * One logged exchange: what the user said and what the bot answered.
 */
@Entity
@Table(
    name = "messages",
    indexes = {
        @Index(name = "idx_messages_user_id", columnList = "user_id"),
        @Index(name = "idx_messages_timestamp", columnList = "timestamp"),
        @Index(name = "idx_messages_intent", columnList = "intent")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false, length = 255)
    @JsonProperty("user_id")
    private String userId;

    @Column(name = "user_message", columnDefinition = "TEXT")
    @JsonProperty("user_message")
    private String userMessage;

    @Column(name = "bot_response", columnDefinition = "TEXT")
    @JsonProperty("bot_response")
    private String botResponse;

    @Column(name = "intent", length = 100)
    private String intent;

    @Column(name = "confidence")
    private double confidence;

    @Column(name = "source", length = 50)
    private String source;

    @Column(name = "timestamp", nullable = false)
    private Instant timestamp;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    private Map<String, Object> metadata;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "sentiment", columnDefinition = "jsonb")
    private SentimentScores sentiment;

    @Column(name = "language", length = 10)
    private String language;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
