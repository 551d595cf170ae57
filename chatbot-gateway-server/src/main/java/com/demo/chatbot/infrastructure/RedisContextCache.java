package com.demo.chatbot.infrastructure;

import com.demo.chatbot.domain.ConversationContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link ContextCache} backed by Redis string values holding the JSON form of the context.
 */
@Component
@Slf4j
public class RedisContextCache implements ContextCache {

    private static final String CONTEXT_KEY = "context:{senderId}";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisContextCache(StringRedisTemplate redisTemplate,
                             ObjectMapper objectMapper,
                             @Value("${chatbot.context.ttl-seconds:3600}") long ttlSeconds) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    @Override
    public Optional<ConversationContext> get(String senderId) {
        try {
            String json = redisTemplate.opsForValue().get(key(senderId));
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, ConversationContext.class));
        } catch (Exception e) {
            throw new ContextCacheException("Failed to read context for " + senderId, e);
        }
    }

    @Override
    public void put(String senderId, ConversationContext context) {
        try {
            String json = objectMapper.writeValueAsString(context);
            redisTemplate.opsForValue().set(key(senderId), json, ttl);
            log.debug("Cached context: senderId={}, messageCount={}", senderId, context.getMessageCount());
        } catch (Exception e) {
            throw new ContextCacheException("Failed to write context for " + senderId, e);
        }
    }

    @Override
    public void delete(String senderId) {
        try {
            redisTemplate.delete(key(senderId));
        } catch (Exception e) {
            throw new ContextCacheException("Failed to delete context for " + senderId, e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
            return "PONG".equalsIgnoreCase(pong);
        } catch (Exception e) {
            log.warn("Redis health check failed: {}", e.getMessage());
            return false;
        }
    }

    private static String key(String senderId) {
        return CONTEXT_KEY.replace("{senderId}", senderId);
    }
}
