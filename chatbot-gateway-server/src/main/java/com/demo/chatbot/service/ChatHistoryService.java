package com.demo.chatbot.service;

import com.demo.chatbot.domain.ConversationLogEntity;
import com.demo.chatbot.infrastructure.ContextCache;
import com.demo.chatbot.repository.ConversationLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class ChatHistoryService {

    private final ConversationLogRepository conversationLogRepository;
    private final ContextCache contextCache;

    public ChatHistoryService(ConversationLogRepository conversationLogRepository,
                              ContextCache contextCache) {
        this.conversationLogRepository = conversationLogRepository;
        this.contextCache = contextCache;
    }

    /**
     * Latest 50 logged exchanges for a sender, newest first
     */
    public List<ConversationLogEntity> getHistory(String senderId) {
        List<ConversationLogEntity> history = conversationLogRepository.findTop50ByUserIdOrderByTimestampDesc(senderId);
        log.debug("Retrieved {} logged exchanges for sender {}", history.size(), senderId);
        return history;
    }

    /**
     * Delete the sender's logged exchanges and cached context
     *
     * @return number of log rows removed
     */
    public long clearHistory(String senderId) {
        long removed = conversationLogRepository.deleteByUserId(senderId);
        try {
            contextCache.delete(senderId);
        } catch (Exception e) {
            log.error("Error clearing context: senderId={}", senderId, e);
        }
        log.info("Cleared history for sender {}: rows={}", senderId, removed);
        return removed;
    }
}
