package com.demo.chatbot.repository;

import com.demo.chatbot.domain.ConversationLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface ConversationLogRepository extends JpaRepository<ConversationLogEntity, String> {

    /**
     * Latest 50 exchanges for a user, newest first
     */
    List<ConversationLogEntity> findTop50ByUserIdOrderByTimestampDesc(String userId);

    @Modifying
    @Transactional
    long deleteByUserId(String userId);
}
