package com.demo.chatbot.repository;

import com.demo.chatbot.domain.FaqEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FaqRepository extends JpaRepository<FaqEntity, Long> {

    List<FaqEntity> findByLanguageOrderByPriorityAsc(String language);
}
