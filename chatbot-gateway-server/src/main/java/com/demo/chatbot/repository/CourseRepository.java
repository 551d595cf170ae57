package com.demo.chatbot.repository;

import com.demo.chatbot.domain.CourseEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CourseRepository extends JpaRepository<CourseEntity, Long> {

    List<CourseEntity> findTop5ByStatusOrderByIdAsc(String status);
}
