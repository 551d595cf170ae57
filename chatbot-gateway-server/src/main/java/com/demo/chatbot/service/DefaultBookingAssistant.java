package com.demo.chatbot.service;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConversationContext;
import com.demo.chatbot.domain.CourseEntity;
import com.demo.chatbot.domain.ReplyOption;
import com.demo.chatbot.domain.ResponseSource;
import com.demo.chatbot.repository.CourseRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Offers one enroll button per active course, or a generic enrollment menu when there are none.
 */
@Slf4j
@Service
public class DefaultBookingAssistant implements BookingAssistant {

    static final String ENROLL_PROMPT = "I can help you enroll! Which course are you interested in?";
    static final String NO_COURSES_PROMPT = "I can help you with enrollment. Tell me which course you'd "
            + "like to join, or browse our catalog first.";

    private final CourseRepository courseRepository;

    public DefaultBookingAssistant(CourseRepository courseRepository) {
        this.courseRepository = courseRepository;
    }

    @Override
    public BotResponse handle(String message, String senderId, ConversationContext context) {
        List<CourseEntity> courses = courseRepository.findTop5ByStatusOrderByIdAsc(CourseEntity.STATUS_ACTIVE);
        log.debug("Booking request: senderId={}, activeCourses={}", senderId, courses.size());

        if (courses.isEmpty()) {
            return BotResponse.builder()
                    .text(NO_COURSES_PROMPT)
                    .quickReplies(List.of(
                            ReplyOption.of("Browse Courses", "/browse_courses"),
                            ReplyOption.of("Contact Support", "/contact_support")))
                    .source(ResponseSource.BOOKING)
                    .confidence(0.6)
                    .intent("book_course")
                    .build();
        }

        List<ReplyOption> buttons = new ArrayList<>();
        for (CourseEntity course : courses) {
            buttons.add(ReplyOption.of(
                    "Enroll in " + course.getCourseCode(),
                    "/enroll{\"course_code\":\"" + course.getCourseCode() + "\"}"));
        }
        return BotResponse.builder()
                .text(ENROLL_PROMPT)
                .buttons(buttons)
                .source(ResponseSource.BOOKING)
                .confidence(0.8)
                .intent("book_course")
                .build();
    }
}
