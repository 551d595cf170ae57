package com.demo.chatbot.service.rules;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConversationContext;
import com.demo.chatbot.domain.CourseEntity;
import com.demo.chatbot.domain.ReplyOption;
import com.demo.chatbot.domain.ResponseSource;
import com.demo.chatbot.repository.CourseRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Lists up to five active courses when the message asks about courses.
 */
@Slf4j
@Component
@Order(4)
public class CourseQueryRule implements FallbackRule {

    static final KeywordMatcher COURSE_KEYWORDS =
            KeywordMatcher.of("course", "class", "program", "training", "learn", "study");

    static final String LIST_HEADER = "Here are our available courses:\n\n";
    static final String NO_COURSES = "We have many exciting courses available! Please visit our website "
            + "or contact us directly for the most up-to-date course information.";
    static final String COURSE_ERROR = "I'm having trouble accessing course information right now.";

    private static final List<ReplyOption> COURSE_MENU = List.of(
            ReplyOption.of("Enroll Now", "/enroll"),
            ReplyOption.of("More Details", "/course_details"),
            ReplyOption.of("Schedule", "/schedule"));

    private final CourseRepository courseRepository;

    public CourseQueryRule(CourseRepository courseRepository) {
        this.courseRepository = courseRepository;
    }

    @Override
    public String name() {
        return "course_query";
    }

    @Override
    public Optional<BotResponse> apply(String message, String senderId, ConversationContext context) {
        if (!COURSE_KEYWORDS.matches(message)) {
            return Optional.empty();
        }
        try {
            List<CourseEntity> courses = courseRepository.findTop5ByStatusOrderByIdAsc(CourseEntity.STATUS_ACTIVE);
            if (courses.isEmpty()) {
                return Optional.of(BotResponse.builder()
                        .text(NO_COURSES)
                        .source(ResponseSource.COURSE_QUERY)
                        .confidence(0.7)
                        .build());
            }
            return Optional.of(BotResponse.builder()
                    .text(render(courses))
                    .quickReplies(COURSE_MENU)
                    .source(ResponseSource.COURSE_QUERY)
                    .confidence(0.9)
                    .build());
        } catch (Exception e) {
            log.error("Error handling course query", e);
            return Optional.of(BotResponse.error(COURSE_ERROR));
        }
    }

    static String render(List<CourseEntity> courses) {
        StringBuilder text = new StringBuilder(LIST_HEADER);
        for (CourseEntity course : courses) {
            text.append("📚 **").append(course.getTitle()).append("** (").append(course.getCourseCode()).append(")\n")
                    .append("   Duration: ").append(course.getDuration()).append('\n')
                    .append("   Price: $").append(formatPrice(course.getPrice())).append('\n')
                    .append("   Level: ").append(titleCase(course.getLevel())).append("\n\n");
        }
        return text.toString();
    }

    private static String formatPrice(BigDecimal price) {
        return price != null ? price.toPlainString() : "-";
    }

    private static String titleCase(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String lower = value.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
