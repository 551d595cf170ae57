package com.demo.chatbot.config;

import com.demo.chatbot.domain.CourseEntity;
import com.demo.chatbot.domain.FaqEntity;
import com.demo.chatbot.repository.CourseRepository;
import com.demo.chatbot.repository.FaqRepository;
import com.demo.chatbot.service.FaqService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Seeds the FAQ and course tables on first start so the rule-based fallback has something to
 * answer with. Tables that already hold rows are left alone.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "chatbot.seed-default-data", havingValue = "true", matchIfMissing = true)
public class DefaultDataInitializer implements ApplicationRunner {

    private final FaqRepository faqRepository;
    private final CourseRepository courseRepository;
    private final FaqService faqService;

    public DefaultDataInitializer(FaqRepository faqRepository,
                                  CourseRepository courseRepository,
                                  FaqService faqService) {
        this.faqRepository = faqRepository;
        this.courseRepository = courseRepository;
        this.faqService = faqService;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            if (faqRepository.count() == 0) {
                faqRepository.saveAll(defaultFaqs());
                faqService.invalidate();
                log.info("Default FAQ data inserted");
            }
            if (courseRepository.count() == 0) {
                courseRepository.saveAll(defaultCourses());
                log.info("Default course data inserted");
            }
        } catch (Exception e) {
            log.error("Failed to initialize default data", e);
        }
    }

    static List<FaqEntity> defaultFaqs() {
        return List.of(
                faq("What courses do you offer?",
                        "We offer a wide range of courses including Computer Science, Data Science, Web Development, "
                                + "Mobile App Development, AI/ML, and Digital Marketing. Visit our course catalog for "
                                + "detailed information.",
                        "courses"),
                faq("How do I enroll in a course?",
                        "You can enroll in a course by visiting our website, selecting your desired course, and "
                                + "completing the registration process. You can also ask me to help you with the "
                                + "enrollment process.",
                        "enrollment"),
                faq("What are the payment options?",
                        "We accept various payment methods including credit cards, debit cards, PayPal, and bank "
                                + "transfers. We also offer installment plans for select courses.",
                        "payment"),
                faq("Do you provide certificates?",
                        "Yes, we provide industry-recognized certificates upon successful completion of courses. "
                                + "Our certificates are accredited and can be verified online.",
                        "certification"));
    }

    static List<CourseEntity> defaultCourses() {
        return List.of(
                CourseEntity.builder()
                        .courseCode("CS101")
                        .title("Introduction to Programming")
                        .duration("8 weeks")
                        .price(new BigDecimal("299.99"))
                        .level("beginner")
                        .status(CourseEntity.STATUS_ACTIVE)
                        .build(),
                CourseEntity.builder()
                        .courseCode("DS201")
                        .title("Data Science Fundamentals")
                        .duration("10 weeks")
                        .price(new BigDecimal("399.99"))
                        .level("intermediate")
                        .status(CourseEntity.STATUS_ACTIVE)
                        .build());
    }

    private static FaqEntity faq(String question, String answer, String category) {
        return FaqEntity.builder()
                .question(question)
                .answer(answer)
                .category(category)
                .language("en")
                .priority(1)
                .build();
    }
}
