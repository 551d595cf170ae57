package com.demo.chatbot.service.rules;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConversationContext;
import com.demo.chatbot.domain.FaqEntity;
import com.demo.chatbot.domain.ResponseSource;
import com.demo.chatbot.service.FaqService;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(2)
public class FaqRule implements FallbackRule {

    static final String NO_ANSWER = "I don't have an answer for that question.";

    private final FaqService faqService;

    public FaqRule(FaqService faqService) {
        this.faqService = faqService;
    }

    @Override
    public String name() {
        return "faq";
    }

    @Override
    public Optional<BotResponse> apply(String message, String senderId, ConversationContext context) {
        return faqService.findBestMatch(message).map(FaqRule::toResponse);
    }

    private static BotResponse toResponse(FaqEntity faq) {
        String answer = faq.getAnswer();
        return BotResponse.builder()
                .text(answer != null && !answer.isBlank() ? answer : NO_ANSWER)
                .source(ResponseSource.FAQ)
                .confidence(0.85)
                .faqId(faq.getId() != null ? String.valueOf(faq.getId()) : "")
                .build();
    }
}
