package com.demo.chatbot.service;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConversationContext;
import com.demo.chatbot.domain.NluFragment;
import com.demo.chatbot.domain.ReplyOption;
import com.demo.chatbot.domain.ResponseSource;
import com.demo.chatbot.infrastructure.NluBackendClient;
import com.demo.chatbot.infrastructure.NluBackendException;
import com.demo.chatbot.service.rules.RuleBasedResponder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes a message to the NLU backend when it is ready, or through the rule cascade when it is
 * not. Never throws: every failure ends in a fallback or an error reply.
 */
@Slf4j
@Service
public class BackendDispatcher {

    static final String FALLBACK_TEXT = "I'm sorry, I didn't quite understand that. "
            + "Could you please rephrase your question or choose from the options below?";
    static final String APOLOGY_TEXT =
            "I apologize, but I'm experiencing technical difficulties. Please try again.";

    private static final List<ReplyOption> FALLBACK_MENU = List.of(
            ReplyOption.of("Course Information", "/courses"),
            ReplyOption.of("Enrollment", "/enrollment"),
            ReplyOption.of("FAQ", "/faq"),
            ReplyOption.of("Human Agent", "/human_agent"));

    private final NluBackendClient nluBackendClient;
    private final RuleBasedResponder ruleBasedResponder;
    private final MetricsService metricsService;
    private final AtomicBoolean ready = new AtomicBoolean(false);

    public BackendDispatcher(NluBackendClient nluBackendClient,
                             RuleBasedResponder ruleBasedResponder,
                             MetricsService metricsService) {
        this.nluBackendClient = nluBackendClient;
        this.ruleBasedResponder = ruleBasedResponder;
        this.metricsService = metricsService;
    }

    /**
     * Probe the backend and pick the dispatch mode. Never fails startup.
     *
     * @return true if the backend is ready
     */
    public boolean initialize() {
        boolean healthy = probeQuietly();
        ready.set(healthy);
        if (healthy) {
            log.info("NLU backend ready, dispatching to {}", nluBackendClient.getBaseUrl());
        } else {
            log.warn("NLU backend unavailable, using rule-based fallback");
        }
        return healthy;
    }

    /**
     * Re-run the health probe and switch mode if the result changed.
     */
    public void reprobe() {
        boolean healthy = probeQuietly();
        boolean previous = ready.getAndSet(healthy);
        if (previous != healthy) {
            log.info("NLU backend mode changed: ready={}", healthy);
        }
    }

    public boolean isReady() {
        return ready.get();
    }

    public BotResponse dispatch(String message,
                                String senderId,
                                Map<String, Object> metadata,
                                ConversationContext context) {
        MetricsService.TimerSample timer = metricsService.startTimer();
        BotResponse reply;
        try {
            reply = ready.get()
                    ? callBackend(message, senderId, metadata)
                    : ruleBasedResponder.respond(message, senderId, context);
        } catch (Exception e) {
            log.error("Error dispatching message: senderId={}", senderId, e);
            metricsService.recordError("DISPATCH_FAILED", "BackendDispatcher");
            reply = BotResponse.error(APOLOGY_TEXT);
        }
        metricsService.recordDispatch(reply.getSource(), timer.stop());
        return reply;
    }

    private BotResponse callBackend(String message, String senderId, Map<String, Object> metadata) {
        List<NluFragment> fragments;
        try {
            fragments = nluBackendClient.send(message, senderId, metadata);
        } catch (NluBackendException e) {
            log.error("NLU backend call failed: senderId={}", senderId, e);
            return fallbackResponse();
        }
        if (fragments.isEmpty()) {
            log.debug("NLU backend returned no fragments: senderId={}", senderId);
            return fallbackResponse();
        }
        return merge(fragments);
    }

    /**
     * Join fragment texts with single spaces and concatenate their structured parts. A reply
     * without any text is answered with the fallback menu.
     */
    static BotResponse merge(List<NluFragment> fragments) {
        StringBuilder text = new StringBuilder();
        List<ReplyOption> buttons = new ArrayList<>();
        List<ReplyOption> quickReplies = new ArrayList<>();
        Map<String, Object> custom = new LinkedHashMap<>();

        for (NluFragment fragment : fragments) {
            if (fragment.getText() != null) {
                text.append(fragment.getText()).append(' ');
            }
            if (fragment.getButtons() != null) {
                buttons.addAll(fragment.getButtons());
            }
            if (fragment.getQuickReplies() != null) {
                quickReplies.addAll(fragment.getQuickReplies());
            }
            if (fragment.getCustom() != null) {
                custom.putAll(fragment.getCustom());
            }
        }

        String combined = text.toString().trim();
        if (combined.isEmpty()) {
            log.warn("NLU backend reply carried no text, answering with fallback");
            return fallbackResponse();
        }
        return BotResponse.builder()
                .text(combined)
                .buttons(buttons)
                .quickReplies(quickReplies)
                .custom(custom)
                .source(ResponseSource.RASA)
                .confidence(0.8)
                .build();
    }

    static BotResponse fallbackResponse() {
        return BotResponse.builder()
                .text(FALLBACK_TEXT)
                .quickReplies(FALLBACK_MENU)
                .source(ResponseSource.FALLBACK)
                .confidence(0.3)
                .build();
    }

    private boolean probeQuietly() {
        try {
            return nluBackendClient.probe();
        } catch (Exception e) {
            log.warn("NLU backend probe failed: {}", e.getMessage());
            return false;
        }
    }
}
