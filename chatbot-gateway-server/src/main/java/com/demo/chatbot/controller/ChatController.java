package com.demo.chatbot.controller;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ChatRequest;
import com.demo.chatbot.domain.ChatResponse;
import com.demo.chatbot.domain.ConversationLogEntity;
import com.demo.chatbot.domain.IncomingMessage;
import com.demo.chatbot.service.ChatHistoryService;
import com.demo.chatbot.service.MessagePipeline;
import com.demo.chatbot.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * HTTP entry point for chat: same pipeline as the WebSocket, reply in the response body.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/chat")
@CrossOrigin(origins = "*")
public class ChatController {

    private final MessagePipeline messagePipeline;
    private final ChatHistoryService chatHistoryService;
    private final MetricsService metricsService;

    public ChatController(MessagePipeline messagePipeline,
                          ChatHistoryService chatHistoryService,
                          MetricsService metricsService) {
        this.messagePipeline = messagePipeline;
        this.chatHistoryService = chatHistoryService;
        this.metricsService = metricsService;
    }

    /**
     * Send chat message
     * POST /api/v1/chat/message
     */
    @PostMapping("/message")
    public ResponseEntity<?> sendMessage(@RequestBody(required = false) ChatRequest request) {
        if (request == null || request.getMessage() == null) {
            return ResponseEntity
                    .status(HttpStatus.BAD_REQUEST)
                    .body(Map.of(
                            "error", "Bad request",
                            "detail", "Field 'message' is required"
                    ));
        }

        try {
            IncomingMessage incoming = request.toIncomingMessage();
            metricsService.recordMessageReceived("http");
            log.info("Chat request: sender_id={}", incoming.getSenderId());

            BotResponse reply = messagePipeline.process(incoming);
            return ResponseEntity.ok(ChatResponse.from(incoming.getSenderId(), reply));

        } catch (Exception e) {
            log.error("Error processing chat request", e);
            metricsService.recordError("HTTP_CHAT_FAILED", "ChatController");
            return internalError(e);
        }
    }

    /**
     * Get chat history
     * GET /api/v1/chat/history/{senderId}
     */
    @GetMapping("/history/{senderId}")
    public ResponseEntity<?> getHistory(@PathVariable String senderId) {
        try {
            List<ConversationLogEntity> history = chatHistoryService.getHistory(senderId);
            return ResponseEntity.ok(Map.of(
                    "sender_id", senderId,
                    "history", history
            ));
        } catch (Exception e) {
            log.error("Error retrieving history: sender_id={}", senderId, e);
            return internalError(e);
        }
    }

    /**
     * Clear chat history
     * DELETE /api/v1/chat/history/{senderId}
     */
    @DeleteMapping("/history/{senderId}")
    public ResponseEntity<?> clearHistory(@PathVariable String senderId) {
        try {
            long deleted = chatHistoryService.clearHistory(senderId);
            return ResponseEntity.ok(Map.of(
                    "message", "Chat history cleared for " + senderId,
                    "deleted", deleted
            ));
        } catch (Exception e) {
            log.error("Error clearing history: sender_id={}", senderId, e);
            return internalError(e);
        }
    }

    static ResponseEntity<Map<String, Object>> internalError(Exception e) {
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of(
                        "error", "Internal server error",
                        "detail", String.valueOf(e.getMessage())
                ));
    }
}
