package com.demo.chatbot.controller;

import com.demo.chatbot.domain.ConnectionStats;
import com.demo.chatbot.domain.OutboundFrame;
import com.demo.chatbot.infrastructure.ConnectionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/connections")
@CrossOrigin(origins = "*")
public class ConnectionController {

    private final ConnectionRegistry connectionRegistry;

    public ConnectionController(ConnectionRegistry connectionRegistry) {
        this.connectionRegistry = connectionRegistry;
    }

    @GetMapping("/stats")
    public ConnectionStats stats() {
        return connectionRegistry.stats();
    }

    /**
     * System announcement to every client, or to one room when {@code room} is given.
     * POST /api/v1/connections/broadcast
     */
    @PostMapping("/broadcast")
    public ResponseEntity<?> broadcast(@RequestBody Map<String, Object> request) {
        String text = stringField(request, "message");
        if (text == null) {
            return ResponseEntity
                    .status(HttpStatus.BAD_REQUEST)
                    .body(Map.of(
                            "error", "Bad request",
                            "detail", "Field 'message' is required"
                    ));
        }

        try {
            String exclude = stringField(request, "exclude");
            String room = stringField(request, "room");
            OutboundFrame frame = OutboundFrame.system(text);

            int delivered = room != null
                    ? connectionRegistry.sendToRoom(room, frame, exclude)
                    : connectionRegistry.broadcast(frame, exclude);

            log.info("Broadcast sent: room={}, exclude={}, delivered={}", room, exclude, delivered);
            return ResponseEntity.ok(Map.of(
                    "status", "sent",
                    "delivered", delivered
            ));
        } catch (Exception e) {
            log.error("Error broadcasting message", e);
            return ChatController.internalError(e);
        }
    }

    private static String stringField(Map<String, Object> request, String field) {
        Object value = request.get(field);
        if (!(value instanceof String) || ((String) value).isBlank()) {
            return null;
        }
        return (String) value;
    }
}
