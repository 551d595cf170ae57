package com.demo.chatbot.handler;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.IncomingMessage;
import com.demo.chatbot.domain.OutboundFrame;
import com.demo.chatbot.infrastructure.ConnectionRegistry;
import com.demo.chatbot.service.MessagePipeline;
import com.demo.chatbot.service.MetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.util.Map;

/**
 * WebSocket endpoint {@code /ws/{client_id}}.
 *
 * Frames without a recognised {@code type} are chat messages and go through the
 * {@link MessagePipeline}; the reply is framed by typing indicators. Spring delivers the frames of
 * one session sequentially and each is handled to completion, so replies keep the order of the
 * messages they answer.
 */
@Slf4j
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    static final String CLIENT_ID_ATTRIBUTE = "clientId";
    static final String INVALID_FORMAT = "Invalid message format";
    static final String ROOM_REQUIRED = "Room is required";
    static final String PROCESSING_FAILED = "Message processing failed";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() { };

    private final ObjectMapper objectMapper;
    private final ConnectionRegistry connectionRegistry;
    private final MessagePipeline messagePipeline;
    private final MetricsService metricsService;

    public ChatWebSocketHandler(ObjectMapper objectMapper,
                                ConnectionRegistry connectionRegistry,
                                MessagePipeline messagePipeline,
                                MetricsService metricsService) {
        this.objectMapper = objectMapper;
        this.connectionRegistry = connectionRegistry;
        this.messagePipeline = messagePipeline;
        this.metricsService = metricsService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        String clientId = extractClientId(wsSession);
        if (clientId == null) {
            log.warn("Rejecting WebSocket without client id: uri={}", wsSession.getUri());
            wsSession.close(CloseStatus.BAD_DATA);
            return;
        }
        wsSession.getAttributes().put(CLIENT_ID_ATTRIBUTE, clientId);
        connectionRegistry.connect(wsSession, clientId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        String clientId = (String) wsSession.getAttributes().get(CLIENT_ID_ATTRIBUTE);
        if (clientId == null) {
            log.warn("Frame from unregistered WebSocket: wsId={}", wsSession.getId());
            return;
        }
        connectionRegistry.touch(clientId);
        metricsService.recordMessageReceived("websocket");

        try {
            String payload = message.getPayload();
            log.debug("Received frame from {}: {}", clientId, payload);

            JsonNode frame;
            try {
                frame = objectMapper.readTree(payload);
            } catch (JsonProcessingException e) {
                log.debug("Malformed frame from {}: {}", clientId, e.getOriginalMessage());
                connectionRegistry.sendErrorMessage(clientId, INVALID_FORMAT);
                return;
            }
            if (frame == null || !frame.isObject()) {
                connectionRegistry.sendErrorMessage(clientId, INVALID_FORMAT);
                return;
            }

            String type = frame.path("type").asText("");
            switch (type) {
                case "ping":
                    connectionRegistry.sendPersonal(clientId, OutboundFrame.pong());
                    break;
                case "join_room":
                    handleJoinRoom(clientId, frame);
                    break;
                case "leave_room":
                    handleLeaveRoom(clientId, frame);
                    break;
                case "room_message":
                    handleRoomMessage(clientId, frame);
                    break;
                default:
                    handleChatMessage(clientId, frame);
            }

        } catch (Exception e) {
            log.error("Error handling frame: clientId={}", clientId, e);
            metricsService.recordError("MESSAGE_PROCESSING_ERROR", "ChatWebSocketHandler");
            connectionRegistry.sendErrorMessage(clientId, PROCESSING_FAILED);
        }
    }

    private void handleChatMessage(String clientId, JsonNode frame) {
        JsonNode text = frame.get("message");
        Map<String, Object> metadata = readMetadata(frame.get("metadata"));

        connectionRegistry.sendTypingIndicator(clientId, true);
        BotResponse reply = messagePipeline.process(
                IncomingMessage.of(text != null && text.isTextual() ? text.asText() : null, clientId, metadata));
        connectionRegistry.sendBotResponse(clientId, reply);
        connectionRegistry.sendTypingIndicator(clientId, false);
    }

    private void handleJoinRoom(String clientId, JsonNode frame) {
        String room = textField(frame, "room");
        if (room == null) {
            connectionRegistry.sendErrorMessage(clientId, ROOM_REQUIRED);
            return;
        }
        connectionRegistry.joinRoom(clientId, room);
        connectionRegistry.sendSystemMessage(clientId, "Joined room " + room, "info");
    }

    private void handleLeaveRoom(String clientId, JsonNode frame) {
        String room = textField(frame, "room");
        if (room == null) {
            connectionRegistry.sendErrorMessage(clientId, ROOM_REQUIRED);
            return;
        }
        connectionRegistry.leaveRoom(clientId, room);
        connectionRegistry.sendSystemMessage(clientId, "Left room " + room, "info");
    }

    private void handleRoomMessage(String clientId, JsonNode frame) {
        String room = textField(frame, "room");
        if (room == null) {
            connectionRegistry.sendErrorMessage(clientId, ROOM_REQUIRED);
            return;
        }
        String text = textField(frame, "message");
        connectionRegistry.sendToRoom(room, OutboundFrame.roomMessage(room, clientId, text), clientId);
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        String clientId = (String) wsSession.getAttributes().get(CLIENT_ID_ATTRIBUTE);
        log.error("Transport error: clientId={}", clientId, exception);
        if (clientId != null) {
            connectionRegistry.disconnect(clientId, wsSession);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        String clientId = (String) wsSession.getAttributes().get(CLIENT_ID_ATTRIBUTE);
        log.info("WebSocket closed: clientId={}, status={}", clientId, status);
        if (clientId != null) {
            connectionRegistry.disconnect(clientId, wsSession);
        }
    }

    private Map<String, Object> readMetadata(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, METADATA_TYPE);
    }

    private static String textField(JsonNode frame, String field) {
        JsonNode node = frame.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
    }

    /**
     * Last path segment of {@code /ws/{client_id}}
     */
    static String extractClientId(WebSocketSession session) {
        URI uri = session.getUri();
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        String path = uri.getPath();
        int slash = path.lastIndexOf('/');
        String clientId = slash >= 0 ? path.substring(slash + 1) : path;
        return clientId.isBlank() ? null : clientId;
    }
}
