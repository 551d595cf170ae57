package com.demo.chatbot.infrastructure;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConnectionInfo;
import com.demo.chatbot.domain.ConnectionStats;
import com.demo.chatbot.domain.OutboundFrame;
import com.demo.chatbot.service.MetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.WebSocketSessionDecorator;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local registry of live WebSocket connections and the rooms they belong to.
 *
 * Connections live in a {@link ConcurrentHashMap}. Room membership is guarded by a single
 * registry-wide lock. Every transport is wrapped in a {@link ConcurrentWebSocketSessionDecorator}
 * so concurrent senders never interleave frames on one socket. A failed send always ends with the
 * client being deregistered; failures are never reported back to whoever triggered the send.
 */
@Component
@Slf4j
public class ConnectionRegistry {

    static final String WELCOME_MESSAGE = "Connected successfully! How can I help you today?";
    static final String TIMEOUT_MESSAGE = "Connection timed out due to inactivity";

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final ConcurrentHashMap<String, ConnectionInfo> connections = new ConcurrentHashMap<>();

    // roomId -> members; guarded by roomLock
    private final Map<String, Set<String>> rooms = new HashMap<>();
    private final Object roomLock = new Object();

    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;
    private final Clock clock;

    @Autowired
    public ConnectionRegistry(ObjectMapper objectMapper, MetricsService metricsService) {
        this(objectMapper, metricsService, Clock.systemUTC());
    }

    ConnectionRegistry(ObjectMapper objectMapper, MetricsService metricsService, Clock clock) {
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Register a connection and greet it. A second connect with the same client id replaces the
     * first one and closes its transport.
     */
    public void connect(WebSocketSession wsSession, String clientId) {
        Instant now = clock.instant();
        ConnectionInfo info = ConnectionInfo.builder()
                .clientId(clientId)
                .wsSession(new ConcurrentWebSocketSessionDecorator(
                        wsSession, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES))
                .connectedAt(now)
                .lastActivity(now)
                .build();

        ConnectionInfo previous = connections.put(clientId, info);
        if (previous != null) {
            log.warn("Client reconnected, replacing previous transport: clientId={}", clientId);
            closeQuietly(previous, CloseStatus.NORMAL);
        } else {
            metricsService.recordWebSocketConnection(clientId);
        }

        log.info("Client connected: clientId={}, total={}", clientId, connections.size());
        sendSystemMessage(clientId, WELCOME_MESSAGE, null);
    }

    /**
     * Remove a client with all of its room memberships. Unknown ids are ignored.
     */
    public void disconnect(String clientId) {
        ConnectionInfo info = connections.remove(clientId);
        if (info != null) {
            afterRemoval(info);
        }
    }

    /**
     * Remove a client only if it is still bound to the given transport. Used by transport
     * callbacks so a late close of a replaced socket cannot evict its successor.
     */
    public void disconnect(String clientId, WebSocketSession wsSession) {
        ConnectionInfo info = connections.get(clientId);
        if (info != null && WebSocketSessionDecorator.unwrap(info.getWsSession()) == wsSession) {
            remove(clientId, info);
        }
    }

    public void touch(String clientId) {
        ConnectionInfo info = connections.get(clientId);
        if (info != null) {
            info.setLastActivity(clock.instant());
        }
    }

    /**
     * Deliver one frame to one client.
     *
     * @return true if the frame was handed to the transport
     */
    public boolean sendPersonal(String clientId, OutboundFrame frame) {
        ConnectionInfo info = connections.get(clientId);
        if (info == null) {
            log.debug("Dropping frame for absent client: clientId={}, type={}", clientId, frame.getType());
            return false;
        }
        String payload = serialize(frame);
        if (payload == null) {
            return false;
        }
        if (deliver(info, payload)) {
            info.setLastActivity(clock.instant());
            metricsService.recordMessageSent(frame.getType().wireName());
            return true;
        }
        remove(clientId, info);
        return false;
    }

    /**
     * Deliver to every connected client except {@code excludeClientId}.
     *
     * @return number of clients the frame reached
     */
    public int broadcast(OutboundFrame frame, String excludeClientId) {
        String payload = serialize(frame);
        if (payload == null) {
            return 0;
        }
        List<ConnectionInfo> targets = new ArrayList<>();
        for (ConnectionInfo info : connections.values()) {
            if (!info.getClientId().equals(excludeClientId)) {
                targets.add(info);
            }
        }
        return deliverAll(targets, payload, frame);
    }

    /**
     * Deliver to the members of a room except {@code excludeClientId}. Unknown rooms are ignored.
     *
     * @return number of clients the frame reached
     */
    public int sendToRoom(String roomId, OutboundFrame frame, String excludeClientId) {
        List<String> members = getRoomMembers(roomId);
        if (members.isEmpty()) {
            return 0;
        }
        String payload = serialize(frame);
        if (payload == null) {
            return 0;
        }
        List<ConnectionInfo> targets = new ArrayList<>();
        for (String memberId : members) {
            if (memberId.equals(excludeClientId)) {
                continue;
            }
            ConnectionInfo info = connections.get(memberId);
            if (info != null) {
                targets.add(info);
            }
        }
        return deliverAll(targets, payload, frame);
    }

    public void joinRoom(String clientId, String roomId) {
        boolean added;
        synchronized (roomLock) {
            // afterRemoval purges rooms under this lock once the connection is gone
            if (!connections.containsKey(clientId)) {
                log.debug("Ignoring room join for absent client: clientId={}, roomId={}", clientId, roomId);
                return;
            }
            added = rooms.computeIfAbsent(roomId, k -> new LinkedHashSet<>()).add(clientId);
        }
        if (added) {
            log.info("Client joined room: clientId={}, roomId={}", clientId, roomId);
        }
    }

    public void leaveRoom(String clientId, String roomId) {
        boolean removed = false;
        synchronized (roomLock) {
            Set<String> members = rooms.get(roomId);
            if (members != null) {
                removed = members.remove(clientId);
                if (members.isEmpty()) {
                    rooms.remove(roomId);
                }
            }
        }
        if (removed) {
            log.info("Client left room: clientId={}, roomId={}", clientId, roomId);
        }
    }

    public List<String> getRoomMembers(String roomId) {
        synchronized (roomLock) {
            Set<String> members = rooms.get(roomId);
            return members != null ? List.copyOf(members) : List.of();
        }
    }

    /**
     * Disconnect every client idle for longer than {@code timeout}. Each one gets a best-effort
     * warning before its transport is closed.
     *
     * @return ids of the clients removed
     */
    public List<String> cleanupInactive(Duration timeout) {
        Instant cutoff = clock.instant().minus(timeout);
        List<ConnectionInfo> snapshot = new ArrayList<>(connections.values());
        List<String> removed = new ArrayList<>();

        for (ConnectionInfo info : snapshot) {
            if (!info.getLastActivity().isBefore(cutoff)) {
                continue;
            }
            String clientId = info.getClientId();
            log.info("Cleaning up inactive connection: clientId={}, lastActivity={}",
                    clientId, info.getLastActivity());

            String warning = serialize(OutboundFrame.system(TIMEOUT_MESSAGE, "warning"));
            if (warning != null && !deliver(info, warning)) {
                log.debug("Timeout warning not delivered: clientId={}", clientId);
            }
            if (remove(clientId, info)) {
                removed.add(clientId);
            }
            closeQuietly(info, CloseStatus.GOING_AWAY);
        }
        metricsService.recordInactiveCleanup(removed.size());
        return removed;
    }

    public ConnectionStats stats() {
        Map<String, Integer> perRoom = new LinkedHashMap<>();
        synchronized (roomLock) {
            rooms.forEach((roomId, members) -> perRoom.put(roomId, members.size()));
        }
        return ConnectionStats.builder()
                .totalConnections(connections.size())
                .totalRooms(perRoom.size())
                .connectionsPerRoom(perRoom)
                .connectedClients(new ArrayList<>(connections.keySet()))
                .build();
    }

    public boolean isConnected(String clientId) {
        return connections.containsKey(clientId);
    }

    public int getConnectionCount() {
        return connections.size();
    }

    /**
     * Connection metadata without the transport handle.
     */
    public Optional<ConnectionInfo> getConnectionInfo(String clientId) {
        return Optional.ofNullable(connections.get(clientId))
                .map(info -> ConnectionInfo.builder()
                        .clientId(info.getClientId())
                        .connectedAt(info.getConnectedAt())
                        .lastActivity(info.getLastActivity())
                        .status(info.getStatus())
                        .build());
    }

    // ===== Convenience frames =====

    public boolean sendTypingIndicator(String clientId, boolean isTyping) {
        return sendPersonal(clientId, OutboundFrame.typing(isTyping));
    }

    public boolean sendSystemMessage(String clientId, String message, String messageType) {
        return sendPersonal(clientId, OutboundFrame.system(message, messageType));
    }

    public boolean sendErrorMessage(String clientId, String error) {
        return sendPersonal(clientId, OutboundFrame.error(error));
    }

    public boolean sendBotResponse(String clientId, BotResponse response) {
        return sendPersonal(clientId, OutboundFrame.botResponse(response));
    }

    // ===== Internals =====

    private int deliverAll(List<ConnectionInfo> targets, String payload, OutboundFrame frame) {
        List<ConnectionInfo> failed = new ArrayList<>();
        int delivered = 0;
        for (ConnectionInfo info : targets) {
            if (deliver(info, payload)) {
                delivered++;
                metricsService.recordMessageSent(frame.getType().wireName());
            } else {
                failed.add(info);
            }
        }
        for (ConnectionInfo info : failed) {
            remove(info.getClientId(), info);
        }
        return delivered;
    }

    private boolean deliver(ConnectionInfo info, String payload) {
        WebSocketSession session = info.getWsSession();
        if (!session.isOpen()) {
            log.warn("Transport already closed: clientId={}", info.getClientId());
            return false;
        }
        try {
            session.sendMessage(new TextMessage(payload));
            return true;
        } catch (Exception e) {
            log.error("Error sending to client: clientId={}", info.getClientId(), e);
            return false;
        }
    }

    private boolean remove(String clientId, ConnectionInfo expected) {
        if (connections.remove(clientId, expected)) {
            afterRemoval(expected);
            return true;
        }
        return false;
    }

    private void afterRemoval(ConnectionInfo info) {
        String clientId = info.getClientId();
        synchronized (roomLock) {
            rooms.values().forEach(members -> members.remove(clientId));
            rooms.values().removeIf(Set::isEmpty);
        }
        metricsService.recordWebSocketDisconnection(clientId);
        log.info("Client disconnected: clientId={}, total={}, duration={}s",
                clientId, connections.size(),
                Duration.between(info.getConnectedAt(), clock.instant()).getSeconds());
    }

    private void closeQuietly(ConnectionInfo info, CloseStatus status) {
        try {
            info.getWsSession().close(status);
        } catch (IOException e) {
            log.debug("Error closing transport: clientId={}", info.getClientId(), e);
        }
    }

    private String serialize(OutboundFrame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize frame: type={}", frame.getType(), e);
            return null;
        }
    }
}
