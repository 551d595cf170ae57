package com.demo.chatbot.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;

/**
 * Registry-side record of one live WebSocket connection. The session handle never leaves the registry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionInfo {

    private String clientId;
    private WebSocketSession wsSession;
    private Instant connectedAt;
    private volatile Instant lastActivity;

    @Builder.Default
    private ConnectionStatus status = ConnectionStatus.ONLINE;

    public enum ConnectionStatus {
        ONLINE
    }
}
