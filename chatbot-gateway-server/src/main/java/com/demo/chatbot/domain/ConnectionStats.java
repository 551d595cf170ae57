package com.demo.chatbot.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the connection registry. Not transactionally consistent with concurrent edits.
 */
@Value
@Builder
public class ConnectionStats {

    @JsonProperty("total_connections")
    int totalConnections;

    @JsonProperty("total_rooms")
    int totalRooms;

    @JsonProperty("connections_per_room")
    Map<String, Integer> connectionsPerRoom;

    @JsonProperty("connected_clients")
    List<String> connectedClients;
}
