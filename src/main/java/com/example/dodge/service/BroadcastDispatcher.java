package com.example.dodge.service;

import com.example.dodge.model.Player;
import com.example.dodge.model.Room;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Writes outbound payloads to one player, a whole room, or a room minus one player.
 * Best-effort: closed or failing sessions are skipped, nothing is retried or queued.
 */
@Component
public class BroadcastDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BroadcastDispatcher.class);

    private final ObjectMapper objectMapper;

    public BroadcastDispatcher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Every player in the room, sender included. */
    public void toAll(Room room, Map<String, Object> payload) {
        toAllExcept(room, null, payload);
    }

    /** Every player in the room except {@code excludedId}. */
    public void toAllExcept(Room room, String excludedId, Map<String, Object> payload) {
        if (room == null) return;
        String json = encode(payload);
        if (json == null) return;
        for (Player p : room.getPlayers()) {
            if (Objects.equals(p.getId(), excludedId)) continue;
            deliver(p.getSession(), json, p.getId());
        }
    }

    public void toPlayer(Player player, Map<String, Object> payload) {
        if (player == null) return;
        toSession(player.getSession(), payload);
    }

    /** Used for replies to connections that are not (yet) seated in a room. */
    public void toSession(WebSocketSession session, Map<String, Object> payload) {
        String json = encode(payload);
        if (json == null) return;
        deliver(session, json, null);
    }

    private String encode(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Dropping outbound {}: not serializable ({})", payload.get("type"), e.getOriginalMessage());
            return null;
        }
    }

    private void deliver(WebSocketSession session, String json, String playerId) {
        if (session == null) return;
        if (!session.isOpen()) {
            log.debug("Skipping send to closed session sid={} player={}", session.getId(), playerId);
            return;
        }
        try {
            session.sendMessage(new TextMessage(json));
        } catch (IOException | SessionLimitExceededException e) {
            log.warn("WS send failed (sid={}, player={}): {}", session.getId(), playerId, e.toString());
        }
    }
}
