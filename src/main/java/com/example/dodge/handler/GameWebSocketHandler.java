package com.example.dodge.handler;

import com.example.dodge.protocol.ClientMessage;
import com.example.dodge.service.GameService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket handler for the game endpoint.
 * - One JSON object per text frame; {@code type} selects the operation
 * - Malformed JSON is dropped, unknown types are ignored; the connection stays open
 * - Outbound writes go through a {@link ConcurrentWebSocketSessionDecorator} so room broadcasts
 *   issued from different threads never interleave on one socket
 * - On close: the player leaves its room (host failover / room deletion happen in GameService)
 */
@Component
public class GameWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(GameWebSocketHandler.class);

    private final GameService gameService;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final int sendTimeLimitMs;
    private final int sendBufferLimitBytes;

    /** Per WebSocket session id → connection context. */
    private final Map<String, ConnectionSession> bySession = new ConcurrentHashMap<>();

    @Autowired
    public GameWebSocketHandler(
            GameService gameService,
            @Value("${app.websocket.send-time-limit-ms:5000}") int sendTimeLimitMs,
            @Value("${app.websocket.send-buffer-limit-bytes:524288}") int sendBufferLimitBytes
    ) {
        this.gameService = gameService;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferLimitBytes = sendBufferLimitBytes;
    }

    public GameWebSocketHandler(GameService gameService) {
        this(gameService, 5000, 512 * 1024);
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferLimitBytes);
        bySession.put(session.getId(), new ConnectionSession(safe, gameService));
        log.info("WS OPEN sid={} remote={}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        ConnectionSession conn = bySession.get(session.getId());
        if (conn == null) {
            log.warn("WS message from unknown session sid={}", session.getId());
            return;
        }

        final String payload = message.getPayload();
        ClientMessage msg;
        try {
            msg = objectMapper.readValue(payload, ClientMessage.class);
        } catch (JsonProcessingException e) {
            log.debug("WS dropped malformed payload (sid={}): {}", session.getId(), e.getOriginalMessage());
            return;
        }
        if (msg == null) return;

        try {
            conn.dispatch(msg);
        } catch (RuntimeException e) {
            log.error("WS handleTextMessage failed (room={}, player={}, type={})",
                    conn.roomCode(), conn.playerId(), msg.type(), e);
            closeQuietly(session, CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        ConnectionSession conn = bySession.get(session.getId());
        log.error("WS ERROR sid={} room={} player={} : transport error", session.getId(),
                conn == null ? null : conn.roomCode(), conn == null ? null : conn.playerId(), exception);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        ConnectionSession conn = bySession.remove(session.getId());
        if (conn == null) {
            log.info("WS CLOSE sid={} code={} reason={}", session.getId(), status.getCode(), status.getReason());
            return;
        }

        final String roomCode = conn.roomCode();
        final String playerId = conn.playerId();
        log.info("WS CLOSE sid={} room={} player={} code={} reason={}",
                session.getId(), roomCode, playerId, status.getCode(), status.getReason());

        try {
            conn.close();
        } catch (RuntimeException e) {
            log.error("WS afterConnectionClosed handling failed (room={}, player={})", roomCode, playerId, e);
        }
    }

    /** Number of open connections; used by the health endpoint. */
    public int connectionCount() {
        return bySession.size();
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            session.close(status);
        } catch (Exception e) {
            log.debug("WS close failed (sid={}): {}", session.getId(), e.toString());
        }
    }
}
