package com.example.dodge.handler;

import com.example.dodge.protocol.ClientMessage;
import com.example.dodge.protocol.MessageTypes;
import com.example.dodge.service.GameService;
import com.example.dodge.service.Seat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.WebSocketSession;

import java.util.Objects;

/**
 * Per-connection context: binds one WebSocket session to its (room code, player id) seat
 * and routes decoded client messages to the {@link GameService}.
 * <p>
 * A connection takes a seat at most once; later create/join requests are ignored, as is
 * every in-room message sent before a seat was taken.
 */
public class ConnectionSession {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSession.class);

    private final WebSocketSession session;
    private final GameService gameService;
    private volatile Seat seat;

    public ConnectionSession(WebSocketSession session, GameService gameService) {
        this.session = Objects.requireNonNull(session, "session");
        this.gameService = Objects.requireNonNull(gameService, "gameService");
    }

    public WebSocketSession getSession() { return session; }
    public Seat getSeat() { return seat; }
    public boolean isSeated() { return seat != null; }

    public String roomCode() { return seat == null ? null : seat.roomCode(); }
    public String playerId() { return seat == null ? null : seat.playerId(); }

    public void dispatch(ClientMessage msg) {
        String type = msg.type();
        if (type == null) {
            log.debug("Ignored message without type (sid={})", session.getId());
            return;
        }

        switch (type) {
            case MessageTypes.CREATE_ROOM -> {
                if (alreadySeated(type)) return;
                seat = gameService.createRoom(session, msg.playerName(), msg.color());
            }
            case MessageTypes.JOIN_ROOM -> {
                if (alreadySeated(type)) return;
                gameService.joinRoom(session, msg.roomCode(), msg.playerName(), msg.color())
                        .ifPresent(s -> seat = s);
            }
            default -> dispatchSeated(type, msg);
        }
    }

    private void dispatchSeated(String type, ClientMessage msg) {
        Seat s = seat;
        if (s == null) {
            log.debug("Ignored {} from unseated session sid={}", type, session.getId());
            return;
        }
        String room = s.roomCode();
        String me = s.playerId();

        switch (type) {
            case MessageTypes.PLAYER_READY    -> gameService.setReady(room, me, msg.isReady());
            case MessageTypes.START_GAME      -> gameService.startGame(room, me);
            case MessageTypes.PLAYER_POSITION -> gameService.relayPlayerPosition(room, me, msg.x(), msg.y());
            case MessageTypes.PLAYER_DIED     -> gameService.playerDied(room, me, msg.x(), msg.y());
            case MessageTypes.REVIVE_PLAYER   -> gameService.revivePlayer(room, me, msg.targetId());
            case MessageTypes.PLAYER_FINISHED -> gameService.playerFinished(room, me);
            case MessageTypes.LOBBY_POSITION  -> gameService.relayLobbyPosition(room, me, msg.x(), msg.y());
            default -> log.debug("Ignored message type '{}' (room={}, player={})", type, room, me);
        }
    }

    /** Teardown path: releases the seat and removes the player from its room. */
    public void close() {
        Seat s = seat;
        seat = null;
        if (s != null) gameService.disconnect(s.roomCode(), s.playerId());
    }

    private boolean alreadySeated(String type) {
        if (seat == null) return false;
        log.debug("Ignored {}: session sid={} already seated as {} in {}",
                type, session.getId(), seat.playerId(), seat.roomCode());
        return true;
    }
}
