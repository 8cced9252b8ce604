package com.example.dodge.service;

import com.example.dodge.config.GameProperties;
import com.example.dodge.model.Player;
import com.example.dodge.model.Position;
import com.example.dodge.model.Room;
import com.example.dodge.protocol.MessageTypes;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.WebSocketSession;

import java.util.*;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Game service: room lifecycle, roster, ready check, deaths and revivals, level race and host failover.
 * <p>
 * Every operation runs while holding the room's monitor, outbound sends included, so a room sees
 * one operation at a time and each recipient gets messages in the order they were issued.
 * Precondition failures other than the four {@link RoomError}s are silent no-ops.
 */
@Service
public class GameService {

    private static final Logger log = LoggerFactory.getLogger(GameService.class);

    private final RoomRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final ScheduledExecutorService levelTimer;
    private final GameProperties props;

    public GameService(RoomRegistry registry,
                       BroadcastDispatcher dispatcher,
                       @Qualifier("levelAdvanceScheduler") ScheduledExecutorService levelTimer,
                       GameProperties props) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.levelTimer = levelTimer;
        this.props = props;
    }

    public Optional<Room> getRoom(String roomCode) {
        return registry.get(roomCode);
    }

    // ========================================================================
    //  CREATE / JOIN
    // ========================================================================

    /** Opens a room with the caller as its only player and host. Never reports an error. */
    public Seat createRoom(WebSocketSession session, String requestedName, String color) {
        String id = isBlank(requestedName) ? "Player1" : requestedName;
        Player host = new Player(id, session, isBlank(color) ? props.getHostColor() : color, spawn());
        Room room = registry.openRoom(host);

        synchronized (room) {
            Map<String, Object> reply = payload(MessageTypes.ROOM_CREATED);
            reply.put("room_code", room.getCode());
            reply.put("player_id", id);
            reply.put("is_host", true);
            dispatcher.toPlayer(host, reply);
        }
        return new Seat(room.getCode(), id);
    }

    /**
     * Seats the caller in an existing lobby. Name clashes get a numeric suffix.
     * Returns empty if an error was sent back instead.
     */
    public Optional<Seat> joinRoom(WebSocketSession session, String roomCode, String requestedName, String color) {
        String code = RoomRegistry.normalizeCode(roomCode);
        Room room = registry.get(code).orElse(null);
        if (room == null) {
            sendError(session, RoomError.ROOM_NOT_FOUND);
            return Optional.empty();
        }

        synchronized (room) {
            if (room.isClosed()) {
                sendError(session, RoomError.ROOM_NOT_FOUND);
                return Optional.empty();
            }
            if (room.isStarted()) {
                sendError(session, RoomError.GAME_IN_PROGRESS);
                return Optional.empty();
            }
            if (room.playerCount() >= props.getMaxPlayers()) {
                sendError(session, RoomError.ROOM_FULL);
                return Optional.empty();
            }

            String base = isBlank(requestedName)
                    ? "Player" + ThreadLocalRandom.current().nextInt(999)
                    : requestedName;
            String id = room.uniqueIdFor(base);
            Player joiner = new Player(id, session, isBlank(color) ? props.getGuestColor() : color, spawn());
            room.addPlayer(joiner);

            Map<String, Object> roster = new LinkedHashMap<>();
            for (Player p : room.getPlayers()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("name", p.getName());
                entry.put("ready", p.isReady());
                entry.put("color", p.getColor());
                roster.put(p.getId(), entry);
            }

            Map<String, Object> reply = payload(MessageTypes.ROOM_JOINED);
            reply.put("room_code", room.getCode());
            reply.put("player_id", id);
            reply.put("is_host", false);
            reply.put("players", roster);
            reply.put("host", room.getHostId());
            dispatcher.toPlayer(joiner, reply);

            Map<String, Object> joined = payload(MessageTypes.PLAYER_JOINED);
            joined.put("player_id", id);
            joined.put("player_name", id);
            joined.put("color", joiner.getColor());
            dispatcher.toAllExcept(room, id, joined);

            log.info("{} joined room {} ({} players)", id, room.getCode(), room.playerCount());
            return Optional.of(new Seat(room.getCode(), id));
        }
    }

    // ========================================================================
    //  LOBBY
    // ========================================================================

    public void setReady(String roomCode, String playerId, boolean ready) {
        inRoom(roomCode, playerId, MessageTypes.PLAYER_READY, room -> {
            room.setReady(playerId, ready);

            Map<String, Object> update = payload(MessageTypes.PLAYER_READY_UPDATE);
            update.put("player_id", playerId);
            update.put("ready", ready);
            update.put("ready_count", room.readyCount());
            update.put("total_count", room.playerCount());
            dispatcher.toAll(room, update);
        });
    }

    public void startGame(String roomCode, String playerId) {
        inRoom(roomCode, playerId, MessageTypes.START_GAME, room -> {
            if (!room.isHost(playerId)) {
                log.debug("start_game ignored: {} is not host of {}", playerId, room.getCode());
                return;
            }
            if (!room.allReady()) {
                dispatcher.toPlayer(room.getPlayer(playerId), error(RoomError.NOT_ALL_READY));
                return;
            }

            room.startMatch();

            Map<String, Object> roster = new LinkedHashMap<>();
            for (Player p : room.getPlayers()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("name", p.getName());
                entry.put("color", p.getColor());
                roster.put(p.getId(), entry);
            }
            for (Player p : room.getPlayers()) {
                Map<String, Object> start = payload(MessageTypes.GAME_START);
                start.put("level", room.getCurrentLevel());
                start.put("players", roster);
                start.put("your_id", p.getId());
                dispatcher.toPlayer(p, start);
            }
            log.info("Game started in room {} ({} players, match #{})",
                    room.getCode(), room.playerCount(), room.getMatchGeneration());
        });
    }

    public void relayLobbyPosition(String roomCode, String playerId, JsonNode x, JsonNode y) {
        relayPosition(roomCode, playerId, x, y, MessageTypes.LOBBY_POSITION, MessageTypes.LOBBY_PLAYER_MOVED);
    }

    // ========================================================================
    //  LEVEL PLAY
    // ========================================================================

    public void relayPlayerPosition(String roomCode, String playerId, JsonNode x, JsonNode y) {
        relayPosition(roomCode, playerId, x, y, MessageTypes.PLAYER_POSITION, MessageTypes.PLAYER_MOVED);
    }

    private void relayPosition(String roomCode, String playerId, JsonNode x, JsonNode y, String op, String outType) {
        inRoom(roomCode, playerId, op, room -> {
            room.getPlayer(playerId).setPosition(new Position(x, y));

            Map<String, Object> moved = payload(outType);
            moved.put("player_id", playerId);
            moved.put("x", x);
            moved.put("y", y);
            dispatcher.toAllExcept(room, playerId, moved);
        });
    }

    public void playerDied(String roomCode, String playerId, JsonNode x, JsonNode y) {
        inRoom(roomCode, playerId, MessageTypes.PLAYER_DIED, room -> {
            room.recordDeath(playerId, new Position(x, y));

            Map<String, Object> died = payload(MessageTypes.PLAYER_DIED);
            died.put("player_id", playerId);
            died.put("x", x);
            died.put("y", y);
            dispatcher.toAllExcept(room, playerId, died);

            Map<String, Object> own = payload(MessageTypes.YOU_DIED);
            own.put("x", x);
            own.put("y", y);
            dispatcher.toPlayer(room.getPlayer(playerId), own);
        });
    }

    public void revivePlayer(String roomCode, String reviverId, String targetId) {
        inRoom(roomCode, reviverId, MessageTypes.REVIVE_PLAYER, room -> {
            if (!room.isDead(targetId)) {
                log.debug("revive_player ignored: {} is not dead in {}", targetId, room.getCode());
                return;
            }
            Position where = room.revive(targetId);

            Map<String, Object> revived = payload(MessageTypes.PLAYER_REVIVED);
            revived.put("revived_id", targetId);
            revived.put("reviver_id", reviverId);
            revived.put("x", where.x());
            revived.put("y", where.y());
            dispatcher.toAll(room, revived);

            log.info("{} revived {} in room {}", reviverId, targetId, room.getCode());
        });
    }

    /**
     * Records a finisher. The first finisher of a level earns the win and starts the
     * countdown to the next level.
     */
    public void playerFinished(String roomCode, String playerId) {
        inRoom(roomCode, playerId, MessageTypes.PLAYER_FINISHED, room -> {
            if (!room.markFinished(playerId)) {
                log.debug("player_finished ignored: {} already finished level {} in {}",
                        playerId, room.getCurrentLevel(), room.getCode());
                return;
            }
            boolean first = room.creditLevelWin(playerId);

            Map<String, Object> finished = payload(MessageTypes.PLAYER_FINISHED);
            finished.put("player_id", playerId);
            finished.put("is_first", first);
            finished.put("finished_count", room.finishedCount());
            finished.put("total_count", room.playerCount());
            finished.put("level_wins", room.getLevelWins());
            dispatcher.toAll(room, finished);

            if (first) scheduleLevelAdvance(room);
        });
    }

    private void scheduleLevelAdvance(Room room) {
        final long generation = room.getMatchGeneration();
        final int level = room.getCurrentLevel();
        levelTimer.schedule(() -> {
            try {
                advanceLevel(room, generation, level);
            } catch (RuntimeException e) {
                log.error("Level advance failed (room={}, level={})", room.getCode(), level, e);
            }
        }, props.getLevelAdvanceDelayMs(), TimeUnit.MILLISECONDS);
    }

    /**
     * Moves {@code room} past {@code fromLevel}. Does nothing if that room was deleted
     * (even if a newer room now holds its code), or a new match or another advance happened
     * since the timer was scheduled.
     */
    void advanceLevel(Room room, long generation, int fromLevel) {
        String roomCode = room.getCode();
        if (registry.get(roomCode).orElse(null) != room) {
            log.debug("Level advance skipped: room {} no longer exists", roomCode);
            return;
        }
        synchronized (room) {
            if (room.isClosed() || !room.isStarted()
                    || room.getMatchGeneration() != generation
                    || room.getCurrentLevel() != fromLevel) {
                log.debug("Level advance skipped: room {} moved on (match #{}, level {})",
                        roomCode, room.getMatchGeneration(), room.getCurrentLevel());
                return;
            }

            int level = room.advanceLevel();
            if (level > props.getLevelCount()) {
                room.endMatch();
                Map<String, Object> over = payload(MessageTypes.GAME_OVER);
                over.put("level_wins", room.getLevelWins());
                dispatcher.toAll(room, over);
                log.info("Game over in room {}: {}", roomCode, room.getLevelWins());
                return;
            }

            Map<String, Object> next = payload(MessageTypes.NEXT_LEVEL);
            next.put("level", level);
            next.put("level_wins", room.getLevelWins());
            dispatcher.toAll(room, next);
            log.info("Room {} advancing to level {}", roomCode, level);
        }
    }

    // ========================================================================
    //  DISCONNECT
    // ========================================================================

    /** Removes the player; deletes the room when it empties, otherwise hands over the host role if needed. */
    public void disconnect(String roomCode, String playerId) {
        Room room = registry.get(roomCode).orElse(null);
        if (room == null) return;

        synchronized (room) {
            if (room.isClosed() || room.removePlayer(playerId) == null) return;

            Map<String, Object> left = payload(MessageTypes.PLAYER_LEFT);
            left.put("player_id", playerId);
            dispatcher.toAll(room, left);
            log.info("{} left room {}", playerId, room.getCode());

            if (room.isEmpty()) {
                registry.delete(room.getCode());
                return;
            }

            String newHost = room.promoteHostIfNecessary();
            if (newHost != null) {
                Map<String, Object> host = payload(MessageTypes.NEW_HOST);
                host.put("host_id", newHost);
                dispatcher.toAll(room, host);
                log.info("New host in {}: {}", room.getCode(), newHost);
            }
        }
    }

    // ========================================================================
    //  HELPERS
    // ========================================================================

    /** Runs {@code action} under the room monitor if the room is live and the player is in it. */
    private void inRoom(String roomCode, String playerId, String op, Consumer<Room> action) {
        Room room = registry.get(roomCode).orElse(null);
        if (room == null) {
            log.debug("{} ignored: unknown room {}", op, roomCode);
            return;
        }
        synchronized (room) {
            if (room.isClosed() || !room.hasPlayer(playerId)) {
                log.debug("{} ignored: {} is not in room {}", op, playerId, roomCode);
                return;
            }
            action.accept(room);
        }
    }

    private void sendError(WebSocketSession session, RoomError error) {
        log.debug("Join rejected (sid={}): {}", session == null ? "n/a" : session.getId(), error.message());
        dispatcher.toSession(session, error(error));
    }

    private static Map<String, Object> error(RoomError error) {
        Map<String, Object> payload = payload(MessageTypes.ERROR);
        payload.put("message", error.message());
        return payload;
    }

    private static Map<String, Object> payload(String type) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        return payload;
    }

    private Position spawn() {
        return Position.of(props.getSpawnX(), props.getSpawnY());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isEmpty();
    }
}
