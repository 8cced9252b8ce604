package com.example.dodge.service;

import com.example.dodge.model.Player;
import com.example.dodge.model.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide map of live rooms by code.
 * Creation is serialized on the registry; lookups are lock-free.
 */
@Component
public class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    private final RoomCodeGenerator codes;

    public RoomRegistry(RoomCodeGenerator codes) {
        this.codes = codes;
    }

    /** Upper-cased, trimmed code; null stays null. */
    public static String normalizeCode(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Registers a new room under {@code code} with {@code host} as its only member.
     *
     * @throws IllegalStateException if the code is already taken
     */
    public synchronized Room createRoom(String code, String hostId, Player host) {
        if (!Objects.equals(hostId, host.getId())) {
            throw new IllegalArgumentException("Host id " + hostId + " does not match player " + host.getId());
        }
        if (rooms.containsKey(code)) {
            throw new IllegalStateException("Room code already in use: " + code);
        }
        Room room = new Room(code, host);
        rooms.put(code, room);
        log.info("Room {} created by {} (live rooms: {})", code, hostId, rooms.size());
        return room;
    }

    /** Draws a free code and registers the room in one step. */
    public synchronized Room openRoom(Player host) {
        String code = codes.generate(rooms::containsKey);
        return createRoom(code, host.getId(), host);
    }

    public Optional<Room> get(String code) {
        String c = normalizeCode(code);
        if (c == null || c.isEmpty()) return Optional.empty();
        return Optional.ofNullable(rooms.get(c));
    }

    public boolean contains(String code) {
        return get(code).isPresent();
    }

    /** Drops the room. Callers must already have emptied its roster. */
    public void delete(String code) {
        Room removed = rooms.remove(code);
        if (removed != null) {
            removed.markClosed();
            log.info("Room {} deleted (live rooms: {})", code, rooms.size());
        }
    }

    public int size() {
        return rooms.size();
    }

    public Set<String> codes() {
        return Collections.unmodifiableSet(new TreeSet<>(rooms.keySet()));
    }
}
