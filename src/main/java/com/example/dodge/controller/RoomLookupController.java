package com.example.dodge.controller;

import com.example.dodge.config.GameProperties;
import com.example.dodge.model.Player;
import com.example.dodge.model.Position;
import com.example.dodge.model.Room;
import com.example.dodge.service.GameService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only room discovery for lobby screens: does a code exist, who is in it, is a name free.
 * Codes are matched case-insensitively.
 */
@RestController
@RequestMapping("/api/rooms")
public class RoomLookupController {

    private final GameService gameService;
    private final GameProperties props;

    public RoomLookupController(GameService gameService, GameProperties props) {
        this.gameService = gameService;
        this.props = props;
    }

    /**
     * Summary of a live room.
     * URL: GET /api/rooms/ABCD
     */
    @GetMapping("/{roomCode}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String roomCode) {
        Room room = gameService.getRoom(roomCode).orElse(null);
        if (room == null) return ResponseEntity.notFound().build();

        Map<String, Object> body = new LinkedHashMap<>();
        synchronized (room) {
            body.put("code", room.getCode());
            body.put("started", room.isStarted());
            body.put("level", room.getCurrentLevel());
            body.put("players", room.playerCount());
            body.put("capacity", props.getMaxPlayers());
            body.put("host", room.getHostId());
            body.put("members", members(room));
        }
        return ResponseEntity.ok(body);
    }

    private static List<Map<String, Object>> members(Room room) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Player p : room.getPlayers()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id", p.getId());
            m.put("color", p.getColor());
            m.put("ready", p.isReady());
            m.put("alive", p.isAlive());
            Position pos = p.getPosition();
            m.put("x", pos == null ? null : pos.x());
            m.put("y", pos == null ? null : pos.y());
            out.add(m);
        }
        return out;
    }

    /**
     * Returns true if the given name is already used by a player in the room.
     * The server would still accept the join and suffix the name.
     * URL: GET /api/rooms/ABCD/name-taken?name=Alice
     */
    @GetMapping("/{roomCode}/name-taken")
    public boolean isNameTaken(@PathVariable String roomCode, @RequestParam String name) {
        if (name == null || name.isEmpty()) return false;
        Room room = gameService.getRoom(roomCode).orElse(null);
        if (room == null) return false;
        synchronized (room) {
            return room.hasPlayer(name);
        }
    }
}
