package com.example.dodge.model;

import org.springframework.web.socket.WebSocketSession;

import java.util.Objects;

/** Room member bound to exactly one WebSocket session for as long as it is connected. */
public class Player {

    private final String id;             // unique within the room, also the display name
    private final WebSocketSession session;
    private final String color;
    private boolean ready = false;       // lobby only
    private boolean alive = true;        // level only
    private Position position;

    public Player(String id, WebSocketSession session, String color, Position spawn) {
        this.id = Objects.requireNonNull(id, "id");
        this.session = session;
        this.color = color;
        this.position = spawn;
    }

    // identity
    public String getId() { return id; }
    public String getName() { return id; }
    public WebSocketSession getSession() { return session; }
    public String getColor() { return color; }

    // lobby
    public boolean isReady() { return ready; }
    public void setReady(boolean ready) { this.ready = ready; }

    // level
    public boolean isAlive() { return alive; }
    public void setAlive(boolean alive) { this.alive = alive; }

    public Position getPosition() { return position; }
    public void setPosition(Position position) { this.position = position; }

    @Override
    public String toString() {
        return "Player{" +
                "id='" + id + '\'' +
                ", color='" + color + '\'' +
                ", ready=" + ready +
                ", alive=" + alive +
                ", position=" + position +
                '}';
    }
}
