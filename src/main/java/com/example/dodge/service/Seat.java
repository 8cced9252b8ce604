package com.example.dodge.service;

import java.util.Objects;

/** Where a connection sits once it created or joined a room. */
public record Seat(String roomCode, String playerId) {

    public Seat {
        Objects.requireNonNull(roomCode, "roomCode");
        Objects.requireNonNull(playerId, "playerId");
    }
}
