package com.example.dodge.service;

/** Conditions reported back to the requesting client as an {@code error} message. */
public enum RoomError {

    ROOM_NOT_FOUND("Room not found"),
    GAME_IN_PROGRESS("Game already started"),
    ROOM_FULL("Room is full"),
    NOT_ALL_READY("Not all players are ready");

    private final String message;

    RoomError(String message) {
        this.message = message;
    }

    /** Human-readable text sent in the {@code message} field. */
    public String message() {
        return message;
    }
}
