package com.example.dodge.service;

/** Thrown when no unused room code could be drawn within the configured number of attempts. */
public class RoomCodeExhaustedException extends IllegalStateException {

    public RoomCodeExhaustedException(int attempts) {
        super("No free room code after " + attempts + " attempts");
    }
}
