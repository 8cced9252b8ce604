package com.example.dodge.protocol;

/** Values of the {@code type} field, inbound and outbound. */
public final class MessageTypes {

    private MessageTypes() { }

    // ========== client → server ==========

    public static final String CREATE_ROOM = "create_room";
    public static final String JOIN_ROOM = "join_room";
    public static final String PLAYER_READY = "player_ready";
    public static final String START_GAME = "start_game";
    public static final String PLAYER_POSITION = "player_position";
    public static final String PLAYER_DIED = "player_died";
    public static final String REVIVE_PLAYER = "revive_player";
    public static final String PLAYER_FINISHED = "player_finished";
    public static final String LOBBY_POSITION = "lobby_position";

    // ========== server → client ==========

    public static final String ROOM_CREATED = "room_created";
    public static final String ROOM_JOINED = "room_joined";
    public static final String PLAYER_JOINED = "player_joined";
    public static final String ERROR = "error";
    public static final String PLAYER_READY_UPDATE = "player_ready_update";
    public static final String GAME_START = "game_start";
    public static final String PLAYER_MOVED = "player_moved";
    // PLAYER_DIED is shared by both directions
    public static final String YOU_DIED = "you_died";
    public static final String PLAYER_REVIVED = "player_revived";
    // PLAYER_FINISHED is shared by both directions
    public static final String NEXT_LEVEL = "next_level";
    public static final String GAME_OVER = "game_over";
    public static final String LOBBY_PLAYER_MOVED = "lobby_player_moved";
    public static final String PLAYER_LEFT = "player_left";
    public static final String NEW_HOST = "new_host";
}
