package com.example.dodge.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One decoded client frame. {@code type} selects the operation; the other fields are
 * read only by the operations that use them and may be null. Coordinates are kept as
 * raw JSON values and relayed untouched.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientMessage(
        @JsonProperty("type") String type,
        @JsonProperty("player_name") String playerName,
        @JsonProperty("color") String color,
        @JsonProperty("room_code") String roomCode,
        @JsonProperty("ready") Boolean ready,
        @JsonProperty("x") JsonNode x,
        @JsonProperty("y") JsonNode y,
        @JsonProperty("target_id") String targetId
) {

    public boolean isReady() {
        return Boolean.TRUE.equals(ready);
    }
}
