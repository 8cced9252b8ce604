package com.example.dodge.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;

/**
 * Last reported (x, y) of a player, kept as the JSON values the client sent
 * so they are relayed back exactly as received.
 */
public record Position(JsonNode x, JsonNode y) {

    public static Position of(double x, double y) {
        return new Position(DoubleNode.valueOf(x), DoubleNode.valueOf(y));
    }
}
