package com.example.dodge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Mocked WebSocket session that records every outbound JSON frame.
 */
public final class TestSession {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WebSocketSession session = mock(WebSocketSession.class);
    private final List<JsonNode> received = new ArrayList<>();
    private boolean open = true;

    public TestSession(String id) {
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenAnswer(inv -> open);
        try {
            doAnswer(inv -> {
                TextMessage m = inv.getArgument(0);
                received.add(MAPPER.readTree(m.getPayload()));
                return null;
            }).when(session).sendMessage(any());
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    public WebSocketSession session() {
        return session;
    }

    public void setOpen(boolean open) {
        this.open = open;
    }

    public List<JsonNode> received() {
        return received;
    }

    public List<JsonNode> ofType(String type) {
        return received.stream()
                .filter(n -> type.equals(n.path("type").asText()))
                .collect(Collectors.toList());
    }

    /** Last frame of the given type; fails if there is none. */
    public JsonNode last(String type) {
        List<JsonNode> all = ofType(type);
        if (all.isEmpty()) {
            throw new AssertionError("No '" + type + "' received by " + session.getId() + "; got " + types());
        }
        return all.get(all.size() - 1);
    }

    public List<String> types() {
        return received.stream().map(n -> n.path("type").asText()).collect(Collectors.toList());
    }

    public void clear() {
        received.clear();
    }
}
