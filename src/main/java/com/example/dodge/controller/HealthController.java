package com.example.dodge.controller;

import com.example.dodge.handler.GameWebSocketHandler;
import com.example.dodge.service.RoomRegistry;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

  private final RoomRegistry registry;
  private final GameWebSocketHandler handler;

  public HealthController(RoomRegistry registry, GameWebSocketHandler handler) {
    this.registry = registry;
    this.handler = handler;
  }

  /** Liveness probe. */
  @GetMapping("/healthz")
  public String healthz() {
    return "ok";
  }

  /** Human-readable status: live rooms and open connections. */
  @GetMapping("/admin/health")
  public Map<String, Object> adminHealth() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("app", "ok");
    m.put("rooms", registry.size());
    m.put("connections", handler.connectionCount());
    return m;
  }
}
