package com.example.dodge.config;

import com.example.dodge.handler.GameWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private final GameWebSocketHandler handler;
  private final List<String> originPatterns;
  private final String wsPath;

  public WebSocketConfig(
      GameWebSocketHandler handler,
      @Value("${app.websocket.path:/ws}") String wsPath,
      // CSV list of origin patterns; game clients are not browsers-only, so * by default
      @Value("${app.websocket.allowed-origins:*}") String originsCsv
  ) {
    this.handler = handler;
    this.wsPath = wsPath;
    this.originPatterns = parseOrigins(originsCsv);
  }

  static List<String> parseOrigins(String originsCsv) {
    if (originsCsv == null) return List.of("*");
    List<String> list = Arrays.stream(originsCsv.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .flatMap(WebSocketConfig::withLocalVariants)
        .distinct()
        .collect(Collectors.toList());
    return list.isEmpty() ? List.of("*") : list;
  }

  // a local dev client may be served from any port, on either loopback name
  private static Stream<String> withLocalVariants(String origin) {
    if (!origin.startsWith("http://localhost")) return Stream.of(origin);
    return Stream.of(origin, "http://localhost:*", "http://127.0.0.1:*");
  }

  @Override
  public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
    registry.addHandler(handler, wsPath)
            .setAllowedOriginPatterns(originPatterns.toArray(String[]::new));
  }
}
