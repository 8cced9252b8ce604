package com.example.dodge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties("app.game")
public class GameProperties {

  /** Room capacity. */
  private int maxPlayers = 10;

  /** Levels per match; advancing past this ends the match. */
  private int levelCount = 20;

  /** Delay between the first finisher of a level and the next level. */
  private long levelAdvanceDelayMs = 3000L;

  /** Attempts at drawing an unused room code before giving up. */
  private int codeMaxAttempts = 1000;

  private double spawnX = 360;
  private double spawnY = 400;

  private String hostColor = "#4dff7c";
  private String guestColor = "#ff6b6b";

  // --- getters/setters ---

  public int getMaxPlayers() { return maxPlayers; }
  public void setMaxPlayers(int maxPlayers) { this.maxPlayers = maxPlayers; }

  public int getLevelCount() { return levelCount; }
  public void setLevelCount(int levelCount) { this.levelCount = levelCount; }

  public long getLevelAdvanceDelayMs() { return levelAdvanceDelayMs; }
  public void setLevelAdvanceDelayMs(long levelAdvanceDelayMs) { this.levelAdvanceDelayMs = levelAdvanceDelayMs; }

  public int getCodeMaxAttempts() { return codeMaxAttempts; }
  public void setCodeMaxAttempts(int codeMaxAttempts) { this.codeMaxAttempts = codeMaxAttempts; }

  public double getSpawnX() { return spawnX; }
  public void setSpawnX(double spawnX) { this.spawnX = spawnX; }

  public double getSpawnY() { return spawnY; }
  public void setSpawnY(double spawnY) { this.spawnY = spawnY; }

  public String getHostColor() { return hostColor; }
  public void setHostColor(String hostColor) { this.hostColor = hostColor; }

  public String getGuestColor() { return guestColor; }
  public void setGuestColor(String guestColor) { this.guestColor = guestColor; }
}
