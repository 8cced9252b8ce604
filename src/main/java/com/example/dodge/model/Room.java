package com.example.dodge.model;

import java.util.*;

/**
 * Room model: roster, ready check, level progression, finish/win tracking and death placeholders.
 * GameService synchronizes on Room instances, so this class itself does not add extra locking.
 */
public class Room {

    // ---------------------------------------------------------------------
    // Core identity
    // ---------------------------------------------------------------------

    private final String code;

    /** Player id currently holding host privileges. */
    private String hostId;

    /** Players by id (insertion order preserved; the oldest member inherits the host role). */
    private final Map<String, Player> players = new LinkedHashMap<>();

    /** Set once the registry dropped this room; late callers must not touch it. */
    private boolean closed = false;

    // ---------------------------------------------------------------------
    // Match state
    // ---------------------------------------------------------------------

    private boolean started = false;
    private int currentLevel = 1;

    /** Bumped by every match start; scheduled level advances carry the value they saw. */
    private long matchGeneration = 0;

    /** Wins per player id, kept across levels and across matches in this room. */
    private final Map<String, Integer> levelWins = new LinkedHashMap<>();

    private final Set<String> readyIds = new LinkedHashSet<>();
    private final Set<String> finishedIds = new LinkedHashSet<>();
    private boolean levelDecided = false;

    /** Dead players awaiting revival → position of death. */
    private final Map<String, Position> deathPlaceholders = new LinkedHashMap<>();

    // ---------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------

    public Room(String code, Player host) {
        this.code = Objects.requireNonNull(code, "code");
        Objects.requireNonNull(host, "host");
        players.put(host.getId(), host);
        this.hostId = host.getId();
    }

    // ---------------------------------------------------------------------
    // Basic accessors
    // ---------------------------------------------------------------------

    public String getCode() {
        return code;
    }

    public String getHostId() {
        return hostId;
    }

    public boolean isHost(String playerId) {
        return playerId != null && playerId.equals(hostId);
    }

    public boolean isStarted() {
        return started;
    }

    public int getCurrentLevel() {
        return currentLevel;
    }

    public long getMatchGeneration() {
        return matchGeneration;
    }

    public boolean isClosed() {
        return closed;
    }

    public void markClosed() {
        this.closed = true;
    }

    // ---------------------------------------------------------------------
    // Roster
    // ---------------------------------------------------------------------

    /** Snapshot of the roster in insertion order. */
    public List<Player> getPlayers() {
        return new ArrayList<>(players.values());
    }

    public Player getPlayer(String id) {
        if (id == null) return null;
        return players.get(id);
    }

    public boolean hasPlayer(String id) {
        return id != null && players.containsKey(id);
    }

    public int playerCount() {
        return players.size();
    }

    public boolean isEmpty() {
        return players.isEmpty();
    }

    public void addPlayer(Player p) {
        if (players.containsKey(p.getId())) {
            throw new IllegalArgumentException("Player id already in room " + code + ": " + p.getId());
        }
        players.put(p.getId(), p);
    }

    /**
     * Removes a player together with every per-player trace (ready, finished, death placeholder).
     * Win history is kept. Returns the removed player or null.
     */
    public Player removePlayer(String id) {
        if (id == null) return null;
        Player removed = players.remove(id);
        readyIds.remove(id);
        finishedIds.remove(id);
        deathPlaceholders.remove(id);
        return removed;
    }

    /**
     * Unique player id within this room: {@code name}, {@code name1}, {@code name2}, ...
     */
    public String uniqueIdFor(String requested) {
        String candidate = requested;
        int counter = 1;
        while (players.containsKey(candidate)) {
            candidate = requested + counter;
            counter++;
        }
        return candidate;
    }

    /**
     * If the current host is gone, promote the oldest remaining player.
     * Returns the new host id, or null if nothing changed or nobody is left.
     */
    public String promoteHostIfNecessary() {
        if (hostId != null && players.containsKey(hostId)) return null;
        Iterator<String> it = players.keySet().iterator();
        if (!it.hasNext()) return null;
        hostId = it.next();
        return hostId;
    }

    // ---------------------------------------------------------------------
    // Lobby
    // ---------------------------------------------------------------------

    public void setReady(String id, boolean ready) {
        Player p = players.get(id);
        if (p == null) return;
        p.setReady(ready);
        if (ready) readyIds.add(id);
        else readyIds.remove(id);
    }

    public int readyCount() {
        return readyIds.size();
    }

    public boolean allReady() {
        return readyIds.size() >= players.size();
    }

    public Set<String> getReadyIds() {
        return Collections.unmodifiableSet(readyIds);
    }

    // ---------------------------------------------------------------------
    // Match lifecycle
    // ---------------------------------------------------------------------

    /** Starts (or restarts) a match at level 1. Win history of earlier matches is preserved. */
    public void startMatch() {
        started = true;
        currentLevel = 1;
        matchGeneration++;
        resetLevelState();
        for (String id : players.keySet()) {
            levelWins.putIfAbsent(id, 0);
        }
    }

    /** Moves to the next level and returns its number. */
    public int advanceLevel() {
        currentLevel++;
        resetLevelState();
        return currentLevel;
    }

    /** Ends the match; roster, level and wins stay for the next start. */
    public void endMatch() {
        started = false;
    }

    private void resetLevelState() {
        finishedIds.clear();
        deathPlaceholders.clear();
        levelDecided = false;
        for (Player p : players.values()) {
            p.setAlive(true);
        }
    }

    // ---------------------------------------------------------------------
    // Finish / wins
    // ---------------------------------------------------------------------

    /** Returns false if the player already finished this level. */
    public boolean markFinished(String id) {
        if (!players.containsKey(id)) return false;
        return finishedIds.add(id);
    }

    /**
     * Credits the level win to {@code id} unless the level is already decided.
     * Returns true if this call decided the level.
     */
    public boolean creditLevelWin(String id) {
        if (levelDecided) return false;
        levelDecided = true;
        levelWins.merge(id, 1, Integer::sum);
        return true;
    }

    public int finishedCount() {
        return finishedIds.size();
    }

    public Set<String> getFinishedIds() {
        return Collections.unmodifiableSet(finishedIds);
    }

    public boolean isLevelDecided() {
        return levelDecided;
    }

    /** Copy of the win table. */
    public Map<String, Integer> getLevelWins() {
        return new LinkedHashMap<>(levelWins);
    }

    public int winsOf(String id) {
        return levelWins.getOrDefault(id, 0);
    }

    // ---------------------------------------------------------------------
    // Death / revival
    // ---------------------------------------------------------------------

    public void recordDeath(String id, Position where) {
        Player p = players.get(id);
        if (p == null) return;
        p.setAlive(false);
        p.setPosition(where);
        deathPlaceholders.put(id, where);
    }

    public boolean isDead(String id) {
        return id != null && deathPlaceholders.containsKey(id);
    }

    /** Clears the placeholder and revives the player. Returns the death position, or null if not dead. */
    public Position revive(String id) {
        if (!isDead(id)) return null;
        Position where = deathPlaceholders.remove(id);
        Player p = players.get(id);
        if (p != null) p.setAlive(true);
        return where;
    }

    public Map<String, Position> getDeathPlaceholders() {
        return Collections.unmodifiableMap(deathPlaceholders);
    }
}
