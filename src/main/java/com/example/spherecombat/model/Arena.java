package com.example.spherecombat.model;

/**
 * A duel arena: a protected region with numbered spawn points.
 * The busy flag is the arena lock; at most one duel runs in an arena at a time.
 */
public class Arena {
    private final String name;
    private final int spawnPointCount;
    private final int maxPlayers;
    private volatile boolean busy;

    public Arena(String name, int spawnPointCount, int maxPlayers) {
        this.name = name;
        this.spawnPointCount = Math.max(0, spawnPointCount);
        this.maxPlayers = Math.max(2, maxPlayers);
    }

    public String getName() { return name; }
    public int getSpawnPointCount() { return spawnPointCount; }
    public int getMaxPlayers() { return maxPlayers; }

    /**
     * An arena needs at least two spawn points to host a duel.
     */
    public boolean isConfigured() {
        return spawnPointCount >= 2;
    }

    public boolean isBusy() { return busy; }
    public void setBusy(boolean busy) { this.busy = busy; }

    @Override
    public String toString() {
        return String.format("Arena[%s spawns=%d max=%d busy=%s]", name, spawnPointCount, maxPlayers, busy);
    }
}
