package com.example.spherecombat.duel;

/**
 * Lifecycle of a duel context. A challenge that has not been accepted yet has no context.
 */
public enum DuelState {

    /** Context created, participants gathering */
    WAITING("Waiting"),

    /** Participants teleported and frozen, counting down */
    COUNTDOWN("Countdown"),

    /** Fighting */
    IN_PROGRESS("In Progress"),

    /** Outcome decided, settling */
    ENDING("Ending"),

    /** Loot duels only: the winner may loot before cleanup */
    LOOT_PHASE("Loot Phase"),

    /** Cleaned up; arena released */
    COMPLETED("Completed");

    private final String displayName;

    DuelState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** True once the outcome has been decided */
    public boolean isFinished() {
        return this == ENDING || this == LOOT_PHASE || this == COMPLETED;
    }
}
