package com.example.spherecombat.audit;

/**
 * How much the combat audit records. Each level includes everything below it.
 */
public enum AuditLevel {

    /** Nothing is recorded */
    NONE("None"),

    /** Swings, hits and spell outcomes with their timing */
    STANDARD("Standard"),

    /** Adds bandages, wands and rejected actions */
    DETAILED("Detailed"),

    /** Adds roster changes, throttle events and shadow comparisons */
    DEBUG("Debug");

    private final String displayName;

    AuditLevel(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Whether an entry needing {@code required} is recorded at this level.
     */
    public boolean includes(AuditLevel required) {
        return this != NONE && ordinal() >= required.ordinal();
    }
}
