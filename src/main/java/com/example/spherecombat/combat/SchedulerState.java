package com.example.spherecombat.combat;

/**
 * Lifecycle of the global pulse.
 */
public enum SchedulerState {

    /** Constructed; registrations accepted but no ticks run */
    UNINITIALIZED("Uninitialized"),

    /** Periodic tick scheduled */
    RUNNING("Running"),

    /** Tick cancelled; cannot be restarted */
    STOPPED("Stopped");

    private final String displayName;

    SchedulerState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
