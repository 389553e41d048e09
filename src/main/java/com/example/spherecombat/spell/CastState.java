package com.example.spherecombat.spell;

/**
 * Progress of one spell cast.
 */
public enum CastState {

    /** Target cursor is up; nothing has been spent */
    AWAITING_TARGET("Awaiting target", false),

    /** Target chosen; mana and reagents being taken */
    RESOURCE_COMMIT("Committing resources", false),

    /** Resources spent; waiting out the cast delay */
    DELAYING("Delaying", false),

    /** Delay expired; re-validating and applying */
    RESOLVING("Resolving", false),

    APPLIED("Applied", true),
    FIZZLED("Fizzled", true),
    INTERRUPTED("Interrupted", true);

    private final String displayName;
    private final boolean terminal;

    CastState(String displayName, boolean terminal) {
        this.displayName = displayName;
        this.terminal = terminal;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
