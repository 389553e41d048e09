package com.example.spherecombat.combat;

/**
 * The independently timed actions a combatant can take.
 */
public enum ActionKind {
    SWING("Weapon swing"),
    CAST("Spell cast"),
    BANDAGE("Bandaging"),
    WAND("Wand use");

    private final String displayName;

    ActionKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
