package com.example.spherecombat.spell;

/**
 * Spell schools; each names the skill that speeds its casts.
 */
public enum SpellSchool {
    MAGERY("Magery", "Magery"),
    NECROMANCY("Necromancy", "Necromancy"),
    CHIVALRY("Chivalry", "Chivalry"),
    BUSHIDO("Bushido", "Bushido"),
    NINJITSU("Ninjitsu", "Ninjitsu");

    public final String displayName;
    public final String skillName;

    SpellSchool(String displayName, String skillName) {
        this.displayName = displayName;
        this.skillName = skillName;
    }

    /**
     * Parse school from string (case-insensitive). Unknown names map to MAGERY.
     */
    public static SpellSchool fromString(String s) {
        if (s == null || s.isEmpty()) return MAGERY;
        try {
            return valueOf(s.toUpperCase().trim());
        } catch (IllegalArgumentException e) {
            return MAGERY;
        }
    }
}
