package com.example.spherecombat.model;

/**
 * Broad weapon families used to pick default timing when a weapon has no table entry.
 */
public enum WeaponClass {
    DAGGER("Dagger"),
    ONE_HANDED("One-handed"),
    TWO_HANDED("Two-handed"),
    BOW("Bow"),
    CROSSBOW("Crossbow"),
    WRESTLING("Wrestling");

    private final String displayName;

    WeaponClass(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parse a class name from config (case-insensitive).
     * @return the matching class, or null if unknown
     */
    public static WeaponClass fromString(String s) {
        if (s == null || s.isEmpty()) return null;
        String key = s.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        for (WeaponClass wc : values()) {
            if (wc.name().equals(key)) return wc;
        }
        return null;
    }
}
