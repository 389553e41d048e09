package com.example.spherecombat.combat;

import com.example.spherecombat.model.WeaponClass;

/**
 * One row of weapon timing data.
 * Higher speed values mean slower weapons: the base interval is speed * 40 ms.
 */
public final class WeaponEntry {

    /** Fallback for anything without a table row or class default */
    public static final WeaponEntry DEFAULT = new WeaponEntry(-1, "Default", 50, 1600, 300, 600);

    public static final WeaponEntry DAGGER = new WeaponEntry(-1, "Dagger", 20, 1600, 200, 400);
    public static final WeaponEntry ONE_HANDED = new WeaponEntry(-1, "OneHandedSword", 35, 1600, 300, 600);
    public static final WeaponEntry TWO_HANDED = new WeaponEntry(-1, "TwoHanded", 75, 1900, 400, 800);
    public static final WeaponEntry BOW = new WeaponEntry(-1, "Bow", 45, 2000, 500, 900);
    public static final WeaponEntry CROSSBOW = new WeaponEntry(-1, "Crossbow", 50, 2000, 600, 1100);

    private final int itemId;
    private final String name;
    private final int weaponSpeedValue;
    private final int weaponBaseMs;
    private final int animationHitOffsetMs;
    private final int animationDurationMs;

    public WeaponEntry(int itemId, String name, int weaponSpeedValue, int weaponBaseMs,
                       int animationHitOffsetMs, int animationDurationMs) {
        this.itemId = itemId;
        this.name = name != null ? name : "";
        this.weaponSpeedValue = weaponSpeedValue;
        this.weaponBaseMs = weaponBaseMs;
        this.animationHitOffsetMs = Math.max(0, animationHitOffsetMs);
        this.animationDurationMs = Math.max(0, animationDurationMs);
    }

    public int getItemId() { return itemId; }
    public String getName() { return name; }
    public int getWeaponSpeedValue() { return weaponSpeedValue; }
    public int getWeaponBaseMs() { return weaponBaseMs; }
    public int getAnimationHitOffsetMs() { return animationHitOffsetMs; }
    public int getAnimationDurationMs() { return animationDurationMs; }

    /**
     * Default timing row for a weapon class.
     */
    public static WeaponEntry forClass(WeaponClass weaponClass) {
        if (weaponClass == null) return DEFAULT;
        switch (weaponClass) {
            case DAGGER: return DAGGER;
            case ONE_HANDED: return ONE_HANDED;
            case TWO_HANDED: return TWO_HANDED;
            case BOW: return BOW;
            case CROSSBOW: return CROSSBOW;
            default: return DEFAULT;
        }
    }

    @Override
    public String toString() {
        return String.format("WeaponEntry[%s id=0x%X speed=%d base=%dms hit=%dms anim=%dms]",
                name, itemId, weaponSpeedValue, weaponBaseMs, animationHitOffsetMs, animationDurationMs);
    }
}
