package com.example.spherecombat.model;

/**
 * An equipped weapon, as seen by the timing providers.
 */
public interface Implement {

    /** Art/item id used for the exact-match weapon table lookup */
    int getItemId();

    String getName();

    WeaponClass getWeaponClass();

    /**
     * The weapon's own swing delay for a wielder, as the host game computes it.
     * Only the legacy timing provider uses this; it may throw for broken items.
     */
    int getSwingDelayMs(Actor wielder);
}
