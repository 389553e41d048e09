package com.example.spherecombat.spell;

/**
 * What disturbed a cast in progress.
 */
public enum DisturbType {
    /** Caster took damage; only counts when damage fizzles are enabled */
    DAMAGE,
    /** Caster used an action that cancels casting */
    ACTION,
    /** Caster was paralyzed or otherwise lost control */
    PARALYSIS,
    /** Caster died or logged out */
    REMOVED
}
