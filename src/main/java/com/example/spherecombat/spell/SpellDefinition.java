package com.example.spherecombat.spell;

import com.example.spherecombat.model.Actor;

/**
 * Spell collaborator supplied by the game content layer.
 * The cast pipeline only needs costs, reagents, the effect itself and the reflection rule.
 */
public interface SpellDefinition {

    /** Name used for timing table lookup, e.g. "Explosion" */
    String getName();

    default SpellSchool getSchool() {
        return SpellSchool.MAGERY;
    }

    int getManaCost();

    /**
     * Take every reagent the spell needs from the caster, or none at all.
     * @return false if the caster lacks any reagent; nothing is consumed in that case
     */
    boolean consumeReagents(Actor caster);

    /**
     * Apply the spell's effect. Runs once per successful cast.
     */
    void applyEffect(Actor caster, Actor target);

    /**
     * Whether the target would bounce this spell back onto the caster.
     */
    default boolean hasReflection(Actor target) {
        return isReflectable() && SpellReflection.hasSpellReflection(target);
    }

    /** Harmful single-target spells are reflectable; area and beneficial spells are not */
    default boolean isReflectable() {
        return false;
    }

    /** Delay used when the timing table has no row for this spell */
    default int getBaseDelayMs() {
        return 0;
    }

    /** Spell recovery after a completed cast, applied unless policy removes it */
    default int getRecoveryMs() {
        return 0;
    }
}
