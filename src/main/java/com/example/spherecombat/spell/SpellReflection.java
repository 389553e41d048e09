package com.example.spherecombat.spell;

import com.example.spherecombat.model.Actor;

/**
 * Magic reflect checks shared by spells.
 */
public final class SpellReflection {

    private SpellReflection() {}

    /**
     * A target reflects while it has magic-reflect charge left.
     */
    public static boolean hasSpellReflection(Actor target) {
        return target != null && target.getMagicDamageAbsorb() > 0;
    }
}
