package com.example.spherecombat.combat;

import com.example.spherecombat.model.Actor;
import com.example.spherecombat.model.Implement;

/**
 * Combat-resolution collaborator: decides hit or miss and applies damage.
 */
@FunctionalInterface
public interface SwingResolver {

    /**
     * Called once the swing animation reaches its hit frame.
     */
    void resolveHit(Actor attacker, Actor defender, Implement implement);
}
