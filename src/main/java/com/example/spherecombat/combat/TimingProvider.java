package com.example.spherecombat.combat;

import com.example.spherecombat.model.Actor;
import com.example.spherecombat.model.Implement;

/**
 * Maps an attacker and their weapon to swing timing.
 * Implementations are pure and must not throw: unknown weapons resolve to a default.
 * One implementation is chosen at startup and kept for the life of the engine.
 */
public interface TimingProvider {

    /**
     * Milliseconds between two swings.
     * @param actor the attacker, may be null
     * @param implement equipped weapon, null for unarmed
     */
    int getAttackIntervalMs(Actor actor, Implement implement);

    /** Milliseconds from swing start until the hit lands */
    int getAnimationHitOffsetMs(Implement implement);

    /** Length of the swing animation in milliseconds */
    int getAnimationDurationMs(Implement implement);

    String getProviderName();

    default TimingSnapshot snapshot(Actor actor, Implement implement) {
        return new TimingSnapshot(
                getAttackIntervalMs(actor, implement),
                getAnimationHitOffsetMs(implement),
                getAnimationDurationMs(implement));
    }
}
