package com.example.spherecombat.combat;

import com.example.spherecombat.model.Actor;
import com.example.spherecombat.model.Implement;

/**
 * Data-driven swing timing.
 * The interval comes from the weapon's speed value, scaled by the attacker's dexterity
 * around a baseline of 100 and snapped to the 50 ms pulse.
 */
public class WeaponTimingProvider implements TimingProvider {

    public static final String NAME = "weapon";

    static final int DEX_BASELINE = 100;
    static final double HIGH_DEX_MODIFIER = 0.008;
    static final double LOW_DEX_MODIFIER = 0.004;
    static final int MAX_DEX_BONUS = 25;
    static final int MAX_DEX_PENALTY = -50;
    static final int TICK_MS = 50;
    static final int MIN_MS = 200;
    static final int MAX_MS = 4000;

    private final WeaponTimingTable table;

    public WeaponTimingProvider(WeaponTimingTable table) {
        this.table = table != null ? table : WeaponTimingTable.empty();
    }

    @Override
    public int getAttackIntervalMs(Actor actor, Implement implement) {
        if (actor == null) {
            return MIN_MS;
        }
        WeaponEntry entry = table.lookup(implement);
        double baseDelayMs = entry.getWeaponSpeedValue() * 40.0;

        int bonusDex = 0;
        if (actor.isPlayer()) {
            bonusDex = actor.getDexterity() - DEX_BASELINE;
            bonusDex = Math.max(MAX_DEX_PENALTY, Math.min(MAX_DEX_BONUS, bonusDex));
        }

        double dexMultiplier = 1.0;
        if (bonusDex > 0) {
            dexMultiplier -= bonusDex * HIGH_DEX_MODIFIER;
        } else if (bonusDex < 0) {
            dexMultiplier -= bonusDex * LOW_DEX_MODIFIER;
        }

        // half-even, so 12.5 ticks lands on 12
        int result = (int) Math.rint(baseDelayMs * dexMultiplier / TICK_MS) * TICK_MS;
        return Math.max(MIN_MS, Math.min(MAX_MS, result));
    }

    @Override
    public int getAnimationHitOffsetMs(Implement implement) {
        return table.lookup(implement).getAnimationHitOffsetMs();
    }

    @Override
    public int getAnimationDurationMs(Implement implement) {
        return table.lookup(implement).getAnimationDurationMs();
    }

    @Override
    public String getProviderName() {
        return NAME;
    }

    public WeaponTimingTable getTable() {
        return table;
    }
}
