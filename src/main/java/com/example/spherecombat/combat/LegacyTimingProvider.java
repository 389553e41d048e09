package com.example.spherecombat.combat;

import com.example.spherecombat.model.Actor;
import com.example.spherecombat.model.Implement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Timing from the host game's own weapon formula.
 * Animation values fall back to the weapon class defaults.
 */
public class LegacyTimingProvider implements TimingProvider {
    private static final Logger logger = LoggerFactory.getLogger(LegacyTimingProvider.class);

    public static final String NAME = "legacy";

    /** Interval used when there is no attacker */
    static final int NO_ATTACKER_MS = 700;

    /** Interval used when the weapon cannot report its own delay */
    static final int FALLBACK_MS = 1500;

    @Override
    public int getAttackIntervalMs(Actor actor, Implement implement) {
        if (actor == null) {
            return NO_ATTACKER_MS;
        }
        if (implement == null) {
            return FALLBACK_MS;
        }
        try {
            int delay = implement.getSwingDelayMs(actor);
            return delay > 0 ? delay : FALLBACK_MS;
        } catch (RuntimeException e) {
            logger.warn("[LegacyTiming] Failed to get attack interval for {}, using fallback", actor.getName(), e);
            return FALLBACK_MS;
        }
    }

    @Override
    public int getAnimationHitOffsetMs(Implement implement) {
        return classDefault(implement).getAnimationHitOffsetMs();
    }

    @Override
    public int getAnimationDurationMs(Implement implement) {
        return classDefault(implement).getAnimationDurationMs();
    }

    @Override
    public String getProviderName() {
        return NAME;
    }

    private static WeaponEntry classDefault(Implement implement) {
        return implement == null ? WeaponEntry.DEFAULT : WeaponEntry.forClass(implement.getWeaponClass());
    }
}
