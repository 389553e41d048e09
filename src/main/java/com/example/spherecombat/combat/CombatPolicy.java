package com.example.spherecombat.combat;

import com.example.spherecombat.config.ConfigurationException;

/**
 * Immutable cross-cancellation matrix and timing limits, read once at startup.
 * Changing any toggle requires building a new engine.
 */
public final class CombatPolicy {

    /** Swing, cast and wand decay on separate timers (bandage always does) */
    private final boolean independentTimers;
    /** Starting a cast cancels a pending swing */
    private final boolean spellCancelSwing;
    /** Starting a swing interrupts the active cast */
    private final boolean swingCancelSpell;
    /** Bandaging cancels the pending swing and the active cast */
    private final boolean bandageCancelActions;
    /** Wand use cancels the pending swing and the active cast */
    private final boolean wandCancelActions;
    /** Swings are rejected while a cast awaits its target */
    private final boolean disableSwingDuringCast;
    /** Swings are rejected while a cast is in its delay */
    private final boolean disableSwingDuringCastDelay;
    /** Casts are rejected while a swing is pending */
    private final boolean disableCastDuringSwing;
    /** Starting a swing, cast or wand ends an in-progress bandage */
    private final boolean actionsCancelBandage;
    /** No spell recovery after a completed cast */
    private final boolean removePostCastRecovery;
    /** Damage may disturb a cast */
    private final boolean damageBasedFizzle;
    /** Only explicit actions may disturb a cast, never damage */
    private final boolean restrictedFizzleTriggers;
    /** Share of the mana cost charged when damage disturbs a cast before commit, 0-100 */
    private final int partialManaPercent;
    private final long minimumCastDelayMs;
    private final long maximumCastDelayMs;
    private final long bandageDelayMs;
    private final long globalTickMs;
    private final long combatIdleTimeoutMs;
    private final String timingProvider;
    private final boolean logActionCancellations;
    private final boolean logTimerStateChanges;

    private CombatPolicy(Builder b) {
        this.independentTimers = b.independentTimers;
        this.spellCancelSwing = b.spellCancelSwing;
        this.swingCancelSpell = b.swingCancelSpell;
        this.bandageCancelActions = b.bandageCancelActions;
        this.wandCancelActions = b.wandCancelActions;
        this.disableSwingDuringCast = b.disableSwingDuringCast;
        this.disableSwingDuringCastDelay = b.disableSwingDuringCastDelay;
        this.disableCastDuringSwing = b.disableCastDuringSwing;
        this.actionsCancelBandage = b.actionsCancelBandage;
        this.removePostCastRecovery = b.removePostCastRecovery;
        this.damageBasedFizzle = b.damageBasedFizzle;
        this.restrictedFizzleTriggers = b.restrictedFizzleTriggers;
        this.partialManaPercent = Math.max(0, Math.min(100, b.partialManaPercent));
        this.minimumCastDelayMs = b.minimumCastDelayMs;
        this.maximumCastDelayMs = b.maximumCastDelayMs;
        this.bandageDelayMs = b.bandageDelayMs;
        this.globalTickMs = b.globalTickMs;
        this.combatIdleTimeoutMs = b.combatIdleTimeoutMs;
        this.timingProvider = b.timingProvider;
        this.logActionCancellations = b.logActionCancellations;
        this.logTimerStateChanges = b.logTimerStateChanges;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Policy with every default, as shipped in combat.yaml */
    public static CombatPolicy defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Reject values the engine cannot run with.
     */
    public CombatPolicy validate() throws ConfigurationException {
        if (globalTickMs <= 0) {
            throw new ConfigurationException("globalTickMs must be positive, got " + globalTickMs);
        }
        if (combatIdleTimeoutMs <= 0) {
            throw new ConfigurationException("combatIdleTimeoutMs must be positive, got " + combatIdleTimeoutMs);
        }
        if (minimumCastDelayMs < 0) {
            throw new ConfigurationException("minimumCastDelayMs must not be negative, got " + minimumCastDelayMs);
        }
        if (maximumCastDelayMs < minimumCastDelayMs) {
            throw new ConfigurationException("maximumCastDelayMs (" + maximumCastDelayMs
                    + ") is below minimumCastDelayMs (" + minimumCastDelayMs + ")");
        }
        if (bandageDelayMs < 0) {
            throw new ConfigurationException("bandageDelayMs must not be negative, got " + bandageDelayMs);
        }
        if (timingProvider == null || timingProvider.isBlank()) {
            throw new ConfigurationException("timingProvider must be set");
        }
        return this;
    }

    /**
     * Mana charged for a partial fizzle.
     */
    public int calculatePartialMana(int totalMana) {
        return totalMana * partialManaPercent / 100;
    }

    /**
     * Damage disturbs a cast only when damage fizzles are on and not restricted to actions.
     */
    public boolean damageDisturbsCast() {
        return damageBasedFizzle && !restrictedFizzleTriggers;
    }

    public boolean isIndependentTimers() { return independentTimers; }
    public boolean isSpellCancelSwing() { return spellCancelSwing; }
    public boolean isSwingCancelSpell() { return swingCancelSpell; }
    public boolean isBandageCancelActions() { return bandageCancelActions; }
    public boolean isWandCancelActions() { return wandCancelActions; }
    public boolean isDisableSwingDuringCast() { return disableSwingDuringCast; }
    public boolean isDisableSwingDuringCastDelay() { return disableSwingDuringCastDelay; }
    public boolean isDisableCastDuringSwing() { return disableCastDuringSwing; }
    public boolean isActionsCancelBandage() { return actionsCancelBandage; }
    public boolean isRemovePostCastRecovery() { return removePostCastRecovery; }
    public boolean isDamageBasedFizzle() { return damageBasedFizzle; }
    public boolean isRestrictedFizzleTriggers() { return restrictedFizzleTriggers; }
    public int getPartialManaPercent() { return partialManaPercent; }
    public long getMinimumCastDelayMs() { return minimumCastDelayMs; }
    public long getMaximumCastDelayMs() { return maximumCastDelayMs; }
    public long getBandageDelayMs() { return bandageDelayMs; }
    public long getGlobalTickMs() { return globalTickMs; }
    public long getCombatIdleTimeoutMs() { return combatIdleTimeoutMs; }
    public String getTimingProvider() { return timingProvider; }
    public boolean isLogActionCancellations() { return logActionCancellations; }
    public boolean isLogTimerStateChanges() { return logTimerStateChanges; }

    @Override
    public String toString() {
        return String.format("CombatPolicy[provider=%s tick=%dms idle=%dms independent=%s "
                        + "spellCancelSwing=%s swingCancelSpell=%s noSwingInCast=%s noSwingInDelay=%s]",
                timingProvider, globalTickMs, combatIdleTimeoutMs, independentTimers,
                spellCancelSwing, swingCancelSpell, disableSwingDuringCast, disableSwingDuringCastDelay);
    }

    /**
     * Mutable builder; defaults match the classic shard rules.
     */
    public static final class Builder {
        private boolean independentTimers = true;
        private boolean spellCancelSwing = true;
        private boolean swingCancelSpell = true;
        private boolean bandageCancelActions = true;
        private boolean wandCancelActions = true;
        private boolean disableSwingDuringCast = true;
        private boolean disableSwingDuringCastDelay = true;
        private boolean disableCastDuringSwing = false;
        private boolean actionsCancelBandage = false;
        private boolean removePostCastRecovery = true;
        private boolean damageBasedFizzle = false;
        private boolean restrictedFizzleTriggers = true;
        private int partialManaPercent = 50;
        private long minimumCastDelayMs = 0;
        private long maximumCastDelayMs = 10_000;
        private long bandageDelayMs = 5_000;
        private long globalTickMs = 50;
        private long combatIdleTimeoutMs = 5_000;
        private String timingProvider = WeaponTimingProvider.NAME;
        private boolean logActionCancellations = false;
        private boolean logTimerStateChanges = false;

        private Builder() {}

        private Builder(CombatPolicy p) {
            this.independentTimers = p.independentTimers;
            this.spellCancelSwing = p.spellCancelSwing;
            this.swingCancelSpell = p.swingCancelSpell;
            this.bandageCancelActions = p.bandageCancelActions;
            this.wandCancelActions = p.wandCancelActions;
            this.disableSwingDuringCast = p.disableSwingDuringCast;
            this.disableSwingDuringCastDelay = p.disableSwingDuringCastDelay;
            this.disableCastDuringSwing = p.disableCastDuringSwing;
            this.actionsCancelBandage = p.actionsCancelBandage;
            this.removePostCastRecovery = p.removePostCastRecovery;
            this.damageBasedFizzle = p.damageBasedFizzle;
            this.restrictedFizzleTriggers = p.restrictedFizzleTriggers;
            this.partialManaPercent = p.partialManaPercent;
            this.minimumCastDelayMs = p.minimumCastDelayMs;
            this.maximumCastDelayMs = p.maximumCastDelayMs;
            this.bandageDelayMs = p.bandageDelayMs;
            this.globalTickMs = p.globalTickMs;
            this.combatIdleTimeoutMs = p.combatIdleTimeoutMs;
            this.timingProvider = p.timingProvider;
            this.logActionCancellations = p.logActionCancellations;
            this.logTimerStateChanges = p.logTimerStateChanges;
        }

        public Builder independentTimers(boolean v) { this.independentTimers = v; return this; }
        public Builder spellCancelSwing(boolean v) { this.spellCancelSwing = v; return this; }
        public Builder swingCancelSpell(boolean v) { this.swingCancelSpell = v; return this; }
        public Builder bandageCancelActions(boolean v) { this.bandageCancelActions = v; return this; }
        public Builder wandCancelActions(boolean v) { this.wandCancelActions = v; return this; }
        public Builder disableSwingDuringCast(boolean v) { this.disableSwingDuringCast = v; return this; }
        public Builder disableSwingDuringCastDelay(boolean v) { this.disableSwingDuringCastDelay = v; return this; }
        public Builder disableCastDuringSwing(boolean v) { this.disableCastDuringSwing = v; return this; }
        public Builder actionsCancelBandage(boolean v) { this.actionsCancelBandage = v; return this; }
        public Builder removePostCastRecovery(boolean v) { this.removePostCastRecovery = v; return this; }
        public Builder damageBasedFizzle(boolean v) { this.damageBasedFizzle = v; return this; }
        public Builder restrictedFizzleTriggers(boolean v) { this.restrictedFizzleTriggers = v; return this; }
        public Builder partialManaPercent(int v) { this.partialManaPercent = v; return this; }
        public Builder minimumCastDelayMs(long v) { this.minimumCastDelayMs = v; return this; }
        public Builder maximumCastDelayMs(long v) { this.maximumCastDelayMs = v; return this; }
        public Builder bandageDelayMs(long v) { this.bandageDelayMs = v; return this; }
        public Builder globalTickMs(long v) { this.globalTickMs = v; return this; }
        public Builder combatIdleTimeoutMs(long v) { this.combatIdleTimeoutMs = v; return this; }
        public Builder timingProvider(String v) { this.timingProvider = v; return this; }
        public Builder logActionCancellations(boolean v) { this.logActionCancellations = v; return this; }
        public Builder logTimerStateChanges(boolean v) { this.logTimerStateChanges = v; return this; }

        public CombatPolicy build() {
            return new CombatPolicy(this);
        }
    }
}
