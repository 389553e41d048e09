package com.example.spherecombat.combat;

import com.example.spherecombat.event.CombatEvent;
import com.example.spherecombat.event.CombatEventBus;
import com.example.spherecombat.event.CombatEventType;
import com.example.spherecombat.model.Actor;
import com.example.spherecombat.model.Implement;
import com.example.spherecombat.spell.CastDescriptor;
import com.example.spherecombat.spell.CastState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-actor timers and action locks.
 * <p>
 * Swing and cast always keep their own "next allowed" time. Bandage and wand keep
 * theirs too unless timers are not independent, in which case they share one skill
 * timer. Whether one action blocks or cancels another is decided by the injected
 * {@link CombatPolicy}.
 * All methods take the current time explicitly and must be called from the
 * scheduler's execution context.
 */
public class CombatantTimingState {
    private static final Logger logger = LoggerFactory.getLogger(CombatantTimingState.class);

    private final long serial;
    private final String name;
    private final CombatPolicy policy;
    private final TimingProvider timingProvider;
    private final CombatEventBus events;

    // Independent timers (absolute ms)
    private long nextSwingTime;
    private long nextSpellTime;
    private long nextBandageTime;
    private long nextWandTime;

    /** Shared by bandage and wand when timers are not independent */
    private long nextSkillTime;

    private boolean swingPending;
    private boolean bandaging;
    private boolean usingWand;
    private CastDescriptor activeCast;
    private long lastActionTimestamp;
    private TimingSnapshot lastSwingTiming;

    public CombatantTimingState(Actor actor, CombatPolicy policy, TimingProvider timingProvider,
                                CombatEventBus events, long now) {
        this.serial = actor.getSerial();
        this.name = actor.getName();
        this.policy = policy;
        this.timingProvider = timingProvider;
        this.events = events != null ? events : new CombatEventBus();
        this.lastActionTimestamp = now;
    }

    // ========== Swing ==========

    /**
     * Start swinging at the current combat target.
     * @return the timing used for this swing
     * @throws ActionBlockedException if the swing timer is running or a cast blocks swings
     */
    public TimingSnapshot beginSwing(Actor actor, Implement implement, long now) {
        if (!isReady(ActionKind.SWING, now)) {
            throw block(ActionKind.SWING, "Timer not ready", getRemaining(ActionKind.SWING, now), now);
        }
        String castBlock = castBlockingSwing();
        if (castBlock != null) {
            throw block(ActionKind.SWING, castBlock, 0, now);
        }
        if (policy.isSwingCancelSpell()) {
            interruptCast("Weapon swing");
        }
        if (policy.isActionsCancelBandage()) {
            cancelBandage("Weapon swing");
        }

        TimingSnapshot snapshot = timingProvider.snapshot(actor, implement);
        setNextTime(ActionKind.SWING, now + snapshot.getAttackIntervalMs());
        swingPending = true;
        lastSwingTiming = snapshot;
        lastActionTimestamp = now;
        logTimer("NextSwingTime", snapshot.getAttackIntervalMs());
        events.publish(CombatEventType.SWING_BEGIN, serial, CombatEvent.NO_ACTOR, snapshot.toString(),
                snapshot.getAttackIntervalMs(), now);
        return snapshot;
    }

    /**
     * Whether a pending swing may fire right now: timer elapsed and no cast holding the lock.
     */
    public boolean canFireSwing(long now) {
        return swingPending && isReady(ActionKind.SWING, now) && castBlockingSwing() == null;
    }

    /**
     * Record a swing that just fired and start the next interval.
     * The swing stays pending so auto-attack continues.
     */
    public TimingSnapshot completeSwing(Actor actor, Implement implement, long now) {
        TimingSnapshot snapshot = timingProvider.snapshot(actor, implement);
        setNextTime(ActionKind.SWING, now + snapshot.getAttackIntervalMs());
        lastSwingTiming = snapshot;
        lastActionTimestamp = now;
        logTimer("NextSwingTime", snapshot.getAttackIntervalMs());
        return snapshot;
    }

    private String castBlockingSwing() {
        CastDescriptor cast = activeCast;
        if (cast == null || cast.isTerminal()) {
            return null;
        }
        if (cast.isCasting() && policy.isDisableSwingDuringCast()) {
            return "Currently casting";
        }
        if (cast.isInCastDelay() && policy.isDisableSwingDuringCastDelay()) {
            return "In cast delay";
        }
        return null;
    }

    // ========== Cast ==========

    /**
     * Attach a new cast awaiting its target. Any previous cast is interrupted first.
     * @throws ActionBlockedException if the spell timer is running or a pending swing blocks casting
     */
    public void beginCast(CastDescriptor cast, long now) {
        if (!isReady(ActionKind.CAST, now)) {
            throw block(ActionKind.CAST, "Timer not ready", getRemaining(ActionKind.CAST, now), now);
        }
        if (policy.isDisableCastDuringSwing() && swingPending) {
            throw block(ActionKind.CAST, "Swing pending", 0, now);
        }
        interruptCast("Replaced by new cast");
        if (policy.isSpellCancelSwing()) {
            cancelSwing("Spell cast begun");
        }
        if (policy.isActionsCancelBandage()) {
            cancelBandage("Spell cast begun");
        }
        activeCast = cast;
        lastActionTimestamp = now;
        events.publish(CombatEventType.SPELL_CAST_BEGIN, serial, CombatEvent.NO_ACTOR, cast.getSpell().getName(), now);
    }

    /**
     * Release the cast lock after a cast completed and apply post-cast recovery.
     */
    public void endCast(CastDescriptor cast, long recoveryMs, long now) {
        releaseCast(cast);
        lastActionTimestamp = now;
        if (!policy.isRemovePostCastRecovery() && recoveryMs > 0) {
            setNextTime(ActionKind.CAST, now + recoveryMs);
            logTimer("NextSpellTime", recoveryMs);
        }
    }

    /**
     * Drop the cast reference if it is still the active one.
     */
    public void releaseCast(CastDescriptor cast) {
        if (cast != null && activeCast == cast) {
            activeCast = null;
        }
    }

    // ========== Bandage / Wand ==========

    /**
     * Start applying a bandage. Only the bandage timer, shared with the wand when timers
     * are not independent, can block this.
     */
    public void beginBandage(Actor actor, long now) {
        if (!isReady(ActionKind.BANDAGE, now)) {
            throw block(ActionKind.BANDAGE, "Timer not ready", getRemaining(ActionKind.BANDAGE, now), now);
        }
        if (policy.isBandageCancelActions()) {
            cancelSwing("Bandage use");
            interruptCast("Bandage use");
        }
        bandaging = true;
        setNextTime(ActionKind.BANDAGE, now + policy.getBandageDelayMs());
        lastActionTimestamp = now;
        logTimer("NextBandageTime", policy.getBandageDelayMs());
        events.publish(CombatEventType.BANDAGE_BEGIN, serial, CombatEvent.NO_ACTOR, null, policy.getBandageDelayMs(), now);
    }

    /**
     * Finish the bandage once its timer has run out.
     * @return true if a bandage completed on this call
     */
    public boolean completeBandage(long now) {
        if (!bandaging || !isReady(ActionKind.BANDAGE, now)) {
            return false;
        }
        bandaging = false;
        events.publish(CombatEventType.BANDAGE_COMPLETE, serial, CombatEvent.NO_ACTOR, null, now);
        return true;
    }

    public void beginWandUse(Actor actor, long delayMs, long now) {
        if (!isReady(ActionKind.WAND, now)) {
            throw block(ActionKind.WAND, "Timer not ready", getRemaining(ActionKind.WAND, now), now);
        }
        if (policy.isWandCancelActions()) {
            cancelSwing("Wand use");
            interruptCast("Wand use");
        }
        if (policy.isActionsCancelBandage()) {
            cancelBandage("Wand use");
        }
        usingWand = true;
        setNextTime(ActionKind.WAND, now + Math.max(0, delayMs));
        lastActionTimestamp = now;
        events.publish(CombatEventType.WAND_USE, serial, CombatEvent.NO_ACTOR, null, Math.max(0, delayMs), now);
    }

    public boolean completeWandUse(long now) {
        if (!usingWand || !isReady(ActionKind.WAND, now)) {
            return false;
        }
        usingWand = false;
        events.publish(CombatEventType.WAND_COMPLETE, serial, CombatEvent.NO_ACTOR, null, now);
        return true;
    }

    // ========== Cancellation ==========

    /**
     * Cancel an action. Cancelling something that is not active does nothing.
     * @return true if an active action was cancelled
     */
    public boolean cancel(ActionKind kind, String reason) {
        switch (kind) {
            case SWING: return cancelSwing(reason);
            case CAST: return interruptCast(reason);
            case BANDAGE: return cancelBandage(reason);
            case WAND: return cancelWand(reason);
            default: return false;
        }
    }

    /**
     * Cancel every active action, e.g. on eviction or death.
     */
    public void cancelAll(String reason) {
        for (ActionKind kind : ActionKind.values()) {
            cancel(kind, reason);
        }
    }

    private boolean cancelSwing(String reason) {
        if (!swingPending) return false;
        swingPending = false;
        logCancellation(ActionKind.SWING, reason);
        return true;
    }

    private boolean interruptCast(String reason) {
        CastDescriptor cast = activeCast;
        if (cast == null) return false;
        activeCast = null;
        if (!cast.terminate(CastState.INTERRUPTED, reason)) {
            return false;
        }
        logCancellation(ActionKind.CAST, reason + " (" + cast.getSpell().getName() + ")");
        return true;
    }

    private boolean cancelBandage(String reason) {
        if (!bandaging) return false;
        bandaging = false;
        logCancellation(ActionKind.BANDAGE, reason);
        return true;
    }

    private boolean cancelWand(String reason) {
        if (!usingWand) return false;
        usingWand = false;
        logCancellation(ActionKind.WAND, reason);
        return true;
    }

    /**
     * Reset every timer and interrupt anything in flight.
     */
    public void clearAllTimers() {
        interruptCast("Timers cleared");
        nextSwingTime = 0;
        nextSpellTime = 0;
        nextBandageTime = 0;
        nextWandTime = 0;
        nextSkillTime = 0;
        swingPending = false;
        bandaging = false;
        usingWand = false;
        lastSwingTiming = null;
    }

    // ========== Queries ==========

    /**
     * Pure timing check; never changes state.
     */
    public boolean isReady(ActionKind kind, long now) {
        return getNextTime(kind) <= now;
    }

    public long getRemaining(ActionKind kind, long now) {
        return Math.max(0, getNextTime(kind) - now);
    }

    public long getNextTime(ActionKind kind) {
        switch (kind) {
            case SWING: return nextSwingTime;
            case CAST: return nextSpellTime;
            case BANDAGE: return policy.isIndependentTimers() ? nextBandageTime : nextSkillTime;
            case WAND: return policy.isIndependentTimers() ? nextWandTime : nextSkillTime;
            default: return 0;
        }
    }

    private void setNextTime(ActionKind kind, long time) {
        switch (kind) {
            case SWING: nextSwingTime = time; break;
            case CAST: nextSpellTime = time; break;
            case BANDAGE:
                if (policy.isIndependentTimers()) nextBandageTime = time; else nextSkillTime = time;
                break;
            case WAND:
                if (policy.isIndependentTimers()) nextWandTime = time; else nextSkillTime = time;
                break;
            default: break;
        }
    }

    public long getSerial() { return serial; }
    public String getName() { return name; }
    public CombatPolicy getPolicy() { return policy; }
    public boolean hasPendingSwing() { return swingPending; }
    public boolean isBandaging() { return bandaging; }
    public boolean isUsingWand() { return usingWand; }
    public CastDescriptor getActiveCast() { return activeCast; }
    public TimingSnapshot getLastSwingTiming() { return lastSwingTiming; }
    public long getLastActionTimestamp() { return lastActionTimestamp; }

    public boolean isCasting() {
        return activeCast != null && activeCast.isCasting();
    }

    public boolean isInCastDelay() {
        return activeCast != null && activeCast.isInCastDelay();
    }

    public boolean isBusy() {
        return activeCast != null || bandaging || usingWand;
    }

    /** Mark the actor as active in combat now */
    public void touch(long now) {
        lastActionTimestamp = Math.max(lastActionTimestamp, now);
    }

    public String getStateSummary() {
        return String.format("Cast=%s Delay=%s Bandage=%s Wand=%s Swing=%s",
                isCasting(), isInCastDelay(), bandaging, usingWand, swingPending);
    }

    // ========== Helpers ==========

    private ActionBlockedException block(ActionKind kind, String reason, long remainingMs, long now) {
        logCancellation(kind, "rejected: " + reason);
        events.publish(CombatEventType.ACTION_BLOCKED, serial, CombatEvent.NO_ACTOR, kind.name() + ": " + reason, now);
        return new ActionBlockedException(kind, reason, remainingMs);
    }

    private void logCancellation(ActionKind kind, String reason) {
        if (policy.isLogActionCancellations()) {
            logger.info("[TimingState] {} - {} cancelled: {}", name, kind.getDisplayName(), reason);
        } else {
            logger.debug("[TimingState] {} - {} cancelled: {}", name, kind.getDisplayName(), reason);
        }
    }

    private void logTimer(String timer, long delayMs) {
        if (policy.isLogTimerStateChanges()) {
            logger.info("[TimingState] {} - {} +{}ms", name, timer, delayMs);
        }
    }

    @Override
    public String toString() {
        return String.format("CombatantTimingState[%s #%d %s]", name, serial, getStateSummary());
    }
}
