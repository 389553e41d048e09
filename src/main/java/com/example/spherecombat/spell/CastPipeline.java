package com.example.spherecombat.spell;

import com.example.spherecombat.combat.ActionBlockedException;
import com.example.spherecombat.combat.ActionKind;
import com.example.spherecombat.combat.CombatPolicy;
import com.example.spherecombat.combat.CombatantRoster;
import com.example.spherecombat.combat.CombatantTimingState;
import com.example.spherecombat.event.CombatEventBus;
import com.example.spherecombat.event.CombatEventType;
import com.example.spherecombat.model.Actor;
import com.example.spherecombat.util.TickScheduler;
import com.example.spherecombat.util.TimerToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;

/**
 * Runs spell casts: target first, then resources, then the delay, then the effect.
 * <p>
 * Mana and reagents are taken exactly once, when the target is confirmed. A shortage
 * fizzles the cast with nothing consumed. Once committed, resources are forfeited if the
 * cast is interrupted. The delay timer holds only a weak handle to the cast and checks
 * that it is still live when it fires.
 */
public class CastPipeline {
    private static final Logger logger = LoggerFactory.getLogger(CastPipeline.class);

    private final TickScheduler scheduler;
    private final CombatantRoster roster;
    private final CombatPolicy policy;
    private final SpellTimingTable timings;
    private final CombatEventBus events;

    public CastPipeline(TickScheduler scheduler, CombatantRoster roster, CombatPolicy policy,
                        SpellTimingTable timings, CombatEventBus events) {
        this.scheduler = scheduler;
        this.roster = roster;
        this.policy = policy;
        this.timings = timings != null ? timings : SpellTimingTable.defaults();
        this.events = events;
    }

    /**
     * Start a cast and raise the target cursor.
     * @throws ActionBlockedException if the caster cannot cast now
     */
    public CastDescriptor beginCast(Actor caster, SpellDefinition spell, boolean fromScroll) {
        if (caster == null || spell == null) {
            throw new IllegalArgumentException("caster and spell are required");
        }
        long now = scheduler.now();
        if (caster.isDeleted() || !caster.isAlive()) {
            events.publish(CombatEventType.ACTION_BLOCKED, caster.getSerial(), 0L, "CAST: Caster cannot cast", now);
            throw new ActionBlockedException(ActionKind.CAST, "Caster cannot cast");
        }
        CombatantTimingState timing = roster.register(caster, now);
        CastDescriptor cast = new CastDescriptor(caster, spell, fromScroll, now);
        cast.setTerminationListener(this::onCastEnded);
        timing.beginCast(cast, now);
        logger.debug("[CastPipeline] {} began {}", caster.getName(), spell.getName());
        return cast;
    }

    public CastState confirmTarget(CastDescriptor cast, Actor target) {
        return confirmTarget(cast, target, 0, 1);
    }

    /**
     * Confirm the target: commit resources and start the cast delay.
     * @param target the chosen target; null targets the caster
     * @param tiles area size for field and area spells
     * @param targets number of targets for chaining spells
     * @return the state the cast is in afterwards
     */
    public CastState confirmTarget(CastDescriptor cast, Actor target, int tiles, int targets) {
        if (cast.getState() != CastState.AWAITING_TARGET) {
            return cast.getState();
        }
        long now = scheduler.now();
        Actor caster = cast.getCaster();
        if (caster == null || caster.isDeleted() || !caster.isAlive()) {
            cast.terminate(CastState.INTERRUPTED, "Caster cannot cast");
            return cast.getState();
        }

        cast.setTarget(target != null ? target : caster, tiles, targets);
        cast.advanceTo(CastState.RESOURCE_COMMIT);
        try {
            commitResources(cast, caster);
        } catch (InsufficientResourcesException e) {
            cast.terminate(CastState.FIZZLED, e.getMessage());
            return cast.getState();
        }

        long delay = computeCastDelay(caster, cast);
        cast.advanceTo(CastState.DELAYING);
        if (delay <= 0) {
            resolve(cast);
            return cast.getState();
        }

        WeakReference<CastDescriptor> handle = new WeakReference<>(cast);
        TimerToken token = scheduler.schedule(() -> onDelayExpired(handle), delay);
        cast.setDelayTimer(token, now + delay);
        logger.debug("[CastPipeline] {} casting {} with {}ms delay", caster.getName(), cast.getSpell().getName(), delay);
        return cast.getState();
    }

    /**
     * Check mana, then take reagents (all or nothing), then mana. Any shortage leaves the caster untouched.
     */
    private void commitResources(CastDescriptor cast, Actor caster) {
        SpellDefinition spell = cast.getSpell();
        int mana = Math.max(0, spell.getManaCost());
        if (caster.getMana() < mana) {
            throw new InsufficientResourcesException("Insufficient mana (" + caster.getMana() + "/" + mana + ")");
        }
        if (!cast.isFromScroll() && !spell.consumeReagents(caster)) {
            throw new InsufficientResourcesException("Missing reagents");
        }
        caster.setMana(caster.getMana() - mana);
        cast.markCommitted(mana);
    }

    /**
     * Delay from the timing table when the spell has a row, else the spell's own base delay,
     * clamped to the configured bounds.
     */
    public long computeCastDelay(Actor caster, CastDescriptor cast) {
        SpellDefinition spell = cast.getSpell();
        SpellTimingData row = timings.get(spell.getName());
        long delay;
        if (row != null) {
            double skill = caster.getSkillValue(spell.getSchool().skillName);
            delay = row.calculateDelay(skill, cast.isFromScroll(), cast.getTiles(), cast.getTargetCount());
        } else {
            delay = spell.getBaseDelayMs();
        }
        return Math.max(policy.getMinimumCastDelayMs(), Math.min(policy.getMaximumCastDelayMs(), delay));
    }

    private void onDelayExpired(WeakReference<CastDescriptor> handle) {
        CastDescriptor cast = handle.get();
        if (cast == null || cast.isTerminal()) {
            return;
        }
        resolve(cast);
    }

    private void resolve(CastDescriptor cast) {
        if (!cast.advanceTo(CastState.RESOLVING)) {
            return;
        }
        long now = scheduler.now();
        Actor caster = cast.getCaster();
        Actor target = cast.getTarget();
        try {
            validate(caster, target);
        } catch (TargetInvalidException e) {
            cast.terminate(CastState.INTERRUPTED, e.getMessage());
            return;
        }

        SpellDefinition spell = cast.getSpell();
        Actor recipient = target;
        if (target != caster && spell.hasReflection(target)) {
            recipient = caster;
            logger.debug("[CastPipeline] {} reflected from {} back to {}", spell.getName(), target.getName(), caster.getName());
            events.publish(CombatEventType.SPELL_REFLECTED, caster.getSerial(), target.getSerial(), spell.getName(), now);
        }

        try {
            spell.applyEffect(caster, recipient);
        } catch (RuntimeException e) {
            logger.warn("[CastPipeline] Effect of {} failed for {}: {}", spell.getName(), caster.getName(), e.getMessage(), e);
            cast.terminate(CastState.INTERRUPTED, "Effect failed: " + e.getMessage());
            return;
        }

        CombatantTimingState timing = roster.get(caster);
        if (timing != null) {
            timing.endCast(cast, spell.getRecoveryMs(), now);
        }
        cast.terminate(CastState.APPLIED, null);
    }

    private static void validate(Actor caster, Actor target) {
        if (caster == null || caster.isDeleted() || !caster.isAlive()) {
            throw new TargetInvalidException("Caster can no longer cast");
        }
        if (target == null || target.isDeleted()) {
            throw new TargetInvalidException("Target no longer exists");
        }
        if (!target.isAlive()) {
            throw new TargetInvalidException("Target is dead");
        }
        if (target != caster && !caster.hasLineOfSightTo(target)) {
            throw new TargetInvalidException("Target is not in line of sight");
        }
    }

    // ========== Interruption ==========

    /**
     * Interrupt the caster's active cast. No active cast is a no-op.
     * Committed mana and reagents are not refunded.
     */
    public boolean interrupt(Actor caster, String reason) {
        CombatantTimingState timing = roster.get(caster);
        return timing != null && timing.cancel(ActionKind.CAST, reason);
    }

    /**
     * Something disturbed the caster. Damage only counts when the policy allows damage fizzles;
     * a damage fizzle before commitment costs the partial-mana share.
     */
    public boolean disturb(Actor caster, DisturbType type) {
        CombatantTimingState timing = roster.get(caster);
        if (timing == null) return false;
        CastDescriptor cast = timing.getActiveCast();
        if (cast == null || cast.isTerminal()) return false;

        if (type == DisturbType.DAMAGE) {
            if (!policy.damageDisturbsCast()) {
                return false;
            }
            if (!cast.isResourcesCommitted()) {
                int charge = Math.min(caster.getMana(), policy.calculatePartialMana(cast.getSpell().getManaCost()));
                caster.setMana(caster.getMana() - charge);
            }
            return timing.cancel(ActionKind.CAST, "Disturbed by damage");
        }
        return timing.cancel(ActionKind.CAST, "Disturbed: " + type.name().toLowerCase());
    }

    /** The caster's cast in flight, or null */
    public CastDescriptor getActiveCast(Actor caster) {
        CombatantTimingState timing = roster.get(caster);
        return timing != null ? timing.getActiveCast() : null;
    }

    private void onCastEnded(CastDescriptor cast) {
        long now = scheduler.now();
        Actor caster = cast.getCaster();
        if (caster != null) {
            CombatantTimingState timing = roster.get(caster);
            if (timing != null) {
                timing.releaseCast(cast);
            }
        }
        String spellName = cast.getSpell().getName();
        switch (cast.getState()) {
            case APPLIED:
                events.publish(CombatEventType.SPELL_CAST_COMPLETE, cast.getCasterSerial(), cast.getTargetSerial(), spellName, now);
                break;
            case FIZZLED:
                logger.debug("[CastPipeline] {} fizzled: {}", cast, cast.getFailureReason());
                events.publish(CombatEventType.SPELL_FIZZLED, cast.getCasterSerial(), cast.getTargetSerial(),
                        spellName + ": " + cast.getFailureReason(), now);
                break;
            case INTERRUPTED:
                logger.debug("[CastPipeline] {} interrupted: {}", cast, cast.getFailureReason());
                events.publish(CombatEventType.SPELL_INTERRUPTED, cast.getCasterSerial(), cast.getTargetSerial(),
                        spellName + ": " + cast.getFailureReason(), now);
                break;
            default:
                break;
        }
    }
}
