package com.example.spherecombat.combat;

import com.example.spherecombat.event.CombatEvent;
import com.example.spherecombat.event.CombatEventBus;
import com.example.spherecombat.event.CombatEventType;
import com.example.spherecombat.model.Actor;
import com.example.spherecombat.model.Implement;
import com.example.spherecombat.util.TickScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.DoubleConsumer;

/**
 * One fixed-rate clock for every combatant's swing timer.
 * <p>
 * Each tick walks a snapshot of the roster: due hits are resolved, ready swings fire and
 * re-arm, finished bandages and wand uses complete, and idle actors are evicted. A failure
 * for one actor is logged as a {@link SchedulerFaultException} and the tick moves on to
 * the next actor. Tick durations feed {@link PulseMetrics}.
 */
public class GlobalPulseScheduler {
    private static final Logger logger = LoggerFactory.getLogger(GlobalPulseScheduler.class);

    static final String TASK_NAME = "global-pulse";

    private final TickScheduler scheduler;
    private final CombatantRoster roster;
    private final CombatPolicy policy;
    private final SwingResolver swingResolver;
    private final CombatEventBus events;
    private final PulseMetrics metrics = new PulseMetrics();
    private final List<DoubleConsumer> tickObservers = new CopyOnWriteArrayList<>();

    private volatile SchedulerState state = SchedulerState.UNINITIALIZED;
    private long tickNumber;

    public GlobalPulseScheduler(TickScheduler scheduler, CombatantRoster roster, CombatPolicy policy,
                                SwingResolver swingResolver, CombatEventBus events) {
        this.scheduler = scheduler;
        this.roster = roster;
        this.policy = policy;
        this.swingResolver = swingResolver;
        this.events = events;
    }

    /**
     * Schedule the periodic tick.
     * @throws IllegalStateException if already started or stopped
     */
    public synchronized void start() {
        if (state != SchedulerState.UNINITIALIZED) {
            throw new IllegalStateException("Pulse cannot start from state " + state.getDisplayName());
        }
        long period = policy.getGlobalTickMs();
        if (period <= 0) {
            throw new IllegalStateException("Pulse period must be positive, got " + period);
        }
        scheduler.scheduleAtFixedRate(TASK_NAME, this::tick, period, period);
        state = SchedulerState.RUNNING;
        logger.info("[GlobalPulse] Started: {}ms tick, {}ms idle timeout", period, policy.getCombatIdleTimeoutMs());
    }

    /**
     * Cancel the periodic tick. Calling stop again is a no-op.
     */
    public synchronized void stop() {
        if (state == SchedulerState.STOPPED) {
            return;
        }
        if (state == SchedulerState.RUNNING) {
            scheduler.cancel(TASK_NAME);
        }
        state = SchedulerState.STOPPED;
        logger.info("[GlobalPulse] Stopped after {} ticks; {}", metrics.getTotalTicks(), getMetrics());
    }

    public SchedulerState getState() {
        return state;
    }

    // ========== Registration ==========

    public CombatantTimingState registerCombatant(Actor actor) {
        return roster.register(actor, scheduler.now());
    }

    public boolean unregisterCombatant(Actor actor) {
        return roster.unregister(actor, "Unregistered", scheduler.now());
    }

    public boolean isActiveCombatant(Actor actor) {
        return roster.isRegistered(actor);
    }

    /**
     * Keep an actor from being evicted as idle.
     */
    public void updateCombatActivity(Actor actor) {
        CombatantTimingState timing = roster.get(actor);
        if (timing != null) {
            timing.touch(scheduler.now());
        }
    }

    /**
     * Queue a hit to land after the given animation offset.
     */
    public void scheduleHitResolution(Actor attacker, Actor defender, Implement implement, long hitOffsetMs) {
        if (attacker == null || defender == null) return;
        CombatantRoster.Entry entry = roster.entry(attacker.getSerial());
        if (entry == null) return;
        entry.addPendingHit(new CombatantRoster.PendingHit(defender, implement, scheduler.now() + Math.max(0, hitOffsetMs)));
    }

    public CombatantRoster getRoster() {
        return roster;
    }

    // ========== Tick ==========

    /**
     * Process one pulse. Runs on the scheduler thread; does nothing unless running.
     */
    public void tick() {
        if (state != SchedulerState.RUNNING) {
            return;
        }
        long startNanos = System.nanoTime();
        long now = scheduler.now();
        tickNumber++;

        for (CombatantRoster.Entry entry : roster.snapshot()) {
            try {
                processEntry(entry, now);
            } catch (RuntimeException e) {
                SchedulerFaultException fault = new SchedulerFaultException(entry.serial, tickNumber, e);
                metrics.recordFault();
                logger.warn("[GlobalPulse] {}", fault.getMessage(), fault);
                events.publish(CombatEventType.SCHEDULER_FAULT, entry.serial, CombatEvent.NO_ACTOR, e.toString(), now);
            }
        }

        double tickMs = (System.nanoTime() - startNanos) / 1_000_000.0;
        metrics.recordTick(tickMs);
        for (DoubleConsumer observer : tickObservers) {
            try {
                observer.accept(tickMs);
            } catch (RuntimeException e) {
                logger.warn("[GlobalPulse] Tick observer failed", e);
            }
        }
        if (tickMs > policy.getGlobalTickMs()) {
            metrics.recordThrottle();
            logger.warn("[GlobalPulse] Tick {} took {}ms (period {}ms, {} combatants)",
                    tickNumber, String.format("%.2f", tickMs), policy.getGlobalTickMs(), roster.size());
            events.publish(CombatEventType.THROTTLE, CombatEvent.NO_ACTOR, CombatEvent.NO_ACTOR,
                    String.format("%.2fms", tickMs), now);
        }
    }

    private void processEntry(CombatantRoster.Entry entry, long now) {
        Actor actor = entry.getActor();
        if (actor == null || actor.isDeleted()) {
            roster.unregister(entry.serial, "Actor removed", now);
            return;
        }
        CombatantTimingState timing = entry.state;

        for (CombatantRoster.PendingHit hit : entry.drainDueHits(now)) {
            landHit(actor, hit, now);
        }

        if (timing.canFireSwing(now)) {
            fireSwing(entry, actor, timing, now);
        }

        timing.completeBandage(now);
        timing.completeWandUse(now);

        if (!timing.isBusy() && now - timing.getLastActionTimestamp() > policy.getCombatIdleTimeoutMs()) {
            roster.unregister(entry.serial, "Idle timeout", now);
        }
    }

    private void fireSwing(CombatantRoster.Entry entry, Actor actor, CombatantTimingState timing, long now) {
        Actor target = actor.getCombatTarget();
        if (!actor.isAlive() || target == null || target.isDeleted() || !target.isAlive()) {
            timing.cancel(ActionKind.SWING, "No combat target");
            return;
        }
        Implement implement = actor.getEquippedImplement();
        TimingSnapshot snapshot = timing.completeSwing(actor, implement, now);
        events.publish(CombatEventType.SWING_COMPLETE, actor.getSerial(), target.getSerial(), snapshot.toString(),
                snapshot.getAttackIntervalMs(), now);

        if (snapshot.getAnimationHitOffsetMs() > 0) {
            entry.addPendingHit(new CombatantRoster.PendingHit(target, implement, now + snapshot.getAnimationHitOffsetMs()));
        } else {
            swingResolver.resolveHit(actor, target, implement);
            events.publish(CombatEventType.HIT_RESOLVED, actor.getSerial(), target.getSerial(), null, now);
        }
    }

    private void landHit(Actor attacker, CombatantRoster.PendingHit hit, long now) {
        Actor defender = hit.defender.get();
        if (defender == null || defender.isDeleted() || !defender.isAlive() || !attacker.isAlive()) {
            return;
        }
        swingResolver.resolveHit(attacker, defender, hit.implement);
        events.publish(CombatEventType.HIT_RESOLVED, attacker.getSerial(), defender.getSerial(), null, now);
    }

    // ========== Metrics ==========

    /**
     * Be told how long each tick took, in milliseconds.
     */
    public void addTickObserver(DoubleConsumer observer) {
        if (observer != null) {
            tickObservers.add(observer);
        }
    }

    public PulseMetrics.Snapshot getMetrics() {
        return metrics.snapshot(roster.size());
    }

    public void resetMetrics() {
        metrics.reset();
    }

    public long getTickNumber() {
        return tickNumber;
    }
}
