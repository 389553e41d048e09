package com.example.spherecombat.combat;

import com.example.spherecombat.event.CombatEvent;
import com.example.spherecombat.event.CombatEventBus;
import com.example.spherecombat.event.CombatEventType;
import com.example.spherecombat.model.Actor;
import com.example.spherecombat.model.Implement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The registered-combatant set, keyed by actor serial.
 * Owns each actor's {@link CombatantTimingState}; actors themselves are held weakly so
 * a deleted actor that nobody unregistered is dropped on the next pulse.
 * Iteration happens over snapshots, so registering or removing during a tick is safe.
 */
public class CombatantRoster {
    private static final Logger logger = LoggerFactory.getLogger(CombatantRoster.class);

    private final Map<Long, Entry> entries = new ConcurrentHashMap<>();
    private final CombatPolicy policy;
    private final TimingProvider timingProvider;
    private final CombatEventBus events;

    public CombatantRoster(CombatPolicy policy, TimingProvider timingProvider, CombatEventBus events) {
        this.policy = policy;
        this.timingProvider = timingProvider;
        this.events = events;
    }

    /**
     * Register an actor, creating its timing state on first use.
     * @return the actor's timing state, or null for a null or deleted actor
     */
    public CombatantTimingState register(Actor actor, long now) {
        if (actor == null || actor.isDeleted()) {
            return null;
        }
        Entry entry = entries.get(actor.getSerial());
        if (entry != null && entry.getActor() == actor) {
            entry.state.touch(now);
            return entry.state;
        }
        Entry created = new Entry(actor, new CombatantTimingState(actor, policy, timingProvider, events, now));
        Entry replaced = entries.put(actor.getSerial(), created);
        if (replaced != null) {
            replaced.state.cancelAll("Actor re-registered");
        }
        logger.debug("[Roster] Registered {} (#{})", actor.getName(), actor.getSerial());
        events.publish(CombatEventType.COMBAT_ENTER, actor.getSerial(), CombatEvent.NO_ACTOR, null, now);
        return created.state;
    }

    /**
     * Remove an actor, cancelling anything it still had in flight.
     * @return true if the actor was registered
     */
    public boolean unregister(Actor actor, String reason, long now) {
        if (actor == null) return false;
        return unregister(actor.getSerial(), reason, now);
    }

    public boolean unregister(long serial, String reason, long now) {
        Entry entry = entries.remove(serial);
        if (entry == null) {
            return false;
        }
        entry.state.cancelAll(reason);
        entry.pendingHits.clear();
        logger.debug("[Roster] Unregistered #{}: {}", serial, reason);
        events.publish(CombatEventType.COMBAT_EXIT, serial, CombatEvent.NO_ACTOR, reason, now);
        return true;
    }

    /** Timing state of a registered actor, or null */
    public CombatantTimingState get(Actor actor) {
        if (actor == null) return null;
        Entry entry = entries.get(actor.getSerial());
        return entry != null ? entry.state : null;
    }

    public boolean isRegistered(Actor actor) {
        return actor != null && entries.containsKey(actor.getSerial());
    }

    public int size() {
        return entries.size();
    }

    /** Point-in-time copy for iteration */
    List<Entry> snapshot() {
        return new ArrayList<>(entries.values());
    }

    Entry entry(long serial) {
        return entries.get(serial);
    }

    public void clear(String reason, long now) {
        for (Entry entry : snapshot()) {
            unregister(entry.serial, reason, now);
        }
    }

    /**
     * One roster slot: the weakly held actor, its timing state and queued hits.
     */
    static final class Entry {
        final long serial;
        final WeakReference<Actor> actor;
        final CombatantTimingState state;
        final List<PendingHit> pendingHits = new ArrayList<>();

        Entry(Actor actor, CombatantTimingState state) {
            this.serial = actor.getSerial();
            this.actor = new WeakReference<>(actor);
            this.state = state;
        }

        Actor getActor() {
            return actor.get();
        }

        void addPendingHit(PendingHit hit) {
            pendingHits.add(hit);
        }

        /**
         * Remove and return hits due at or before now.
         */
        List<PendingHit> drainDueHits(long now) {
            if (pendingHits.isEmpty()) {
                return List.of();
            }
            List<PendingHit> due = new ArrayList<>();
            Iterator<PendingHit> it = pendingHits.iterator();
            while (it.hasNext()) {
                PendingHit hit = it.next();
                if (hit.dueTime <= now) {
                    due.add(hit);
                    it.remove();
                }
            }
            return due;
        }
    }

    /**
     * A swing whose hit frame has not been reached yet. The defender is weak and
     * re-checked when the hit lands.
     */
    static final class PendingHit {
        final WeakReference<Actor> defender;
        final Implement implement;
        final long dueTime;

        PendingHit(Actor defender, Implement implement, long dueTime) {
            this.defender = new WeakReference<>(defender);
            this.implement = implement;
            this.dueTime = dueTime;
        }
    }
}
