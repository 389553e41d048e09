package com.example.spherecombat.audit;

import com.example.spherecombat.combat.ActionKind;
import com.example.spherecombat.event.CombatEvent;
import com.example.spherecombat.event.CombatEventBus;
import com.example.spherecombat.event.CombatEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Records combat actions from the {@link CombatEventBus} and checks their timing.
 * <p>
 * Each completed swing, bandage or wand use is measured against the start of the same
 * timer: the expected delay is the one announced when the timer was armed, the actual
 * delay is the time that really passed. Entries go to a bounded buffer that
 * {@link #flush()} drains to the {@code combat.audit} logger, and to a bounded
 * per-actor history for queries. When pulse ticks run slow the audit drops to
 * {@link AuditLevel#STANDARD} until they recover.
 */
public class CombatAuditSystem {
    private static final Logger logger = LoggerFactory.getLogger(CombatAuditSystem.class);
    private static final Logger trail = LoggerFactory.getLogger("combat.audit");

    /** Actors whose history and timer marks are kept; the least recently active is dropped first */
    static final int MAX_TRACKED_ACTORS = 1024;

    /** Throttling lifts once ticks fall below this share of the threshold */
    static final double THROTTLE_RECOVERY = 0.8;

    private final AuditConfig config;
    private final String providerName;
    private final Consumer<CombatEvent> listener = this::onEvent;

    private final Deque<CombatLogEntry> buffer = new ArrayDeque<>();
    private final Map<Long, Deque<CombatLogEntry>> histories = lruMap();
    private final Map<Long, EnumMap<ActionKind, TimerMark>> marks = lruMap();

    private volatile boolean throttled;
    private long totalRecorded;
    private long totalFlushed;
    private long droppedEntries;
    private long anomalyCount;

    public CombatAuditSystem(AuditConfig config, String providerName) {
        this.config = config;
        this.providerName = providerName;
    }

    // ========== Wiring ==========

    public void attach(CombatEventBus events) {
        events.subscribe(listener);
        logger.info("[CombatAudit] Recording at {} level, buffer {}", config.getLevel().getDisplayName(),
                config.getBufferSize());
    }

    public void detach(CombatEventBus events) {
        events.unsubscribe(listener);
    }

    // ========== Recording ==========

    /**
     * Turn one combat event into an audit entry, if the current level wants it.
     */
    public synchronized void onEvent(CombatEvent event) {
        if (!config.isEnabled()) {
            return;
        }
        CombatLogEntry entry;
        switch (event.getType()) {
            case SWING_BEGIN:
                entry = arm(event, ActionKind.SWING);
                break;
            case SWING_COMPLETE:
                // auto-attack: a completed swing also arms the next one
                entry = measure(event, ActionKind.SWING);
                mark(event.getActorSerial(), ActionKind.SWING, event.getTimestamp(), event.getDurationMs());
                break;
            case BANDAGE_BEGIN:
                entry = arm(event, ActionKind.BANDAGE);
                break;
            case BANDAGE_COMPLETE:
                entry = measure(event, ActionKind.BANDAGE);
                break;
            case WAND_USE:
                entry = arm(event, ActionKind.WAND);
                break;
            case WAND_COMPLETE:
                entry = measure(event, ActionKind.WAND);
                break;
            case SPELL_CAST_BEGIN:
                entry = arm(event, ActionKind.CAST);
                break;
            case SPELL_CAST_COMPLETE:
                entry = elapsedSinceStart(event);
                break;
            case COMBAT_EXIT:
                marks.remove(event.getActorSerial());
                entry = plain(event);
                break;
            default:
                entry = plain(event);
                break;
        }
        if (getEffectiveLevel().includes(entry.getLevel())) {
            record(entry);
        }
    }

    private CombatLogEntry arm(CombatEvent event, ActionKind kind) {
        mark(event.getActorSerial(), kind, event.getTimestamp(), event.getDurationMs());
        return new CombatLogEntry(event.getTimestamp(), event.getActorSerial(), event.getOtherSerial(),
                event.getType().name(), providerName, requiredLevel(event.getType()), event.getDetail(),
                event.getDurationMs(), 0, false);
    }

    private CombatLogEntry measure(CombatEvent event, ActionKind kind) {
        TimerMark start = takeMark(event.getActorSerial(), kind);
        if (start == null || start.expectedMs <= 0) {
            return plain(event);
        }
        return new CombatLogEntry(event.getTimestamp(), event.getActorSerial(), event.getOtherSerial(),
                event.getType().name(), providerName, requiredLevel(event.getType()), event.getDetail(),
                start.expectedMs, event.getTimestamp() - start.timestamp, true);
    }

    /** Spell time includes targeting, so it is reported but never judged */
    private CombatLogEntry elapsedSinceStart(CombatEvent event) {
        TimerMark start = takeMark(event.getActorSerial(), ActionKind.CAST);
        CombatLogEntry entry = plain(event);
        if (start != null) {
            entry.addDetail("elapsedMs", event.getTimestamp() - start.timestamp);
        }
        return entry;
    }

    private CombatLogEntry plain(CombatEvent event) {
        return new CombatLogEntry(event.getTimestamp(), event.getActorSerial(), event.getOtherSerial(),
                event.getType().name(), providerName, requiredLevel(event.getType()), event.getDetail());
    }

    private void mark(long serial, ActionKind kind, long timestamp, long expectedMs) {
        marks.computeIfAbsent(serial, s -> new EnumMap<>(ActionKind.class))
                .put(kind, new TimerMark(timestamp, expectedMs));
    }

    private TimerMark takeMark(long serial, ActionKind kind) {
        EnumMap<ActionKind, TimerMark> actorMarks = marks.get(serial);
        return actorMarks != null ? actorMarks.remove(kind) : null;
    }

    /**
     * Add an entry that did not come from the event bus, e.g. a provider comparison.
     */
    public synchronized void recordEntry(CombatLogEntry entry) {
        if (config.isEnabled() && entry != null && getEffectiveLevel().includes(entry.getLevel())) {
            record(entry);
        }
    }

    private void record(CombatLogEntry entry) {
        buffer.addLast(entry);
        totalRecorded++;
        while (buffer.size() > config.getBufferSize()) {
            buffer.removeFirst();
            droppedEntries++;
        }

        if (config.isActorHistoryEnabled() && entry.getActorSerial() != CombatEvent.NO_ACTOR) {
            Deque<CombatLogEntry> history = histories.computeIfAbsent(entry.getActorSerial(), s -> new ArrayDeque<>());
            history.addLast(entry);
            while (history.size() > config.getActorHistorySize()) {
                history.removeFirst();
            }
        }

        if (entry.isAnomaly(config.getAnomalyThresholdMs())) {
            anomalyCount++;
            if (getEffectiveLevel().includes(AuditLevel.DETAILED)) {
                logger.warn("[CombatAudit] Timing anomaly: {}", entry);
            }
        }
    }

    static AuditLevel requiredLevel(CombatEventType type) {
        switch (type) {
            case SWING_BEGIN:
            case SWING_COMPLETE:
            case HIT_RESOLVED:
            case SPELL_CAST_BEGIN:
            case SPELL_CAST_COMPLETE:
            case SPELL_FIZZLED:
            case SPELL_INTERRUPTED:
            case SPELL_REFLECTED:
            case SCHEDULER_FAULT:
                return AuditLevel.STANDARD;
            case BANDAGE_BEGIN:
            case BANDAGE_COMPLETE:
            case WAND_USE:
            case WAND_COMPLETE:
            case ACTION_BLOCKED:
                return AuditLevel.DETAILED;
            default:
                return AuditLevel.DEBUG;
        }
    }

    // ========== Flushing ==========

    /**
     * Write every buffered entry to the audit trail and empty the buffer.
     * @return number of entries written
     */
    public int flush() {
        List<CombatLogEntry> pending;
        synchronized (this) {
            if (buffer.isEmpty()) {
                return 0;
            }
            pending = new ArrayList<>(buffer);
            buffer.clear();
            totalFlushed += pending.size();
        }
        for (CombatLogEntry entry : pending) {
            trail.info("{}", entry);
        }
        logger.debug("[CombatAudit] Flushed {} entries", pending.size());
        return pending.size();
    }

    // ========== Performance ==========

    /**
     * Feed one pulse tick duration. Above the threshold the audit is throttled to standard
     * detail; it recovers once ticks drop below {@value #THROTTLE_RECOVERY} of the threshold.
     */
    public void checkPerformanceThrottle(double tickMs) {
        double threshold = config.getAutoThrottleThresholdMs();
        if (threshold <= 0) {
            return;
        }
        if (!throttled && tickMs > threshold) {
            throttled = true;
            logger.warn("[CombatAudit] Throttled: tick took {}ms, threshold {}ms",
                    String.format("%.2f", tickMs), threshold);
        } else if (throttled && tickMs < threshold * THROTTLE_RECOVERY) {
            throttled = false;
            logger.info("[CombatAudit] Throttle lifted: tick took {}ms", String.format("%.2f", tickMs));
        }
    }

    public boolean isThrottled() {
        return throttled;
    }

    /** Configured level, capped at standard while throttled */
    public AuditLevel getEffectiveLevel() {
        AuditLevel level = config.getLevel();
        if (throttled && level.includes(AuditLevel.DETAILED)) {
            return AuditLevel.STANDARD;
        }
        return level;
    }

    // ========== Queries ==========

    /** Recent entries for one actor, oldest first */
    public synchronized List<CombatLogEntry> getActorHistory(long serial) {
        Deque<CombatLogEntry> history = histories.get(serial);
        return history != null ? new ArrayList<>(history) : Collections.emptyList();
    }

    /**
     * Entries for one actor no older than {@code windowMs} before {@code now}.
     */
    public synchronized List<CombatLogEntry> getActorHistory(long serial, long windowMs, long now) {
        List<CombatLogEntry> result = new ArrayList<>();
        long cutoff = now - windowMs;
        for (CombatLogEntry entry : getActorHistory(serial)) {
            if (entry.getTimestamp() >= cutoff) {
                result.add(entry);
            }
        }
        return result;
    }

    /** Entries not yet flushed, oldest first */
    public synchronized List<CombatLogEntry> getBufferSnapshot() {
        return new ArrayList<>(buffer);
    }

    public synchronized int getBufferCount() { return buffer.size(); }
    public synchronized long getTotalRecorded() { return totalRecorded; }
    public synchronized long getTotalFlushed() { return totalFlushed; }
    public synchronized long getDroppedEntries() { return droppedEntries; }
    public synchronized long getAnomalyCount() { return anomalyCount; }
    public AuditConfig getConfig() { return config; }

    @Override
    public synchronized String toString() {
        return String.format("CombatAudit[level=%s throttled=%s recorded=%d flushed=%d buffered=%d anomalies=%d]",
                getEffectiveLevel(), throttled, totalRecorded, totalFlushed, buffer.size(), anomalyCount);
    }

    private static <V> Map<Long, V> lruMap() {
        return new LinkedHashMap<Long, V>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Long, V> eldest) {
                return size() > MAX_TRACKED_ACTORS;
            }
        };
    }

    /**
     * When a timer was armed and how long it was meant to run.
     */
    private static final class TimerMark {
        final long timestamp;
        final long expectedMs;

        TimerMark(long timestamp, long expectedMs) {
            this.timestamp = timestamp;
            this.expectedMs = expectedMs;
        }
    }
}
