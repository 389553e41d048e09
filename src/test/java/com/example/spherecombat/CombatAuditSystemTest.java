package com.example.spherecombat;

import com.example.spherecombat.audit.AuditConfig;
import com.example.spherecombat.audit.AuditLevel;
import com.example.spherecombat.audit.CombatAuditSystem;
import com.example.spherecombat.audit.CombatLogEntry;
import com.example.spherecombat.combat.CombatPolicy;
import com.example.spherecombat.combat.CombatantRoster;
import com.example.spherecombat.combat.GlobalPulseScheduler;
import com.example.spherecombat.combat.WeaponTimingProvider;
import com.example.spherecombat.combat.WeaponTimingTable;
import com.example.spherecombat.event.CombatEvent;
import com.example.spherecombat.event.CombatEventBus;
import com.example.spherecombat.event.CombatEventType;
import com.example.spherecombat.event.EventScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CombatAuditSystem Tests")
class CombatAuditSystemTest {

    private static final long ACTOR = 0x2001;
    private static final long OTHER = 0x2002;

    private final CombatEventBus events = new CombatEventBus();

    private CombatAuditSystem auditWith(AuditConfig config) {
        CombatAuditSystem audit = new CombatAuditSystem(config, WeaponTimingProvider.NAME);
        audit.attach(events);
        return audit;
    }

    private CombatAuditSystem auditAt(AuditLevel level) {
        return auditWith(AuditConfig.builder().level(level).build());
    }

    private void publish(CombatEventType type, long durationMs, long at) {
        events.publish(new CombatEvent(type, ACTOR, OTHER, null, durationMs, at));
    }

    private static CombatLogEntry last(List<CombatLogEntry> entries) {
        return entries.get(entries.size() - 1);
    }

    // === Timing measurement ===

    @Test
    @DisplayName("A completed swing is measured against the interval it was armed with")
    void swingMeasured() {
        CombatAuditSystem audit = auditAt(AuditLevel.STANDARD);

        publish(CombatEventType.SWING_BEGIN, 1850, 0);
        publish(CombatEventType.SWING_COMPLETE, 1850, 1900);

        CombatLogEntry entry = last(audit.getBufferSnapshot());
        assertEquals("SWING_COMPLETE", entry.getAction());
        assertTrue(entry.isMeasured());
        assertEquals(1850, entry.getExpectedDelayMs());
        assertEquals(1900, entry.getActualDelayMs());
        assertEquals(50, entry.getVarianceMs());
        assertEquals(WeaponTimingProvider.NAME, entry.getTimingProvider());
        assertEquals(0, audit.getAnomalyCount());
    }

    @Test
    @DisplayName("Auto-attack swings are measured from the previous swing")
    void autoAttackChain() {
        CombatAuditSystem audit = auditAt(AuditLevel.STANDARD);

        publish(CombatEventType.SWING_BEGIN, 1850, 0);
        publish(CombatEventType.SWING_COMPLETE, 2000, 1850);
        publish(CombatEventType.SWING_COMPLETE, 2000, 3900);

        CombatLogEntry second = last(audit.getBufferSnapshot());
        assertEquals(2000, second.getExpectedDelayMs());
        assertEquals(2050, second.getActualDelayMs());
        assertEquals(50, second.getVarianceMs());
    }

    @Test
    @DisplayName("A late swing beyond the threshold counts as an anomaly")
    void anomaly() {
        CombatAuditSystem audit = auditAt(AuditLevel.DETAILED);

        publish(CombatEventType.SWING_BEGIN, 1850, 0);
        publish(CombatEventType.SWING_COMPLETE, 1850, 1951);

        assertEquals(1, audit.getAnomalyCount());
        assertTrue(last(audit.getBufferSnapshot()).isAnomaly(50));
    }

    @Test
    @DisplayName("A completion with no recorded start is kept but not measured")
    void unmatchedCompletion() {
        CombatAuditSystem audit = auditAt(AuditLevel.STANDARD);

        publish(CombatEventType.SWING_COMPLETE, 1850, 500);

        CombatLogEntry entry = last(audit.getBufferSnapshot());
        assertFalse(entry.isMeasured());
        assertEquals(0, entry.getVarianceMs());
    }

    @Test
    @DisplayName("Leaving combat forgets running timers")
    void exitClearsMarks() {
        CombatAuditSystem audit = auditAt(AuditLevel.DETAILED);

        publish(CombatEventType.BANDAGE_BEGIN, 5000, 0);
        publish(CombatEventType.COMBAT_EXIT, 0, 100);
        publish(CombatEventType.BANDAGE_COMPLETE, 0, 5000);

        assertFalse(last(audit.getBufferSnapshot()).isMeasured());
    }

    @Test
    @DisplayName("Spell completion reports elapsed time without judging it")
    void spellElapsed() {
        CombatAuditSystem audit = auditAt(AuditLevel.STANDARD);

        publish(CombatEventType.SPELL_CAST_BEGIN, 0, 100);
        publish(CombatEventType.SPELL_CAST_COMPLETE, 0, 1600);

        CombatLogEntry entry = last(audit.getBufferSnapshot());
        assertFalse(entry.isMeasured());
        assertEquals(1500L, entry.getDetail("elapsedMs"));
    }

    // === Levels ===

    @ParameterizedTest
    @CsvSource({
            "NONE, 0",
            "STANDARD, 2",
            "DETAILED, 4",
            "DEBUG, 5"
    })
    @DisplayName("Each level records its own events and everything below")
    void levels(AuditLevel level, int expected) {
        CombatAuditSystem audit = auditAt(level);

        publish(CombatEventType.SWING_BEGIN, 1850, 0);
        publish(CombatEventType.HIT_RESOLVED, 0, 300);
        publish(CombatEventType.BANDAGE_BEGIN, 5000, 400);
        publish(CombatEventType.BANDAGE_COMPLETE, 0, 5400);
        publish(CombatEventType.COMBAT_ENTER, 0, 0);

        assertEquals(expected, audit.getBufferCount());
    }

    @Test
    @DisplayName("A disabled audit records nothing")
    void disabled() {
        CombatAuditSystem audit = auditWith(AuditConfig.builder().enabled(false).level(AuditLevel.DEBUG).build());

        publish(CombatEventType.SWING_BEGIN, 1850, 0);

        assertEquals(0, audit.getTotalRecorded());
    }

    @Test
    @DisplayName("Bandage timing is measured at detailed level")
    void bandageMeasured() {
        CombatAuditSystem audit = auditAt(AuditLevel.DETAILED);

        publish(CombatEventType.BANDAGE_BEGIN, 5000, 1000);
        publish(CombatEventType.BANDAGE_COMPLETE, 0, 6000);

        CombatLogEntry entry = last(audit.getBufferSnapshot());
        assertEquals(5000, entry.getExpectedDelayMs());
        assertEquals(0, entry.getVarianceMs());
        assertTrue(entry.isMeasured());
    }

    // === Buffer and history ===

    @Test
    @DisplayName("The buffer keeps only the newest entries")
    void bufferBounded() {
        CombatAuditSystem audit = auditWith(AuditConfig.builder().bufferSize(3).build());

        for (int i = 0; i < 5; i++) {
            publish(CombatEventType.HIT_RESOLVED, 0, i * 100);
        }

        List<CombatLogEntry> snapshot = audit.getBufferSnapshot();
        assertEquals(3, snapshot.size());
        assertEquals(200, snapshot.get(0).getTimestamp());
        assertEquals(5, audit.getTotalRecorded());
        assertEquals(2, audit.getDroppedEntries());
    }

    @Test
    @DisplayName("Actor history is bounded and can be windowed")
    void actorHistory() {
        CombatAuditSystem audit = auditWith(AuditConfig.builder().actorHistorySize(2).build());

        publish(CombatEventType.HIT_RESOLVED, 0, 100);
        publish(CombatEventType.HIT_RESOLVED, 0, 200);
        publish(CombatEventType.HIT_RESOLVED, 0, 300);

        List<CombatLogEntry> history = audit.getActorHistory(ACTOR);
        assertEquals(2, history.size());
        assertEquals(200, history.get(0).getTimestamp());
        assertEquals(1, audit.getActorHistory(ACTOR, 50, 320).size());
        assertTrue(audit.getActorHistory(OTHER).isEmpty());
    }

    @Test
    @DisplayName("Flushing drains the buffer but keeps actor history")
    void flush() {
        CombatAuditSystem audit = auditAt(AuditLevel.STANDARD);
        publish(CombatEventType.SWING_BEGIN, 1850, 0);
        publish(CombatEventType.HIT_RESOLVED, 0, 300);

        assertEquals(2, audit.flush());

        assertEquals(0, audit.getBufferCount());
        assertEquals(2, audit.getTotalFlushed());
        assertEquals(2, audit.getActorHistory(ACTOR).size());
        assertEquals(0, audit.flush());
    }

    // === Throttling ===

    @Test
    @DisplayName("Slow ticks cap the level at standard until they recover")
    void throttle() {
        CombatAuditSystem audit = auditWith(AuditConfig.builder()
                .level(AuditLevel.DEBUG).autoThrottleThresholdMs(10.0).build());

        audit.checkPerformanceThrottle(12.0);
        assertTrue(audit.isThrottled());
        assertEquals(AuditLevel.STANDARD, audit.getEffectiveLevel());
        publish(CombatEventType.BANDAGE_BEGIN, 5000, 0);
        assertEquals(0, audit.getBufferCount());

        audit.checkPerformanceThrottle(9.0);
        assertTrue(audit.isThrottled());

        audit.checkPerformanceThrottle(7.0);
        assertFalse(audit.isThrottled());
        assertEquals(AuditLevel.DEBUG, audit.getEffectiveLevel());
    }

    @Test
    @DisplayName("A zero threshold never throttles")
    void throttleDisabled() {
        CombatAuditSystem audit = auditWith(AuditConfig.builder().autoThrottleThresholdMs(0).build());

        audit.checkPerformanceThrottle(500.0);

        assertFalse(audit.isThrottled());
    }

    // === Live pulse ===

    @Test
    @DisplayName("Swings driven by the pulse are measured at tick granularity")
    void pulseSwings() {
        EventScheduler scheduler = new EventScheduler();
        CombatPolicy policy = CombatPolicy.defaults();
        CombatantRoster roster = new CombatantRoster(policy,
                new WeaponTimingProvider(WeaponTimingTable.compatibilityMapping()), events);
        GlobalPulseScheduler pulse = new GlobalPulseScheduler(scheduler, roster, policy,
                (attacker, defender, implement) -> { }, events);
        CombatAuditSystem audit = auditAt(AuditLevel.STANDARD);
        pulse.addTickObserver(audit::checkPerformanceThrottle);
        pulse.start();
        TestActor attacker = new TestActor("Fighter").wielding(TestImplement.katana()).attacking(new TestActor("Dummy"));

        scheduler.advance(10);
        pulse.registerCombatant(attacker).beginSwing(attacker, attacker.getEquippedImplement(), scheduler.now());
        scheduler.advance(3800);

        List<CombatLogEntry> swings = audit.getActorHistory(attacker.getSerial());
        CombatLogEntry first = swings.stream().filter(e -> e.getAction().equals("SWING_COMPLETE")).findFirst().orElseThrow();
        assertEquals(1850, first.getExpectedDelayMs());
        assertEquals(1890, first.getActualDelayMs());
        assertEquals(40, first.getVarianceMs());
        CombatLogEntry second = last(swings.stream().filter(e -> e.getAction().equals("SWING_COMPLETE"))
                .collect(Collectors.toList()));
        assertEquals(0, second.getVarianceMs());
        assertEquals(0, audit.getAnomalyCount());
    }
}
