package com.example.spherecombat;

import com.example.spherecombat.audit.AuditConfig;
import com.example.spherecombat.audit.AuditLevel;
import com.example.spherecombat.audit.CombatAuditSystem;
import com.example.spherecombat.audit.CombatLogEntry;
import com.example.spherecombat.audit.ShadowModeVerifier;
import com.example.spherecombat.combat.ActionKind;
import com.example.spherecombat.combat.CombatPolicy;
import com.example.spherecombat.combat.CombatantRoster;
import com.example.spherecombat.combat.LegacyTimingProvider;
import com.example.spherecombat.combat.SchedulerState;
import com.example.spherecombat.combat.WeaponTimingTable;
import com.example.spherecombat.config.ConfigurationException;
import com.example.spherecombat.config.EngineConfig;
import com.example.spherecombat.duel.DuelContext;
import com.example.spherecombat.duel.DuelManager;
import com.example.spherecombat.duel.DuelSettings;
import com.example.spherecombat.duel.DuelState;
import com.example.spherecombat.event.CombatEventType;
import com.example.spherecombat.event.EventScheduler;
import com.example.spherecombat.model.Arena;
import com.example.spherecombat.spell.CastDescriptor;
import com.example.spherecombat.spell.CastState;
import com.example.spherecombat.spell.SpellTimingTable;
import com.example.spherecombat.util.TickService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CombatEngine Tests")
class CombatEngineTest {

    private EventScheduler scheduler;
    private RecordingEscrow escrow;
    private final List<String> hits = new ArrayList<>();
    private CombatEngine engine;

    @BeforeEach
    void setUp() throws ConfigurationException {
        scheduler = new EventScheduler();
        escrow = new RecordingEscrow();
        engine = engineWith(EngineConfig.defaults());
        engine.start();
    }

    @AfterEach
    void tearDown() {
        engine.stop();
    }

    private CombatEngine engineWith(EngineConfig config) {
        return new CombatEngine(scheduler, config,
                (attacker, defender, implement) -> hits.add(attacker.getName() + "->" + defender.getName()),
                escrow, new RecordingArena());
    }

    // === Lifecycle ===

    @Test
    @DisplayName("Start runs the pulse and stop tears everything down")
    void startAndStop() {
        assertTrue(engine.isStarted());
        assertEquals(SchedulerState.RUNNING, engine.getPulse().getState());
        assertTrue(engine.getDuelManager().isRunning());
        TestActor actor = new TestActor("Fighter");
        engine.beginBandage(actor);
        assertEquals(1, engine.getRoster().size());

        engine.stop();

        assertFalse(engine.isStarted());
        assertEquals(0, scheduler.getRecurringEventCount());
        assertThrows(IllegalStateException.class, () -> engine.beginBandage(actor));
    }

    @Test
    @DisplayName("Starting twice is rejected")
    void startTwice() {
        assertThrows(IllegalStateException.class, engine::start);
    }

    @Test
    @DisplayName("An unknown timing provider stops start-up before the pulse is scheduled")
    void badProviderNeverStartsPulse() {
        engine.stop();
        EngineConfig config = new EngineConfig(CombatPolicy.builder().timingProvider("quantum").build(),
                DuelSettings.defaults(), WeaponTimingTable.empty(), SpellTimingTable.defaults());
        CombatEngine broken = engineWith(config);

        assertThrows(ConfigurationException.class, broken::start);

        assertFalse(broken.isStarted());
        assertEquals(0, scheduler.getRecurringEventCount());
        assertThrows(IllegalStateException.class, broken::getPulse);
    }

    @Test
    @DisplayName("Invalid pulse settings are rejected at start")
    void invalidPolicyRejected() {
        engine.stop();
        EngineConfig config = new EngineConfig(CombatPolicy.builder().combatIdleTimeoutMs(0).build(),
                DuelSettings.defaults(), WeaponTimingTable.empty(), SpellTimingTable.defaults());

        assertThrows(ConfigurationException.class, () -> engineWith(config).start());
    }

    @Test
    @DisplayName("The legacy provider can be selected")
    void legacyProvider() throws ConfigurationException {
        engine.stop();
        EngineConfig config = new EngineConfig(CombatPolicy.builder().timingProvider("Legacy").build(),
                DuelSettings.defaults(), WeaponTimingTable.empty(), SpellTimingTable.defaults());
        engine = engineWith(config);

        engine.start();

        assertTrue(engine.isStarted());
    }

    @Test
    @DisplayName("An engine built from the bundled configuration runs on its own tick thread")
    void fromClasspath() throws ConfigurationException {
        CombatEngine standalone = CombatEngine.fromClasspath(
                (attacker, defender, implement) -> { }, escrow, new RecordingArena());

        standalone.start();
        assertEquals(SchedulerState.RUNNING, standalone.getPulse().getState());
        standalone.stop();

        assertFalse(standalone.isStarted());
    }

    @Test
    @DisplayName("Stopping from another thread tears down on the tick thread and waits for it")
    void stopHandsTeardownToTickThread() throws ConfigurationException, InterruptedException {
        CombatEngine standalone = CombatEngine.fromClasspath(
                (attacker, defender, implement) -> { }, escrow, new RecordingArena());
        List<String> exitThreads = new CopyOnWriteArrayList<>();
        standalone.getEvents().subscribe(e -> {
            if (e.getType() == CombatEventType.COMBAT_EXIT) {
                exitThreads.add(Thread.currentThread().getName());
            }
        });
        standalone.start();
        TestActor defender = new TestActor("Target");
        TestActor attacker = new TestActor("Fighter").wielding(TestImplement.katana()).attacking(defender);
        CountDownLatch swung = new CountDownLatch(1);

        standalone.execute(() -> {
            standalone.beginSwing(attacker);
            swung.countDown();
        });
        assertTrue(swung.await(2, TimeUnit.SECONDS));
        CombatantRoster roster = standalone.getRoster();
        assertTrue(roster.isRegistered(attacker));

        standalone.stop();

        assertEquals(List.of("sphere-tick"), exitThreads);
        assertEquals(0, roster.size());
        TickService ticks = (TickService) standalone.getScheduler();
        assertTrue(ticks.awaitTermination(2_000));
        assertThrows(IllegalStateException.class, () -> standalone.execute(() -> { }));
    }

    // === Actions ===

    @Test
    @DisplayName("Work handed to the engine runs on the next scheduler turn")
    void executeRunsOnScheduler() {
        TestActor actor = new TestActor("Healer");

        engine.execute(() -> engine.beginBandage(actor));
        assertTrue(engine.isReady(actor, ActionKind.BANDAGE));

        assertEquals(1, scheduler.runPending());
        assertFalse(engine.isReady(actor, ActionKind.BANDAGE));
        assertTrue(engine.getRoster().isRegistered(actor));
    }

    @Test
    @DisplayName("A swing started through the engine lands on the pulse")
    void swingThroughEngine() {
        TestActor defender = new TestActor("Target");
        TestActor attacker = new TestActor("Fighter").wielding(TestImplement.katana()).attacking(defender);

        engine.beginSwing(attacker);
        assertFalse(engine.isReady(attacker, ActionKind.SWING));

        scheduler.advance(2150);

        assertEquals(List.of("Fighter->Target"), hits);
    }

    @Test
    @DisplayName("Actors outside combat are always ready")
    void unregisteredIsReady() {
        assertTrue(engine.isReady(new TestActor("Bystander"), ActionKind.CAST));
    }

    @Test
    @DisplayName("Dead actors cannot start actions")
    void deadActorRejected() {
        TestActor corpse = new TestActor("Corpse");
        corpse.kill();
        assertThrows(IllegalArgumentException.class, () -> engine.beginSwing(corpse));
        assertThrows(IllegalArgumentException.class, () -> engine.beginWandUse(corpse, 1000));
    }

    @Test
    @DisplayName("Cancelling reports whether anything was running")
    void cancelThroughEngine() {
        TestActor actor = new TestActor("Healer");
        engine.beginWandUse(actor, 3000);

        assertTrue(engine.cancel(actor, ActionKind.WAND, "Moved"));
        assertFalse(engine.cancel(actor, ActionKind.WAND, "Moved"));
        assertFalse(engine.cancel(new TestActor("Nobody"), ActionKind.SWING, "none"));
    }

    @Test
    @DisplayName("A cast through the engine resolves after its delay")
    void castThroughEngine() {
        TestActor caster = new TestActor("Mage");
        TestActor target = new TestActor("Victim");
        TestSpell spell = new TestSpell("Energy Bolt");

        CastDescriptor cast = engine.beginCast(caster, spell, false);
        assertEquals(CastState.DELAYING, engine.confirmTarget(cast, target));
        scheduler.advance(1000);

        assertEquals(CastState.APPLIED, cast.getState());
        assertEquals(List.of(target), spell.appliedTo);
    }

    // === World notifications ===

    @Test
    @DisplayName("Death interrupts the caster's spell and drops it from combat")
    void deathInterruptsCast() {
        TestActor caster = new TestActor("Mage");
        TestSpell spell = new TestSpell("Energy Bolt");
        CastDescriptor cast = engine.beginCast(caster, spell, false);
        engine.confirmTarget(cast, new TestActor("Victim"));

        caster.kill();
        engine.onDeath(caster, null);
        scheduler.advance(1000);

        assertEquals(CastState.INTERRUPTED, cast.getState());
        assertTrue(spell.appliedTo.isEmpty());
        assertFalse(engine.getRoster().isRegistered(caster));
    }

    @Test
    @DisplayName("A death in a duel settles it")
    void deathSettlesDuel() {
        TestActor alice = new TestActor("Alice");
        TestActor bob = new TestActor("Bob");
        escrow.give(alice, 500);
        escrow.give(bob, 500);
        DuelManager duels = engine.getDuelManager();
        duels.issueChallenge(alice, bob, new Arena("Ring", 2, 2), 100, false);
        DuelContext context = duels.acceptChallenge(bob);
        scheduler.advance(15_000);
        assertEquals(DuelState.IN_PROGRESS, context.getState());

        bob.kill();
        engine.onDeath(bob, alice);

        assertEquals(DuelState.ENDING, context.getState());
        assertEquals(580, escrow.getBalance(alice));
    }

    @Test
    @DisplayName("Disconnecting mid-duel is a draw")
    void disconnectDraws() {
        TestActor alice = new TestActor("Alice");
        TestActor bob = new TestActor("Bob");
        DuelManager duels = engine.getDuelManager();
        duels.issueChallenge(alice, bob, new Arena("Ring", 2, 2), 0, false);
        DuelContext context = duels.acceptChallenge(bob);
        scheduler.advance(15_000);

        engine.onDisconnect(bob);

        assertTrue(context.isDraw());
        assertFalse(engine.getRoster().isRegistered(bob));
    }

    // === Audit ===

    private CombatEngine auditedEngine(AuditConfig audit) throws ConfigurationException {
        engine.stop();
        EngineConfig config = new EngineConfig(CombatPolicy.defaults(), DuelSettings.defaults(),
                WeaponTimingTable.compatibilityMapping(), SpellTimingTable.defaults(), audit);
        engine = engineWith(config);
        engine.start();
        return engine;
    }

    @Test
    @DisplayName("Swings are audited and flushed on the audit interval")
    void auditRecordsSwings() throws ConfigurationException {
        CombatEngine audited = auditedEngine(AuditConfig.builder().flushIntervalMs(1000).build());
        TestActor attacker = new TestActor("Fighter").wielding(TestImplement.katana()).attacking(new TestActor("Dummy"));

        audited.beginSwing(attacker);

        CombatAuditSystem audit = audited.getAudit();
        List<CombatLogEntry> history = audit.getActorHistory(attacker.getSerial());
        assertEquals("SWING_BEGIN", history.get(0).getAction());
        assertEquals(1850, history.get(0).getExpectedDelayMs());
        assertNull(audited.getShadowVerifier());

        scheduler.advance(1000);
        assertEquals(0, audit.getBufferCount());
        assertTrue(audit.getTotalFlushed() > 0);
    }

    @Test
    @DisplayName("A disabled audit is not created")
    void auditDisabled() throws ConfigurationException {
        CombatEngine quiet = auditedEngine(AuditConfig.builder().enabled(false).build());

        assertNull(quiet.getAudit());
        assertEquals(1, scheduler.getRecurringEventCount());
    }

    @Test
    @DisplayName("Shadow mode compares legacy timing on every swing without changing it")
    void shadowModeSwings() throws ConfigurationException {
        CombatEngine shadowed = auditedEngine(AuditConfig.builder().level(AuditLevel.DEBUG).shadowMode(true).build());
        TestActor attacker = new TestActor("Fighter").wielding(TestImplement.katana()).attacking(new TestActor("Dummy"));

        assertEquals(1850, shadowed.beginSwing(attacker).getAttackIntervalMs());

        ShadowModeVerifier shadow = shadowed.getShadowVerifier();
        assertEquals(1, shadow.getTotalComparisons());
        assertEquals(LegacyTimingProvider.NAME, shadow.getShadow().getProviderName());
        assertEquals(350, shadow.generateReport().getMaxVarianceMs());
        assertTrue(shadowed.getAudit().getActorHistory(attacker.getSerial()).stream()
                .anyMatch(e -> e.getAction().equals(CombatLogEntry.SHADOW_COMPARISON)));
    }
}
