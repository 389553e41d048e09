package com.example.spherecombat;

import com.example.spherecombat.audit.AuditConfig;
import com.example.spherecombat.audit.AuditLevel;
import com.example.spherecombat.audit.CombatAuditSystem;
import com.example.spherecombat.audit.CombatLogEntry;
import com.example.spherecombat.audit.ShadowModeVerifier;
import com.example.spherecombat.audit.ShadowReport;
import com.example.spherecombat.audit.TimingComparison;
import com.example.spherecombat.combat.LegacyTimingProvider;
import com.example.spherecombat.combat.TimingProvider;
import com.example.spherecombat.combat.WeaponTimingProvider;
import com.example.spherecombat.combat.WeaponTimingTable;
import com.example.spherecombat.model.Actor;
import com.example.spherecombat.model.Implement;
import com.example.spherecombat.model.WeaponClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ShadowModeVerifier Tests")
class ShadowModeVerifierTest {

    private final WeaponTimingProvider weapon = new WeaponTimingProvider(WeaponTimingTable.compatibilityMapping());
    private final LegacyTimingProvider legacy = new LegacyTimingProvider();
    private final long[] clock = {0};

    private ShadowModeVerifier verifier(AuditConfig config, CombatAuditSystem audit) {
        return new ShadowModeVerifier(weapon, legacy, config, audit, () -> clock[0]);
    }

    private ShadowModeVerifier verifier() {
        return verifier(AuditConfig.builder().shadowMode(true).build(), null);
    }

    // === Comparison ===

    @Test
    @DisplayName("Weapon and legacy timing are compared for a katana")
    void katanaComparison() {
        ShadowModeVerifier shadow = verifier();
        TestActor fighter = new TestActor("Fighter");

        TimingComparison comparison = shadow.compare(fighter, TestImplement.katana());

        assertNotNull(comparison);
        assertEquals(WeaponTimingProvider.NAME, comparison.getPrimaryProvider());
        assertEquals(1850, comparison.getPrimaryMs());
        assertEquals(LegacyTimingProvider.NAME, comparison.getShadowProvider());
        assertEquals(1500, comparison.getShadowMs());
        assertEquals(350, comparison.getVarianceMs());
        assertEquals(TestImplement.KATANA_ID, comparison.getWeaponId());
        assertEquals(100, comparison.getDexterity());
        assertEquals(1, shadow.getDiscrepancyCount());
    }

    @Test
    @DisplayName("Gameplay always gets the primary provider's values")
    void primaryValuesServed() {
        ShadowModeVerifier shadow = verifier();
        TestActor fighter = new TestActor("Fighter");
        TestImplement katana = TestImplement.katana();

        assertEquals(1850, shadow.getAttackIntervalMs(fighter, katana));
        assertEquals(weapon.getAnimationHitOffsetMs(katana), shadow.getAnimationHitOffsetMs(katana));
        assertEquals(weapon.getAnimationDurationMs(katana), shadow.getAnimationDurationMs(katana));
        assertEquals(WeaponTimingProvider.NAME, shadow.getProviderName());
        assertEquals(1, shadow.getTotalComparisons());
    }

    @Test
    @DisplayName("Agreeing providers are not a discrepancy")
    void agreement() {
        ShadowModeVerifier shadow = verifier();
        TestActor fighter = new TestActor("Fighter");
        TestImplement katana = TestImplement.katana();
        katana.swingDelayMs = weapon.getAttackIntervalMs(fighter, katana);

        TimingComparison comparison = shadow.compare(fighter, katana);

        assertEquals(0, comparison.getVarianceMs());
        assertEquals(0, shadow.getDiscrepancyCount());
    }

    @Test
    @DisplayName("A failing shadow provider is skipped without touching gameplay")
    void failingShadow() {
        TimingProvider failing = new TimingProvider() {
            @Override
            public int getAttackIntervalMs(Actor actor, Implement implement) {
                throw new IllegalStateException("no table");
            }

            @Override
            public int getAnimationHitOffsetMs(Implement implement) { return 0; }

            @Override
            public int getAnimationDurationMs(Implement implement) { return 0; }

            @Override
            public String getProviderName() { return "failing"; }
        };
        ShadowModeVerifier shadow = new ShadowModeVerifier(weapon, failing, AuditConfig.defaults(), null, () -> 0L);
        TestActor fighter = new TestActor("Fighter");

        assertEquals(1850, shadow.getAttackIntervalMs(fighter, TestImplement.katana()));
        assertNull(shadow.compare(fighter, TestImplement.katana()));
        assertEquals(0, shadow.getTotalComparisons());
    }

    @Test
    @DisplayName("Unarmed or missing actors are not compared")
    void nothingToCompare() {
        ShadowModeVerifier shadow = verifier();

        assertNull(shadow.compare(new TestActor("Fists"), null));
        assertNull(shadow.compare(null, TestImplement.katana()));
        assertTrue(shadow.getRecentComparisons().isEmpty());
    }

    // === Retention ===

    @Test
    @DisplayName("Only the newest comparisons are kept")
    void bounded() {
        ShadowModeVerifier shadow = verifier(AuditConfig.builder().maxComparisons(2).build(), null);
        TestActor fighter = new TestActor("Fighter");

        for (int i = 0; i < 3; i++) {
            clock[0] = i * 1000L;
            shadow.compare(fighter, TestImplement.katana());
        }

        List<TimingComparison> recent = shadow.getRecentComparisons();
        assertEquals(2, recent.size());
        assertEquals(1000, recent.get(0).getTimestamp());
        assertEquals(3, shadow.getTotalComparisons());
    }

    @Test
    @DisplayName("Comparisons can be limited to a recent window and cleared")
    void windowAndClear() {
        ShadowModeVerifier shadow = verifier();
        TestActor fighter = new TestActor("Fighter");
        shadow.compare(fighter, TestImplement.katana());
        clock[0] = 60_000;
        shadow.compare(fighter, TestImplement.katana());

        assertEquals(1, shadow.getRecentComparisons(10_000, 65_000).size());
        assertEquals(1, shadow.generateReport(10_000, 65_000).getTotalComparisons());

        shadow.clear();
        assertTrue(shadow.getRecentComparisons().isEmpty());
        assertTrue(shadow.generateReport().isEmpty());
    }

    // === Reports ===

    @Test
    @DisplayName("Report summarizes variance overall and per weapon")
    void report() {
        ShadowModeVerifier shadow = verifier();
        TestActor fighter = new TestActor("Fighter");
        TestImplement axe = new TestImplement(0x0F49, "Axe", WeaponClass.TWO_HANDED);
        axe.swingDelayMs = weapon.getAttackIntervalMs(fighter, axe);

        shadow.compare(fighter, TestImplement.katana());
        shadow.compare(fighter, axe);

        ShadowReport report = shadow.generateReport();
        assertEquals(2, report.getTotalComparisons());
        assertEquals(0, report.getMinVarianceMs());
        assertEquals(350, report.getMaxVarianceMs());
        assertEquals(175.0, report.getAvgVarianceMs(), 0.001);
        assertEquals(1, report.getDiscrepancyCount());
        assertEquals(50.0, report.getDiscrepancyPercentage(), 0.001);

        List<ShadowReport.WeaponStats> weapons = report.getWeaponBreakdown();
        assertEquals(2, weapons.size());
        assertEquals("Katana", weapons.get(0).getWeaponName());
        assertEquals(350, weapons.get(0).getMaxVarianceMs());
        assertEquals("Axe", weapons.get(1).getWeaponName());
    }

    @Test
    @DisplayName("Empty report says so")
    void emptyReport() {
        ShadowReport report = verifier().generateReport();

        assertTrue(report.isEmpty());
        assertEquals(0.0, report.getDiscrepancyPercentage(), 0.001);
        assertEquals("No shadow mode comparisons available", report.toString());
    }

    // === Audit ===

    @Test
    @DisplayName("Comparisons reach the audit at debug level only")
    void auditEntries() {
        AuditConfig debug = AuditConfig.builder().level(AuditLevel.DEBUG).shadowMode(true).build();
        CombatAuditSystem audit = new CombatAuditSystem(debug, WeaponTimingProvider.NAME);
        TestActor fighter = new TestActor("Fighter");

        verifier(debug, audit).compare(fighter, TestImplement.katana());

        List<CombatLogEntry> history = audit.getActorHistory(fighter.getSerial());
        assertEquals(1, history.size());
        CombatLogEntry entry = history.get(0);
        assertEquals(CombatLogEntry.SHADOW_COMPARISON, entry.getAction());
        assertEquals(1850, entry.getExpectedDelayMs());
        assertEquals(1500, entry.getActualDelayMs());
        assertEquals(LegacyTimingProvider.NAME, entry.getDetail("shadowProvider"));

        CombatAuditSystem standard = new CombatAuditSystem(AuditConfig.defaults(), WeaponTimingProvider.NAME);
        verifier(AuditConfig.defaults(), standard).compare(fighter, TestImplement.katana());
        assertEquals(0, standard.getTotalRecorded());
    }
}
