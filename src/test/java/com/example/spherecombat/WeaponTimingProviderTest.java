package com.example.spherecombat;

import com.example.spherecombat.combat.TimingSnapshot;
import com.example.spherecombat.combat.WeaponEntry;
import com.example.spherecombat.combat.WeaponTimingProvider;
import com.example.spherecombat.combat.WeaponTimingTable;
import com.example.spherecombat.model.WeaponClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WeaponTimingProvider Tests")
class WeaponTimingProviderTest {

    private final WeaponTimingProvider provider = new WeaponTimingProvider(WeaponTimingTable.compatibilityMapping());

    // === Interval formula ===

    @ParameterizedTest(name = "item {0}, dex {1} -> {2}ms")
    @CsvSource({
        // Katana, speed 46: 1840ms at baseline
        "5119, 100, 1850",
        "5119, 125, 1450",
        "5119, 150, 1450",   // bonus capped at +25
        "5119, 50,  2200",
        "5119, 0,   2200",   // penalty capped at -50
        "5119, 110, 1700",
        // Longsword, speed 30
        "5048, 100, 1200",
        // Halberd, speed 25
        "5182, 100, 1000",
        // Bow, speed 30
        "5041, 100, 1200"
    })
    @DisplayName("Interval follows speed, dexterity and pulse snapping")
    void intervalFormula(int itemId, int dex, int expectedMs) {
        TestActor actor = new TestActor("Fighter").withDex(dex);
        TestImplement weapon = new TestImplement(itemId, "Weapon", WeaponClass.ONE_HANDED);
        assertEquals(expectedMs, provider.getAttackIntervalMs(actor, weapon));
    }

    @ParameterizedTest(name = "{0} -> {1}ms")
    @CsvSource({
        "DAGGER, 800",
        "ONE_HANDED, 1400",
        "TWO_HANDED, 3000",
        "BOW, 1800",
        "CROSSBOW, 2000",
        "WRESTLING, 2000"
    })
    @DisplayName("Unlisted weapons use their class default")
    void classDefaults(WeaponClass weaponClass, int expectedMs) {
        TestActor actor = new TestActor("Fighter");
        TestImplement weapon = new TestImplement(0x0001, "Unlisted", weaponClass);
        assertEquals(expectedMs, provider.getAttackIntervalMs(actor, weapon));
    }

    @Test
    @DisplayName("Unarmed uses the default row")
    void unarmedUsesDefault() {
        assertEquals(2000, provider.getAttackIntervalMs(new TestActor("Brawler"), null));
    }

    @Test
    @DisplayName("Creatures get no dexterity scaling")
    void creaturesIgnoreDexterity() {
        TestActor creature = new TestActor("Orc").withDex(150);
        creature.player = false;
        assertEquals(1850, provider.getAttackIntervalMs(creature, TestImplement.katana()));
    }

    @Test
    @DisplayName("Missing attacker returns the minimum interval")
    void nullActorReturnsMinimum() {
        assertEquals(200, provider.getAttackIntervalMs(null, TestImplement.katana()));
    }

    @Test
    @DisplayName("Intervals are clamped to 200..4000ms")
    void intervalsAreClamped() {
        WeaponTimingProvider custom = new WeaponTimingProvider(new WeaponTimingTable(List.of(
                new WeaponEntry(0x2000, "Twig", 1, 1600, 300, 600),
                new WeaponEntry(0x2001, "Anvil", 200, 1600, 300, 600))));
        TestActor actor = new TestActor("Fighter");

        assertEquals(200, custom.getAttackIntervalMs(actor, new TestImplement(0x2000, "Twig", WeaponClass.DAGGER)));
        assertEquals(4000, custom.getAttackIntervalMs(actor, new TestImplement(0x2001, "Anvil", WeaponClass.TWO_HANDED)));
    }

    @Test
    @DisplayName("Every interval is a multiple of the pulse")
    void intervalsSnapToPulse() {
        TestImplement katana = TestImplement.katana();
        for (int dex = 0; dex <= 150; dex++) {
            int interval = provider.getAttackIntervalMs(new TestActor("Fighter").withDex(dex), katana);
            assertEquals(0, interval % 50, "dex " + dex + " gave " + interval);
        }
    }

    // === Animation ===

    @Test
    @DisplayName("Snapshot carries animation values from the table row")
    void snapshotUsesTableRow() {
        TimingSnapshot snapshot = provider.snapshot(new TestActor("Fighter"),
                new TestImplement(0x143E, "Halberd", WeaponClass.TWO_HANDED));
        assertEquals(1000, snapshot.getAttackIntervalMs());
        assertEquals(400, snapshot.getAnimationHitOffsetMs());
        assertEquals(800, snapshot.getAnimationDurationMs());
    }

    @Test
    @DisplayName("Same inputs give equal snapshots")
    void snapshotsAreValues() {
        TestActor actor = new TestActor("Fighter");
        TestImplement katana = TestImplement.katana();
        assertEquals(provider.snapshot(actor, katana), provider.snapshot(actor, katana));
    }
}
