package com.example.spherecombat;

import com.example.spherecombat.spell.SpellTimingData;
import com.example.spherecombat.spell.SpellTimingTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SpellTimingTable Tests")
class SpellTimingTableTest {

    private final SpellTimingTable table = SpellTimingTable.defaults();

    @ParameterizedTest(name = "{0} skill={1} scroll={2} tiles={3} targets={4} -> {5}ms")
    @CsvSource({
            "Explosion,       0,   false, 0, 1, 2500",
            "Explosion,       0,   false, 3, 1, 2800",
            "Explosion,       100, false, 3, 1, 1400",
            "Explosion,       100, true,  3, 1, 2800",
            "Explosion,       0,   false, 40, 1, 5000",
            "ChainLightning,  0,   false, 0, 4, 2400",
            "ChainLightning,  0,   false, 0, 1, 1800",
            "ChainLightning,  2.5, false, 0, 1, 1350",
            "EnergyField,     0,   false, 9, 1, 1800"
    })
    @DisplayName("Delay formula")
    void delayFormula(String spell, double skill, boolean scroll, int tiles, int targets, int expected) {
        assertEquals(expected, table.get(spell).calculateDelay(skill, scroll, tiles, targets));
    }

    @Test
    @DisplayName("Lookup ignores case and spaces")
    void lookupNormalizesNames() {
        assertNotNull(table.get("meteor swarm"));
        assertNotNull(table.get("PARALYZEFIELD"));
        assertNull(table.get("Fireball"));
        assertNull(table.get(null));
    }

    @Test
    @DisplayName("Unnamed rows are skipped")
    void unnamedRowsSkipped() {
        SpellTimingTable custom = new SpellTimingTable(List.of(
                new SpellTimingData("Blade Spirits", 3000),
                new SpellTimingData(" ", 1000)));

        assertEquals(1, custom.size());
        assertEquals(3000, custom.get("bladespirits").getBaseDelayMs());
    }

    @Test
    @DisplayName("A zero cap leaves the delay uncapped")
    void zeroCapIsUncapped() {
        SpellTimingData row = new SpellTimingData("Wall", 1000, 500, 0, 0);
        assertEquals(11000, row.calculateDelay(0, false, 20, 1));
    }
}
