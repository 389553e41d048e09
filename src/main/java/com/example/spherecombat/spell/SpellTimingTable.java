package com.example.spherecombat.spell;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable spell delay rows, looked up by case-insensitive spell name.
 */
public final class SpellTimingTable {

    private final Map<String, SpellTimingData> timings;

    public SpellTimingTable(Collection<SpellTimingData> rows) {
        Map<String, SpellTimingData> map = new LinkedHashMap<>();
        if (rows != null) {
            for (SpellTimingData row : rows) {
                if (row != null && row.getName() != null && !row.getName().isBlank()) {
                    map.put(key(row.getName()), row);
                }
            }
        }
        this.timings = Collections.unmodifiableMap(map);
    }

    /**
     * The built-in delayed spells.
     */
    public static SpellTimingTable defaults() {
        return new SpellTimingTable(List.of(
                new SpellTimingData("Explosion", 2500, 100, 0, 5000),
                new SpellTimingData("ChainLightning", 1800, 0, 200, 4000),
                new SpellTimingData("MeteorSwarm", 2500, 150, 0, 6000),
                new SpellTimingData("EnergyField", 1800),
                new SpellTimingData("FireField", 1800),
                new SpellTimingData("PoisonField", 1800),
                new SpellTimingData("ParalyzeField", 1800)));
    }

    /** Row for a spell name, or null */
    public SpellTimingData get(String spellName) {
        if (spellName == null) return null;
        return timings.get(key(spellName));
    }

    public boolean contains(String spellName) {
        return get(spellName) != null;
    }

    public int size() {
        return timings.size();
    }

    private static String key(String name) {
        return name.replace(" ", "").toLowerCase(Locale.ROOT);
    }
}
