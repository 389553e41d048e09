package com.example.spherecombat.combat;

import com.example.spherecombat.model.Implement;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable weapon timing rows keyed by item id.
 */
public final class WeaponTimingTable {

    private final Map<Integer, WeaponEntry> entries;

    public WeaponTimingTable(Collection<WeaponEntry> rows) {
        Map<Integer, WeaponEntry> map = new LinkedHashMap<>();
        if (rows != null) {
            for (WeaponEntry row : rows) {
                if (row != null && row.getItemId() >= 0) {
                    map.put(row.getItemId(), row);
                }
            }
        }
        this.entries = Collections.unmodifiableMap(map);
    }

    public static WeaponTimingTable empty() {
        return new WeaponTimingTable(null);
    }

    /**
     * Rows matching the classic shard timing for the most common weapons.
     */
    public static WeaponTimingTable compatibilityMapping() {
        return new WeaponTimingTable(List.of(
                new WeaponEntry(0x13FF, "Katana", 46, 1600, 300, 600),
                new WeaponEntry(0x13B8, "Longsword", 30, 1600, 300, 600),
                new WeaponEntry(0x143E, "Halberd", 25, 1900, 400, 800),
                new WeaponEntry(0x13B1, "Bow", 30, 2000, 500, 900)));
    }

    /**
     * Resolve the row for a weapon: exact item id, then weapon class default, then {@link WeaponEntry#DEFAULT}.
     */
    public WeaponEntry lookup(Implement implement) {
        if (implement == null) {
            return WeaponEntry.DEFAULT;
        }
        WeaponEntry entry = entries.get(implement.getItemId());
        if (entry != null) {
            return entry;
        }
        return WeaponEntry.forClass(implement.getWeaponClass());
    }

    public WeaponEntry get(int itemId) {
        return entries.get(itemId);
    }

    public int size() {
        return entries.size();
    }
}
