package com.example.spherecombat.duel;

/**
 * Kinds of duel. Money duels settle a gold pot; loot duels open a looting window instead.
 */
public enum DuelType {

    MONEY_1V1("Money 1v1", false, false),
    MONEY_2V2("Money 2v2", true, false),
    LOOT_1V1("Loot 1v1", false, true),
    LOOT_2V2("Loot 2v2", true, true);

    private final String displayName;
    private final boolean team;
    private final boolean loot;

    DuelType(String displayName, boolean team, boolean loot) {
        this.displayName = displayName;
        this.team = team;
        this.loot = loot;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTeam() {
        return team;
    }

    public boolean isLoot() {
        return loot;
    }

    /** Number of participants a full duel of this type holds */
    public int getCapacity() {
        return team ? 4 : 2;
    }

    public static DuelType of(boolean team, boolean loot) {
        if (team) {
            return loot ? LOOT_2V2 : MONEY_2V2;
        }
        return loot ? LOOT_1V1 : MONEY_1V1;
    }
}
