package com.example.spherecombat.spell;

/**
 * Cast delay row for one spell.
 */
public final class SpellTimingData {
    private final String name;
    private final int baseDelayMs;
    private final int perTileDelayMs;
    private final int perTargetDelayMs;
    private final int maxDelayMs;

    public SpellTimingData(String name, int baseDelayMs, int perTileDelayMs, int perTargetDelayMs, int maxDelayMs) {
        this.name = name;
        this.baseDelayMs = baseDelayMs;
        this.perTileDelayMs = perTileDelayMs;
        this.perTargetDelayMs = perTargetDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public SpellTimingData(String name, int baseDelayMs) {
        this(name, baseDelayMs, 0, 0, 0);
    }

    public String getName() { return name; }
    public int getBaseDelayMs() { return baseDelayMs; }
    public int getPerTileDelayMs() { return perTileDelayMs; }
    public int getPerTargetDelayMs() { return perTargetDelayMs; }
    public int getMaxDelayMs() { return maxDelayMs; }

    /**
     * Cast delay for one cast.
     * @param skillValue caster's skill in the spell's school
     * @param fromScroll scrolls get no skill reduction
     * @param tiles area covered, for field and area spells
     * @param targets number of targets hit, for chaining spells
     */
    public int calculateDelay(double skillValue, boolean fromScroll, int tiles, int targets) {
        int delay = baseDelayMs;

        if (perTileDelayMs > 0 && tiles > 0) {
            delay += perTileDelayMs * tiles;
        }
        if (perTargetDelayMs > 0 && targets > 1) {
            delay += perTargetDelayMs * (targets - 1);
        }

        if (!fromScroll && skillValue > 0) {
            double skillReduction = Math.min(skillValue / 10.0, 0.5); // capped at half
            delay = (int) (delay * (1.0 - skillReduction));
        }

        if (maxDelayMs > 0 && delay > maxDelayMs) {
            delay = maxDelayMs;
        }
        return Math.max(delay, 0);
    }

    @Override
    public String toString() {
        return String.format("SpellTimingData[%s base=%d tile=%d target=%d max=%d]",
                name, baseDelayMs, perTileDelayMs, perTargetDelayMs, maxDelayMs);
    }
}
