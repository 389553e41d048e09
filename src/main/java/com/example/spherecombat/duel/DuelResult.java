package com.example.spherecombat.duel;

import java.util.Collections;
import java.util.List;

/**
 * Archived outcome of a finished duel.
 */
public final class DuelResult {

    private final long contextId;
    private final DuelType type;
    private final List<String> winners;
    private final List<String> losers;
    private final long durationMs;
    private final int pot;
    private final int payout;
    private final boolean draw;

    public DuelResult(long contextId, DuelType type, List<String> winners, List<String> losers,
                      long durationMs, int pot, int payout, boolean draw) {
        this.contextId = contextId;
        this.type = type;
        this.winners = Collections.unmodifiableList(winners);
        this.losers = Collections.unmodifiableList(losers);
        this.durationMs = durationMs;
        this.pot = pot;
        this.payout = payout;
        this.draw = draw;
    }

    public long getContextId() { return contextId; }
    public DuelType getType() { return type; }
    public List<String> getWinners() { return winners; }
    public List<String> getLosers() { return losers; }
    public long getDurationMs() { return durationMs; }
    public int getPot() { return pot; }
    public int getPayout() { return payout; }
    public boolean isDraw() { return draw; }

    @Override
    public String toString() {
        if (draw) {
            return "Duel#" + contextId + " drawn after " + (durationMs / 1000) + "s";
        }
        return "Duel#" + contextId + " won by " + String.join(", ", winners) + " over " + String.join(", ", losers)
                + " after " + (durationMs / 1000) + "s" + (payout > 0 ? " (" + payout + " gold)" : "");
    }
}
