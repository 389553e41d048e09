package com.example.spherecombat.duel;

import com.example.spherecombat.config.ConfigurationException;

/**
 * Timings and economics of the duel lifecycle. Immutable; build with {@link #builder()}.
 */
public final class DuelSettings {

    private final long challengeTimeoutMs;
    private final long preTeleportDelayMs;
    private final long countdownMs;
    private final long matchDurationMs;
    private final long lootPhaseMs;
    private final long cleanupDelayMs;
    private final int payoutPercent;
    private final int historySize;
    private final String ruleset;

    private DuelSettings(Builder b) {
        this.challengeTimeoutMs = b.challengeTimeoutMs;
        this.preTeleportDelayMs = b.preTeleportDelayMs;
        this.countdownMs = b.countdownMs;
        this.matchDurationMs = b.matchDurationMs;
        this.lootPhaseMs = b.lootPhaseMs;
        this.cleanupDelayMs = b.cleanupDelayMs;
        this.payoutPercent = b.payoutPercent;
        this.historySize = b.historySize;
        this.ruleset = b.ruleset;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DuelSettings defaults() {
        return builder().build();
    }

    public DuelSettings validate() throws ConfigurationException {
        if (challengeTimeoutMs <= 0) {
            throw new ConfigurationException("duel.challengeTimeoutMs must be positive: " + challengeTimeoutMs);
        }
        if (preTeleportDelayMs < 0 || countdownMs < 0 || cleanupDelayMs < 0 || lootPhaseMs < 0) {
            throw new ConfigurationException("duel delays must not be negative");
        }
        if (matchDurationMs <= 0) {
            throw new ConfigurationException("duel.matchDurationMs must be positive: " + matchDurationMs);
        }
        if (payoutPercent < 0 || payoutPercent > 100) {
            throw new ConfigurationException("duel.payoutPercent must be within 0..100: " + payoutPercent);
        }
        if (historySize < 0) {
            throw new ConfigurationException("duel.historySize must not be negative: " + historySize);
        }
        if (!StandardRuleset.NAME.equals(ruleset) && !SphereRuleset.NAME.equals(ruleset)) {
            throw new ConfigurationException("Unknown duel ruleset: " + ruleset);
        }
        return this;
    }

    /** Winner's share of the pot */
    public int calculatePayout(int entryCost, int participantCount) {
        return (int) ((long) entryCost * participantCount * payoutPercent / 100);
    }

    public long getChallengeTimeoutMs() { return challengeTimeoutMs; }
    public long getPreTeleportDelayMs() { return preTeleportDelayMs; }
    public long getCountdownMs() { return countdownMs; }
    public long getMatchDurationMs() { return matchDurationMs; }
    public long getLootPhaseMs() { return lootPhaseMs; }
    public long getCleanupDelayMs() { return cleanupDelayMs; }
    public int getPayoutPercent() { return payoutPercent; }
    public int getHistorySize() { return historySize; }
    public String getRuleset() { return ruleset; }

    @Override
    public String toString() {
        return "DuelSettings[timeout=" + challengeTimeoutMs + "ms, countdown=" + countdownMs + "ms, match="
                + matchDurationMs + "ms, payout=" + payoutPercent + "%, ruleset=" + ruleset + "]";
    }

    public static final class Builder {
        private long challengeTimeoutMs = 30_000;
        private long preTeleportDelayMs = 5_000;
        private long countdownMs = 10_000;
        private long matchDurationMs = 30 * 60_000;
        private long lootPhaseMs = 120_000;
        private long cleanupDelayMs = 5_000;
        private int payoutPercent = 90;
        private int historySize = 50;
        private String ruleset = SphereRuleset.NAME;

        private Builder() {
        }

        public Builder challengeTimeoutMs(long v) { this.challengeTimeoutMs = v; return this; }
        public Builder preTeleportDelayMs(long v) { this.preTeleportDelayMs = v; return this; }
        public Builder countdownMs(long v) { this.countdownMs = v; return this; }
        public Builder matchDurationMs(long v) { this.matchDurationMs = v; return this; }
        public Builder lootPhaseMs(long v) { this.lootPhaseMs = v; return this; }
        public Builder cleanupDelayMs(long v) { this.cleanupDelayMs = v; return this; }
        public Builder payoutPercent(int v) { this.payoutPercent = v; return this; }
        public Builder historySize(int v) { this.historySize = v; return this; }
        public Builder ruleset(String v) { this.ruleset = v; return this; }

        public DuelSettings build() {
            return new DuelSettings(this);
        }
    }
}
