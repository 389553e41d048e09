package com.example.spherecombat.audit;

import com.example.spherecombat.config.ConfigurationException;

/**
 * Settings of the combat audit and of shadow-mode timing comparison.
 * Immutable; build with {@link #builder()}.
 */
public final class AuditConfig {

    private final boolean enabled;
    private final AuditLevel level;
    private final int bufferSize;
    private final long flushIntervalMs;
    private final double autoThrottleThresholdMs;
    private final boolean actorHistoryEnabled;
    private final int actorHistorySize;
    private final double anomalyThresholdMs;
    private final boolean shadowMode;
    private final int maxComparisons;
    private final double discrepancyThresholdMs;

    private AuditConfig(Builder b) {
        this.enabled = b.enabled;
        this.level = b.level;
        this.bufferSize = b.bufferSize;
        this.flushIntervalMs = b.flushIntervalMs;
        this.autoThrottleThresholdMs = b.autoThrottleThresholdMs;
        this.actorHistoryEnabled = b.actorHistoryEnabled;
        this.actorHistorySize = b.actorHistorySize;
        this.anomalyThresholdMs = b.anomalyThresholdMs;
        this.shadowMode = b.shadowMode;
        this.maxComparisons = b.maxComparisons;
        this.discrepancyThresholdMs = b.discrepancyThresholdMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AuditConfig defaults() {
        return builder().build();
    }

    public AuditConfig validate() throws ConfigurationException {
        if (level == null) {
            throw new ConfigurationException("audit.level must be set");
        }
        if (bufferSize <= 0) {
            throw new ConfigurationException("audit.bufferSize must be positive: " + bufferSize);
        }
        if (flushIntervalMs <= 0) {
            throw new ConfigurationException("audit.flushIntervalMs must be positive: " + flushIntervalMs);
        }
        if (autoThrottleThresholdMs < 0) {
            throw new ConfigurationException("audit.autoThrottleThresholdMs must not be negative: " + autoThrottleThresholdMs);
        }
        if (actorHistorySize <= 0) {
            throw new ConfigurationException("audit.actorHistorySize must be positive: " + actorHistorySize);
        }
        if (anomalyThresholdMs < 0 || discrepancyThresholdMs < 0) {
            throw new ConfigurationException("audit thresholds must not be negative");
        }
        if (maxComparisons <= 0) {
            throw new ConfigurationException("audit.maxComparisons must be positive: " + maxComparisons);
        }
        return this;
    }

    public boolean isEnabled() { return enabled; }
    public AuditLevel getLevel() { return level; }
    public int getBufferSize() { return bufferSize; }
    public long getFlushIntervalMs() { return flushIntervalMs; }
    /** Tick time above which the audit drops to standard detail; 0 disables throttling */
    public double getAutoThrottleThresholdMs() { return autoThrottleThresholdMs; }
    public boolean isActorHistoryEnabled() { return actorHistoryEnabled; }
    public int getActorHistorySize() { return actorHistorySize; }
    public double getAnomalyThresholdMs() { return anomalyThresholdMs; }
    public boolean isShadowMode() { return shadowMode; }
    public int getMaxComparisons() { return maxComparisons; }
    public double getDiscrepancyThresholdMs() { return discrepancyThresholdMs; }

    @Override
    public String toString() {
        return "AuditConfig[enabled=" + enabled + ", level=" + level + ", buffer=" + bufferSize
                + ", flush=" + flushIntervalMs + "ms, shadow=" + shadowMode + "]";
    }

    public static final class Builder {
        private boolean enabled = true;
        private AuditLevel level = AuditLevel.STANDARD;
        private int bufferSize = 10_000;
        private long flushIntervalMs = 5_000;
        private double autoThrottleThresholdMs = 10.0;
        private boolean actorHistoryEnabled = true;
        private int actorHistorySize = 100;
        private double anomalyThresholdMs = 50.0;
        private boolean shadowMode = false;
        private int maxComparisons = 10_000;
        private double discrepancyThresholdMs = 10.0;

        private Builder() {
        }

        public Builder enabled(boolean v) { this.enabled = v; return this; }
        public Builder level(AuditLevel v) { this.level = v; return this; }
        public Builder bufferSize(int v) { this.bufferSize = v; return this; }
        public Builder flushIntervalMs(long v) { this.flushIntervalMs = v; return this; }
        public Builder autoThrottleThresholdMs(double v) { this.autoThrottleThresholdMs = v; return this; }
        public Builder actorHistoryEnabled(boolean v) { this.actorHistoryEnabled = v; return this; }
        public Builder actorHistorySize(int v) { this.actorHistorySize = v; return this; }
        public Builder anomalyThresholdMs(double v) { this.anomalyThresholdMs = v; return this; }
        public Builder shadowMode(boolean v) { this.shadowMode = v; return this; }
        public Builder maxComparisons(int v) { this.maxComparisons = v; return this; }
        public Builder discrepancyThresholdMs(double v) { this.discrepancyThresholdMs = v; return this; }

        public AuditConfig build() {
            return new AuditConfig(this);
        }
    }
}
