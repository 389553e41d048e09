package com.example.spherecombat.audit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One recorded combat action with its expected and measured timing.
 * Variance is actual minus expected: positive means the action came late.
 */
public final class CombatLogEntry {

    /** Action name used for provider comparisons, which have no event type */
    public static final String SHADOW_COMPARISON = "SHADOW_COMPARISON";

    private final long timestamp;
    private final long actorSerial;
    private final long otherSerial;
    private final String action;
    private final String timingProvider;
    private final AuditLevel level;
    private final long expectedDelayMs;
    private final long actualDelayMs;
    private final boolean measured;
    private final String detail;
    private final Map<String, Object> details = new LinkedHashMap<>();

    public CombatLogEntry(long timestamp, long actorSerial, long otherSerial, String action,
                          String timingProvider, AuditLevel level, String detail) {
        this(timestamp, actorSerial, otherSerial, action, timingProvider, level, detail, 0, 0, false);
    }

    public CombatLogEntry(long timestamp, long actorSerial, long otherSerial, String action,
                          String timingProvider, AuditLevel level, String detail,
                          long expectedDelayMs, long actualDelayMs, boolean measured) {
        this.timestamp = timestamp;
        this.actorSerial = actorSerial;
        this.otherSerial = otherSerial;
        this.action = action;
        this.timingProvider = timingProvider;
        this.level = level;
        this.detail = detail != null ? detail : "";
        this.expectedDelayMs = expectedDelayMs;
        this.actualDelayMs = actualDelayMs;
        this.measured = measured;
    }

    public long getTimestamp() { return timestamp; }
    public long getActorSerial() { return actorSerial; }
    public long getOtherSerial() { return otherSerial; }
    public String getAction() { return action; }
    public String getTimingProvider() { return timingProvider; }
    public AuditLevel getLevel() { return level; }
    public String getDetail() { return detail; }
    public long getExpectedDelayMs() { return expectedDelayMs; }
    public long getActualDelayMs() { return actualDelayMs; }

    /** Whether the actual delay was measured against an earlier start */
    public boolean isMeasured() { return measured; }

    public long getVarianceMs() {
        return measured ? actualDelayMs - expectedDelayMs : 0;
    }

    public boolean isAnomaly(double thresholdMs) {
        return measured && Math.abs(getVarianceMs()) > thresholdMs;
    }

    public CombatLogEntry addDetail(String key, Object value) {
        details.put(key, value);
        return this;
    }

    public Object getDetail(String key) {
        return details.get(key);
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(timestamp).append("] #").append(actorSerial).append(' ').append(action);
        if (measured) {
            long variance = getVarianceMs();
            sb.append(": ").append(actualDelayMs).append("ms (expected ").append(expectedDelayMs)
                    .append("ms, ").append(variance >= 0 ? "+" : "").append(variance).append("ms)");
        } else if (expectedDelayMs > 0) {
            sb.append(": expected ").append(expectedDelayMs).append("ms");
        }
        if (!detail.isEmpty()) {
            sb.append(" - ").append(detail);
        }
        if (!details.isEmpty()) {
            sb.append(' ').append(details);
        }
        return sb.toString();
    }
}
