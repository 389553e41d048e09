package com.example.spherecombat.event;

/**
 * Structured event data handed to presentation and telemetry listeners.
 * Carries serials rather than actor references so listeners never keep actors alive.
 */
public final class CombatEvent {

    /** Serial used when an event has no second party */
    public static final long NO_ACTOR = 0L;

    private final CombatEventType type;
    private final long actorSerial;
    private final long otherSerial;
    private final String detail;
    private final long durationMs;
    private final long timestamp;

    public CombatEvent(CombatEventType type, long actorSerial, long otherSerial, String detail, long timestamp) {
        this(type, actorSerial, otherSerial, detail, 0L, timestamp);
    }

    /**
     * @param durationMs length of the timer the event starts, 0 if it starts none
     */
    public CombatEvent(CombatEventType type, long actorSerial, long otherSerial, String detail,
                       long durationMs, long timestamp) {
        this.type = type;
        this.actorSerial = actorSerial;
        this.otherSerial = otherSerial;
        this.detail = detail != null ? detail : "";
        this.durationMs = durationMs;
        this.timestamp = timestamp;
    }

    public CombatEventType getType() { return type; }
    public long getActorSerial() { return actorSerial; }
    public long getOtherSerial() { return otherSerial; }
    public String getDetail() { return detail; }
    public long getDurationMs() { return durationMs; }
    public long getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return String.format("CombatEvent[%s actor=%d other=%d detail=%s at=%d]",
                type, actorSerial, otherSerial, detail, timestamp);
    }
}
