package com.example.spherecombat.duel;

import java.util.Arrays;

/**
 * Notification of a duel lifecycle step, for presentation layers.
 */
public final class DuelEvent {

    /** Context id used for events that happen before a duel context exists */
    public static final long NO_CONTEXT = 0L;

    private final DuelEventType type;
    private final long contextId;
    private final long[] actorSerials;
    private final String detail;

    public DuelEvent(DuelEventType type, long contextId, String detail, long... actorSerials) {
        this.type = type;
        this.contextId = contextId;
        this.detail = detail;
        this.actorSerials = actorSerials != null ? actorSerials.clone() : new long[0];
    }

    public DuelEventType getType() { return type; }
    public long getContextId() { return contextId; }
    public String getDetail() { return detail; }

    public long[] getActorSerials() {
        return actorSerials.clone();
    }

    public boolean involves(long serial) {
        for (long s : actorSerials) {
            if (s == serial) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return type + "[duel " + contextId + ", actors " + Arrays.toString(actorSerials)
                + (detail != null ? ", " + detail : "") + "]";
    }
}
