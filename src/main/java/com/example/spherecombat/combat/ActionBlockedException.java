package com.example.spherecombat.combat;

/**
 * A requested action is not allowed right now, either by the cancellation policy or
 * because its own timer has not recovered. This is a rejection to show the actor,
 * not a system fault.
 */
public class ActionBlockedException extends RuntimeException {

    private final ActionKind action;
    private final long remainingMs;

    public ActionBlockedException(ActionKind action, String reason) {
        this(action, reason, 0);
    }

    public ActionBlockedException(ActionKind action, String reason, long remainingMs) {
        super(action.getDisplayName() + " blocked: " + reason);
        this.action = action;
        this.remainingMs = remainingMs;
    }

    public ActionKind getAction() {
        return action;
    }

    /** Time until the blocking timer recovers, or 0 when the block is policy-based */
    public long getRemainingMs() {
        return remainingMs;
    }
}
