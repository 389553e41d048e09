package com.example.spherecombat.duel;

import com.example.spherecombat.model.Actor;
import com.example.spherecombat.model.Arena;
import com.example.spherecombat.util.TimerToken;

import java.lang.ref.WeakReference;

/**
 * A challenge issued but not yet answered. The initiator's wager sits in escrow
 * until the challenge is accepted, declined, or expires.
 */
public class PendingChallenge {

    private final long initiatorSerial;
    private final long targetSerial;
    private final WeakReference<Actor> initiator;
    private final WeakReference<Actor> target;
    private final Arena arena;
    private final int wager;
    private final boolean loot;
    private final long createdAt;
    private final long expiresAt;

    private TimerToken timeoutTimer;
    private boolean escrowHeld;

    public PendingChallenge(Actor initiator, Actor target, Arena arena, int wager, boolean loot,
                            long createdAt, long timeoutMs) {
        this.initiatorSerial = initiator.getSerial();
        this.targetSerial = target.getSerial();
        this.initiator = new WeakReference<>(initiator);
        this.target = new WeakReference<>(target);
        this.arena = arena;
        this.wager = wager;
        this.loot = loot;
        this.createdAt = createdAt;
        this.expiresAt = createdAt + timeoutMs;
    }

    public Actor getInitiator() { return initiator.get(); }
    public Actor getTarget() { return target.get(); }
    public long getInitiatorSerial() { return initiatorSerial; }
    public long getTargetSerial() { return targetSerial; }
    public Arena getArena() { return arena; }
    public int getWager() { return wager; }
    public boolean isLoot() { return loot; }
    public long getCreatedAt() { return createdAt; }
    public long getExpiresAt() { return expiresAt; }
    public boolean isEscrowHeld() { return escrowHeld; }

    public boolean isExpired(long now) {
        return now >= expiresAt;
    }

    void markEscrowHeld() {
        escrowHeld = true;
    }

    void setTimeoutTimer(TimerToken timeoutTimer) {
        this.timeoutTimer = timeoutTimer;
    }

    void cancelTimeout() {
        TimerToken timer = timeoutTimer;
        timeoutTimer = null;
        if (timer != null) {
            timer.cancel();
        }
    }

    /**
     * Give the initiator's wager back. Only the first call pays.
     * @return true if this call paid the refund
     */
    boolean refund(GoldEscrow escrow) {
        if (!escrowHeld) {
            return false;
        }
        escrowHeld = false;
        Actor actor = initiator.get();
        if (actor != null && !actor.isDeleted()) {
            escrow.deposit(actor, wager);
        }
        return true;
    }

    public boolean involves(long serial) {
        return serial == initiatorSerial || serial == targetSerial;
    }

    @Override
    public String toString() {
        return "Challenge[" + initiatorSerial + " -> " + targetSerial + ", " + wager + (loot ? " loot" : " gold") + "]";
    }
}
