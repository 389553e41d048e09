package com.example.spherecombat.combat;

/**
 * Timing values for one (actor, implement) pair at the moment they were computed.
 */
public final class TimingSnapshot {
    private final int attackIntervalMs;
    private final int animationHitOffsetMs;
    private final int animationDurationMs;

    public TimingSnapshot(int attackIntervalMs, int animationHitOffsetMs, int animationDurationMs) {
        this.attackIntervalMs = attackIntervalMs;
        this.animationHitOffsetMs = animationHitOffsetMs;
        this.animationDurationMs = animationDurationMs;
    }

    public int getAttackIntervalMs() { return attackIntervalMs; }
    public int getAnimationHitOffsetMs() { return animationHitOffsetMs; }
    public int getAnimationDurationMs() { return animationDurationMs; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimingSnapshot)) return false;
        TimingSnapshot other = (TimingSnapshot) o;
        return attackIntervalMs == other.attackIntervalMs
                && animationHitOffsetMs == other.animationHitOffsetMs
                && animationDurationMs == other.animationDurationMs;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * attackIntervalMs + animationHitOffsetMs) + animationDurationMs;
    }

    @Override
    public String toString() {
        return String.format("TimingSnapshot[interval=%dms hit=%dms anim=%dms]",
                attackIntervalMs, animationHitOffsetMs, animationDurationMs);
    }
}
