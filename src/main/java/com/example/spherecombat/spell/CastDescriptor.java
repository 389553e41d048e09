package com.example.spherecombat.spell;

import com.example.spherecombat.model.Actor;
import com.example.spherecombat.util.TimerToken;

import java.lang.ref.WeakReference;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One in-flight spell cast.
 * Owned by the caster's timing state; the scheduler only holds a weak handle to it.
 * Caster and target are weak so a pending cast never keeps a deleted actor around.
 */
public class CastDescriptor {

    private static final AtomicLong idGenerator = new AtomicLong(1);

    private final long id;
    private final long casterSerial;
    private final WeakReference<Actor> caster;
    private final SpellDefinition spell;
    private final boolean fromScroll;
    private final long createdAt;

    private volatile CastState state = CastState.AWAITING_TARGET;
    private WeakReference<Actor> target = new WeakReference<>(null);
    private long targetSerial;
    private int tiles;
    private int targetCount = 1;

    /** Set once mana and reagents are taken; never reverts */
    private boolean resourcesCommitted;
    private int manaCommitted;
    private long scheduledEffectTime;
    private TimerToken delayTimer;
    private String failureReason;

    /** Called exactly once when the cast reaches a terminal state */
    private Consumer<CastDescriptor> terminationListener;

    public CastDescriptor(Actor caster, SpellDefinition spell, boolean fromScroll, long createdAt) {
        this.id = idGenerator.getAndIncrement();
        this.casterSerial = caster.getSerial();
        this.caster = new WeakReference<>(caster);
        this.spell = spell;
        this.fromScroll = fromScroll;
        this.createdAt = createdAt;
    }

    public long getId() { return id; }
    public long getCasterSerial() { return casterSerial; }
    public SpellDefinition getSpell() { return spell; }
    public boolean isFromScroll() { return fromScroll; }
    public long getCreatedAt() { return createdAt; }
    public CastState getState() { return state; }
    public long getTargetSerial() { return targetSerial; }
    public int getTiles() { return tiles; }
    public int getTargetCount() { return targetCount; }
    public boolean isResourcesCommitted() { return resourcesCommitted; }
    public int getManaCommitted() { return manaCommitted; }
    public long getScheduledEffectTime() { return scheduledEffectTime; }
    public String getFailureReason() { return failureReason; }

    /** The caster, or null once it has been collected */
    public Actor getCaster() {
        return caster.get();
    }

    /** The confirmed target, or null if none was chosen or it has been collected */
    public Actor getTarget() {
        return target.get();
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /** Target cursor up or resources being taken */
    public boolean isCasting() {
        return state == CastState.AWAITING_TARGET || state == CastState.RESOURCE_COMMIT;
    }

    public boolean isInCastDelay() {
        return state == CastState.DELAYING;
    }

    void setTarget(Actor target, int tiles, int targetCount) {
        this.target = new WeakReference<>(target);
        this.targetSerial = target != null ? target.getSerial() : 0L;
        this.tiles = Math.max(0, tiles);
        this.targetCount = Math.max(1, targetCount);
    }

    void markCommitted(int mana) {
        this.resourcesCommitted = true;
        this.manaCommitted = mana;
    }

    void setDelayTimer(TimerToken delayTimer, long scheduledEffectTime) {
        this.delayTimer = delayTimer;
        this.scheduledEffectTime = scheduledEffectTime;
    }

    void setTerminationListener(Consumer<CastDescriptor> terminationListener) {
        this.terminationListener = terminationListener;
    }

    /**
     * Move to a non-terminal state.
     * @return false if the cast already ended
     */
    boolean advanceTo(CastState next) {
        if (state.isTerminal() || next.isTerminal()) {
            return false;
        }
        state = next;
        return true;
    }

    /**
     * End the cast. The delay timer is cancelled and the listener notified once.
     * @return false if the cast had already ended
     */
    public boolean terminate(CastState terminal, String reason) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException(terminal + " is not a terminal cast state");
        }
        if (state.isTerminal()) {
            return false;
        }
        state = terminal;
        failureReason = reason;
        if (delayTimer != null) {
            delayTimer.cancel();
        }
        Consumer<CastDescriptor> listener = terminationListener;
        terminationListener = null;
        if (listener != null) {
            listener.accept(this);
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("Cast#%d[%s by %d -> %d, %s%s]", id, spell.getName(), casterSerial, targetSerial,
                state.getDisplayName(), failureReason != null ? ": " + failureReason : "");
    }
}
