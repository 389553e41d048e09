package com.example.spherecombat.duel;

import com.example.spherecombat.model.Actor;
import com.example.spherecombat.model.Arena;
import com.example.spherecombat.util.TimerToken;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One duel in one arena, from gathering through cleanup.
 * Mutated only from the scheduler context by {@link DuelManager}.
 */
public class DuelContext {

    private static final AtomicLong idGenerator = new AtomicLong(1);

    private final long id;
    private final Arena arena;
    private final DuelType type;
    private final DuelRuleset ruleset;
    private final int entryCost;
    private final long createdAt;
    private final List<DuelParticipant> participants = new ArrayList<>();

    private DuelState state = DuelState.WAITING;
    private long startTime;
    private long endTime;
    private DuelParticipant winner;
    private int winningTeam = -1;
    private boolean draw;

    /** The single pending timer of the current phase */
    private TimerToken phaseTimer;

    public DuelContext(Arena arena, DuelType type, DuelRuleset ruleset, int entryCost, long createdAt) {
        this.id = idGenerator.getAndIncrement();
        this.arena = arena;
        this.type = type;
        this.ruleset = ruleset != null ? ruleset : new StandardRuleset();
        this.entryCost = Math.max(0, entryCost);
        this.createdAt = createdAt;
    }

    /**
     * Add an actor while the duel is still gathering. The team alternates with join order.
     * @return the new participant, or null if the duel is full, past WAITING, or already has the actor
     */
    DuelParticipant addParticipant(Actor actor) {
        if (actor == null || state != DuelState.WAITING || isFull() || getParticipant(actor.getSerial()) != null) {
            return null;
        }
        DuelParticipant participant = new DuelParticipant(actor, participants.size() % 2);
        participants.add(participant);
        return participant;
    }

    boolean removeParticipant(DuelParticipant participant) {
        return participants.remove(participant);
    }

    public DuelParticipant getParticipant(long serial) {
        for (DuelParticipant p : participants) {
            if (p.getSerial() == serial) return p;
        }
        return null;
    }

    public boolean isFull() {
        return participants.size() >= getCapacity();
    }

    public int getCapacity() {
        return Math.min(type.getCapacity(), arena.getMaxPlayers());
    }

    public List<DuelParticipant> getParticipants() {
        return Collections.unmodifiableList(participants);
    }

    public int getParticipantCount() {
        return participants.size();
    }

    public long getId() { return id; }
    public Arena getArena() { return arena; }
    public DuelType getType() { return type; }
    public DuelRuleset getRuleset() { return ruleset; }
    public int getEntryCost() { return entryCost; }
    public boolean isLoot() { return type.isLoot(); }
    public long getCreatedAt() { return createdAt; }
    public DuelState getState() { return state; }
    public long getStartTime() { return startTime; }
    public long getEndTime() { return endTime; }
    public DuelParticipant getWinner() { return winner; }
    public int getWinningTeam() { return winningTeam; }
    public boolean isDraw() { return draw; }

    void setState(DuelState state) { this.state = state; }
    void setStartTime(long startTime) { this.startTime = startTime; }
    void setEndTime(long endTime) { this.endTime = endTime; }

    void setOutcome(DuelParticipant winner, int winningTeam, boolean draw) {
        this.winner = winner;
        this.winningTeam = winningTeam;
        this.draw = draw;
    }

    /** Replace the phase timer, cancelling the previous one */
    void setPhaseTimer(TimerToken timer) {
        cancelTimers();
        this.phaseTimer = timer;
    }

    void cancelTimers() {
        TimerToken timer = phaseTimer;
        phaseTimer = null;
        if (timer != null) {
            timer.cancel();
        }
    }

    @Override
    public String toString() {
        return "Duel#" + id + "[" + type.getDisplayName() + " @ " + arena.getName() + ", " + state.getDisplayName()
                + ", " + participants.size() + "/" + getCapacity() + "]";
    }
}
