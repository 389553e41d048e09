package com.example.spherecombat.duel;

import com.example.spherecombat.model.Actor;

import java.lang.ref.WeakReference;

/**
 * One actor's place in a duel: team and score.
 */
public class DuelParticipant {

    private final long serial;
    private final String name;
    private final WeakReference<Actor> actor;
    private final int teamId;

    private int kills;
    private int deaths;
    private boolean eliminated;
    private boolean ready;
    private boolean entryPaid;

    public DuelParticipant(Actor actor, int teamId) {
        this.serial = actor.getSerial();
        this.name = actor.getName();
        this.actor = new WeakReference<>(actor);
        this.teamId = teamId;
    }

    /** The actor, or null once it has been collected */
    public Actor getActor() {
        return actor.get();
    }

    public long getSerial() { return serial; }
    public String getName() { return name; }
    public int getTeamId() { return teamId; }
    public int getKills() { return kills; }
    public int getDeaths() { return deaths; }
    public boolean isEliminated() { return eliminated; }
    public boolean isReady() { return ready; }
    public void setReady(boolean ready) { this.ready = ready; }
    public boolean isEntryPaid() { return entryPaid; }
    void setEntryPaid(boolean entryPaid) { this.entryPaid = entryPaid; }

    public void recordKill() {
        kills++;
    }

    /**
     * A death always eliminates. There is no respawn within a duel.
     */
    public void recordDeath() {
        deaths++;
        eliminated = true;
    }

    /**
     * Still fighting: not eliminated and the actor is alive and present.
     */
    public boolean isStanding() {
        Actor a = actor.get();
        return !eliminated && a != null && a.isAlive() && !a.isDeleted();
    }

    @Override
    public String toString() {
        return name + "[team " + teamId + ", " + kills + "/" + deaths + (eliminated ? ", out" : "") + "]";
    }
}
