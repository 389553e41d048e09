package com.example.spherecombat.duel;

import com.example.spherecombat.model.Actor;

/**
 * Host-side world operations a duel needs.
 */
public interface ArenaController {

    void teleportToArena(Actor actor, int spawnIndex);

    void setFrozen(Actor actor, boolean frozen);

    /** Heal to full and cure, ready to fight or leave */
    void restore(Actor actor);

    void returnToOrigin(Actor actor);

    /** Forget any aggression and criminal flagging between the two */
    void clearAggression(Actor a, Actor b);
}
