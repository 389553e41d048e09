package com.example.spherecombat.duel;

import com.example.spherecombat.model.Actor;

/**
 * Host-side gold account used to hold wagers.
 */
public interface GoldEscrow {

    /**
     * Take gold from the actor.
     * @return false if the actor cannot cover the amount; nothing is taken then
     */
    boolean withdraw(Actor actor, int amount);

    void deposit(Actor actor, int amount);

    int getBalance(Actor actor);
}
