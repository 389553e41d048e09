package com.example.spherecombat;

import com.example.spherecombat.duel.GoldEscrow;
import com.example.spherecombat.model.Actor;

import java.util.HashMap;
import java.util.Map;

class RecordingEscrow implements GoldEscrow {

    final Map<Long, Integer> balances = new HashMap<>();
    int deposits;

    void give(Actor actor, int amount) {
        balances.merge(actor.getSerial(), amount, Integer::sum);
    }

    @Override
    public boolean withdraw(Actor actor, int amount) {
        int balance = getBalance(actor);
        if (balance < amount) return false;
        balances.put(actor.getSerial(), balance - amount);
        return true;
    }

    @Override
    public void deposit(Actor actor, int amount) {
        deposits++;
        give(actor, amount);
    }

    @Override
    public int getBalance(Actor actor) {
        return balances.getOrDefault(actor.getSerial(), 0);
    }
}
