package com.example.spherecombat.duel;

/**
 * Hooks a duel context calls at the edges of the fight.
 */
public interface DuelRuleset {

    String getName();

    void onDuelBegin(DuelContext context);

    void onDuelEnd(DuelContext context);
}
