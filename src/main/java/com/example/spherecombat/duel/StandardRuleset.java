package com.example.spherecombat.duel;

/**
 * Plain duel rules: the combat timing of participants is left alone.
 */
public class StandardRuleset implements DuelRuleset {

    public static final String NAME = "standard";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void onDuelBegin(DuelContext context) {
    }

    @Override
    public void onDuelEnd(DuelContext context) {
    }
}
