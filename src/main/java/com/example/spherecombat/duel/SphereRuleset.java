package com.example.spherecombat.duel;

import com.example.spherecombat.combat.CombatantRoster;
import com.example.spherecombat.combat.CombatantTimingState;
import com.example.spherecombat.model.Actor;
import com.example.spherecombat.util.TickScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Duel rules that put every participant on the real-time timing engine.
 * Timers start clean when the fight begins. Unregistering at the end cancels anything in flight.
 */
public class SphereRuleset implements DuelRuleset {
    private static final Logger logger = LoggerFactory.getLogger(SphereRuleset.class);

    public static final String NAME = "sphere";

    private final CombatantRoster roster;
    private final TickScheduler scheduler;

    public SphereRuleset(CombatantRoster roster, TickScheduler scheduler) {
        this.roster = roster;
        this.scheduler = scheduler;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void onDuelBegin(DuelContext context) {
        long now = scheduler.now();
        for (DuelParticipant participant : context.getParticipants()) {
            Actor actor = participant.getActor();
            if (actor == null || actor.isDeleted()) continue;
            CombatantTimingState state = roster.register(actor, now);
            if (state != null) {
                state.clearAllTimers();
            }
        }
        logger.debug("[SphereRuleset] Duel {} timers armed for {} participants", context.getId(), context.getParticipantCount());
    }

    @Override
    public void onDuelEnd(DuelContext context) {
        long now = scheduler.now();
        for (DuelParticipant participant : context.getParticipants()) {
            roster.unregister(participant.getSerial(), "Duel ended", now);
        }
    }
}
