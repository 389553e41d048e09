package com.example.spherecombat.duel;

public enum DuelEventType {
    CHALLENGE_ISSUED,
    CHALLENGE_ACCEPTED,
    CHALLENGE_DECLINED,
    CHALLENGE_EXPIRED,
    CHALLENGE_REJECTED,
    DUEL_CREATED,
    COUNTDOWN_STARTED,
    DUEL_STARTED,
    PARTICIPANT_ELIMINATED,
    DUEL_ENDED,
    LOOT_PHASE_STARTED,
    DUEL_COMPLETED
}
