package com.example.spherecombat.event;

/**
 * Kinds of observable events raised by the timing engine.
 */
public enum CombatEventType {

    SWING_BEGIN("Swing begun"),
    SWING_COMPLETE("Swing completed"),
    HIT_RESOLVED("Hit resolved"),

    SPELL_CAST_BEGIN("Spell cast begun"),
    SPELL_CAST_COMPLETE("Spell cast completed"),
    SPELL_FIZZLED("Spell fizzled"),
    SPELL_INTERRUPTED("Spell interrupted"),
    SPELL_REFLECTED("Spell reflected"),

    BANDAGE_BEGIN("Bandage begun"),
    BANDAGE_COMPLETE("Bandage completed"),
    WAND_USE("Wand used"),
    WAND_COMPLETE("Wand use completed"),

    COMBAT_ENTER("Entered combat"),
    COMBAT_EXIT("Left combat"),

    /** A requested action was rejected by policy or timer state */
    ACTION_BLOCKED("Action blocked"),

    /** A pulse tick ran longer than the pulse period */
    THROTTLE("Pulse throttled"),

    /** One actor's processing failed during a pulse tick */
    SCHEDULER_FAULT("Scheduler fault");

    private final String displayName;

    CombatEventType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
