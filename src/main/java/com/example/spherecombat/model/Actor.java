package com.example.spherecombat.model;

/**
 * The narrow view of a game mobile that the timing and duel engines need.
 * Implemented by the host game's player and creature objects.
 */
public interface Actor {

    /** Unique, stable identifier */
    long getSerial();

    String getName();

    boolean isAlive();

    /** True once the actor has been removed from the world; never reverts */
    boolean isDeleted();

    /** Players get dexterity scaling on swing speed; creatures do not */
    boolean isPlayer();

    /** Currently equipped weapon, or null when fighting unarmed */
    Implement getEquippedImplement();

    int getDexterity();

    /**
     * Skill value on the 0-100 scale.
     * @param skillName skill key, e.g. "Magery"
     */
    double getSkillValue(String skillName);

    int getMana();

    void setMana(int mana);

    int getHits();

    int getMaxHits();

    boolean isMounted();

    /** Current combat opponent, or null */
    Actor getCombatTarget();

    boolean hasLineOfSightTo(Actor other);

    /** Remaining magic-reflect charge; positive means spells bounce back */
    int getMagicDamageAbsorb();
}
