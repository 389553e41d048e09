package com.example.spherecombat.spell;

/**
 * The caster lacks the mana or reagents a cast needs at commit time. Causes a fizzle.
 */
public class InsufficientResourcesException extends RuntimeException {

    public InsufficientResourcesException(String message) {
        super(message);
    }
}
