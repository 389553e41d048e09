package com.example.spherecombat.spell;

/**
 * Caster or target can no longer take part when a cast resolves. Causes an interruption.
 */
public class TargetInvalidException extends RuntimeException {

    public TargetInvalidException(String message) {
        super(message);
    }
}
