package com.example.spherecombat.combat;

/**
 * Wraps an unexpected failure while the pulse processed one actor.
 * Logged and counted by the pulse; never thrown out of a tick.
 */
public class SchedulerFaultException extends RuntimeException {

    private final long actorSerial;
    private final long tick;

    public SchedulerFaultException(long actorSerial, long tick, Throwable cause) {
        super("Pulse tick " + tick + " failed for actor " + actorSerial + ": " + cause.getMessage(), cause);
        this.actorSerial = actorSerial;
        this.tick = tick;
    }

    public long getActorSerial() {
        return actorSerial;
    }

    public long getTick() {
        return tick;
    }
}
