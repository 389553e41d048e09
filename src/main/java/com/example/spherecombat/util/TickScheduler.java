package com.example.spherecombat.util;

/**
 * The single serialized execution context every timer runs on.
 * All callbacks scheduled through one instance run one at a time, in due-time order,
 * so game state touched only from these callbacks needs no further locking.
 */
public interface TickScheduler {

    /** Current time in milliseconds as seen by callbacks on this scheduler. */
    long now();

    /**
     * Run a task once after the given delay.
     * @return token the owner keeps so it can cancel on a terminal transition
     */
    TimerToken schedule(Runnable task, long delayMs);

    /**
     * Run a named task repeatedly. A task already registered under the same name is cancelled.
     */
    TimerToken scheduleAtFixedRate(String name, Runnable task, long initialDelayMs, long periodMs);

    /**
     * Cancel a named periodic task.
     * @return true if a task was registered under that name
     */
    boolean cancel(String name);

    /**
     * Whether the calling thread is this scheduler's execution context. Work from any
     * other thread has to be handed over with {@link #schedule(Runnable, long)}.
     */
    boolean isSchedulerThread();

    void shutdown();
}
