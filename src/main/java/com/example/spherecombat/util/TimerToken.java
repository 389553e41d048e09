package com.example.spherecombat.util;

/**
 * Cancellation handle for a scheduled callback.
 * Cancelling is idempotent and safe after the callback has already run.
 */
public interface TimerToken {

    /**
     * Cancel the callback if it has not run yet.
     * @return true if this call prevented the callback from running
     */
    boolean cancel();

    boolean isCancelled();

    /** True once the callback has run, been cancelled, or can no longer run. */
    boolean isDone();
}
