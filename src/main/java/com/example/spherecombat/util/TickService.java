package com.example.spherecombat.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Wall-clock scheduler backed by a single daemon thread.
 * Periodic tasks are registered by name; one-shot tasks hand back a {@link TimerToken}.
 */
public class TickService implements TickScheduler {
    private static final Logger logger = LoggerFactory.getLogger(TickService.class);

    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();
    private volatile Thread tickThread;

    public TickService() {
        this("sphere-tick");
    }

    public TickService(String threadName) {
        // one thread: every timer callback is serialized with the pulse
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            tickThread = t;
            return t;
        });
    }

    @Override
    public long now() {
        return System.currentTimeMillis();
    }

    @Override
    public TimerToken schedule(Runnable task, long delayMs) {
        ScheduledFuture<?> f = scheduler.schedule(guard("one-shot", task), Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        return new FutureToken(f);
    }

    @Override
    public TimerToken scheduleAtFixedRate(String name, Runnable task, long initialDelayMs, long periodMs) {
        ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(guard(name, task), initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = tasks.put(name, f);
        if (previous != null) {
            previous.cancel(false);
        }
        return new FutureToken(f);
    }

    @Override
    public boolean cancel(String name) {
        ScheduledFuture<?> f = tasks.remove(name);
        if (f == null) return false;
        f.cancel(false);
        return true;
    }

    @Override
    public boolean isSchedulerThread() {
        return Thread.currentThread() == tickThread;
    }

    @Override
    public void shutdown() {
        for (ScheduledFuture<?> f : tasks.values()) {
            f.cancel(false);
        }
        tasks.clear();
        scheduler.shutdownNow();
        logger.info("[TickService] Shut down");
    }

    /**
     * Block until the tick thread has finished whatever it was running after {@link #shutdown()}.
     * @return false if it was still busy when the timeout ran out
     */
    public boolean awaitTermination(long timeoutMs) throws InterruptedException {
        return scheduler.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public boolean isTerminated() {
        return scheduler.isTerminated();
    }

    /**
     * An exception escaping a periodic task would silently stop its future runs,
     * so every task is wrapped and failures are logged instead.
     */
    private static Runnable guard(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("[TickService] Task '{}' failed", name, e);
            }
        };
    }

    private static final class FutureToken implements TimerToken {
        private final ScheduledFuture<?> future;

        FutureToken(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            return future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }

        @Override
        public boolean isDone() {
            return future.isDone();
        }
    }
}
