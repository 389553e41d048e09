package com.example.spherecombat.event;

import com.example.spherecombat.util.TickScheduler;
import com.example.spherecombat.util.TimerToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Virtual-time scheduler.
 * Events wait in a priority queue ordered by due time and only run when the clock is
 * moved forward with {@link #advance(long)}. Used to replay combat deterministically,
 * e.g. for load tests or unit tests, on the same {@link TickScheduler} contract as
 * the wall-clock service.
 */
public class EventScheduler implements TickScheduler {
    private static final Logger logger = LoggerFactory.getLogger(EventScheduler.class);

    /** Events ordered by due time, then by scheduling order */
    private final PriorityQueue<ScheduledEvent> eventQueue = new PriorityQueue<>();

    /** Named periodic events, for cancellation by name */
    private final Map<String, ScheduledEvent> recurringEvents = new ConcurrentHashMap<>();

    private final AtomicLong sequence = new AtomicLong();

    private long now;
    private boolean shutdown = false;

    public EventScheduler() {
        this(0L);
    }

    public EventScheduler(long startTime) {
        this.now = startTime;
    }

    @Override
    public synchronized long now() {
        return now;
    }

    @Override
    public synchronized TimerToken schedule(Runnable task, long delayMs) {
        ScheduledEvent event = new ScheduledEvent(task, now + Math.max(0, delayMs), 0, sequence.incrementAndGet(), null);
        if (!shutdown) {
            eventQueue.offer(event);
        } else {
            event.cancelled = true;
        }
        return event;
    }

    @Override
    public synchronized TimerToken scheduleAtFixedRate(String name, Runnable task, long initialDelayMs, long periodMs) {
        if (periodMs <= 0) {
            throw new IllegalArgumentException("period must be positive: " + periodMs);
        }
        ScheduledEvent event = new ScheduledEvent(task, now + Math.max(0, initialDelayMs), periodMs, sequence.incrementAndGet(), name);
        ScheduledEvent previous = recurringEvents.put(name, event);
        if (previous != null) {
            previous.cancel();
        }
        if (!shutdown) {
            eventQueue.offer(event);
        }
        return event;
    }

    @Override
    public synchronized boolean cancel(String name) {
        ScheduledEvent event = recurringEvents.remove(name);
        if (event == null) return false;
        event.cancel();
        return true;
    }

    /**
     * Virtual time has no thread of its own; whoever drives {@link #advance(long)} is the context.
     */
    @Override
    public boolean isSchedulerThread() {
        return true;
    }

    @Override
    public synchronized void shutdown() {
        shutdown = true;
        for (ScheduledEvent event : eventQueue) {
            event.cancelled = true;
        }
        eventQueue.clear();
        recurringEvents.clear();
    }

    /**
     * Move the clock forward, running every event that falls due on the way in order.
     * @return number of callbacks executed
     */
    public synchronized int advance(long deltaMs) {
        if (deltaMs < 0) {
            throw new IllegalArgumentException("cannot move time backwards: " + deltaMs);
        }
        long target = now + deltaMs;
        int processed = 0;

        while (!eventQueue.isEmpty()) {
            ScheduledEvent scheduled = eventQueue.peek();
            if (scheduled.executeAt > target) {
                break;
            }
            eventQueue.poll();
            if (scheduled.cancelled) {
                continue;
            }
            now = Math.max(now, scheduled.executeAt);

            if (scheduled.periodMs > 0) {
                scheduled.executeAt += scheduled.periodMs;
                eventQueue.offer(scheduled);
            } else {
                scheduled.done = true;
            }

            try {
                scheduled.task.run();
            } catch (RuntimeException e) {
                logger.error("[EventScheduler] Error executing event{}", scheduled.name != null ? " " + scheduled.name : "", e);
            }
            processed++;
        }

        now = target;
        return processed;
    }

    /**
     * Run everything that is due at the current instant without moving the clock.
     */
    public int runPending() {
        return advance(0);
    }

    /**
     * Number of live events still queued.
     */
    public synchronized int getPendingEventCount() {
        int count = 0;
        for (ScheduledEvent event : eventQueue) {
            if (!event.cancelled) count++;
        }
        return count;
    }

    public synchronized int getRecurringEventCount() {
        return recurringEvents.size();
    }

    // ===== Inner Classes =====

    /**
     * A queued callback; also its own cancellation token.
     */
    private static final class ScheduledEvent implements Comparable<ScheduledEvent>, TimerToken {
        final Runnable task;
        final long periodMs;      // 0 for one-shot events
        final long seq;
        final String name;        // null for one-shot events
        long executeAt;
        volatile boolean cancelled;
        volatile boolean done;

        ScheduledEvent(Runnable task, long executeAt, long periodMs, long seq, String name) {
            this.task = task;
            this.executeAt = executeAt;
            this.periodMs = periodMs;
            this.seq = seq;
            this.name = name;
        }

        @Override
        public int compareTo(ScheduledEvent other) {
            int c = Long.compare(this.executeAt, other.executeAt);
            return c != 0 ? c : Long.compare(this.seq, other.seq);
        }

        @Override
        public boolean cancel() {
            if (cancelled || done) return false;
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return cancelled || done;
        }
    }
}
