package com.example.spherecombat;

import com.example.spherecombat.event.EventScheduler;
import com.example.spherecombat.util.TimerToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EventScheduler Tests")
class EventSchedulerTest {

    private final EventScheduler scheduler = new EventScheduler();
    private final List<String> order = new ArrayList<>();

    @Test
    @DisplayName("Events run in due order, ties in scheduling order")
    void dueOrder() {
        scheduler.schedule(() -> order.add("late"), 300);
        scheduler.schedule(() -> order.add("first"), 100);
        scheduler.schedule(() -> order.add("second"), 100);

        assertEquals(3, scheduler.advance(1000));

        assertEquals(List.of("first", "second", "late"), order);
        assertEquals(1000, scheduler.now());
    }

    @Test
    @DisplayName("The clock reads the due time while an event runs")
    void clockDuringEvent() {
        List<Long> seen = new ArrayList<>();
        scheduler.schedule(() -> seen.add(scheduler.now()), 250);

        scheduler.advance(1000);

        assertEquals(List.of(250L), seen);
    }

    @Test
    @DisplayName("Events scheduled during an advance run in it when they fall due")
    void nestedScheduling() {
        scheduler.schedule(() -> {
            order.add("outer");
            scheduler.schedule(() -> order.add("inner"), 100);
        }, 100);

        scheduler.advance(150);
        assertEquals(List.of("outer"), order);
        scheduler.advance(50);
        assertEquals(List.of("outer", "inner"), order);
    }

    @Test
    @DisplayName("runPending runs zero-delay work without moving the clock")
    void runPending() {
        scheduler.advance(400);
        scheduler.schedule(() -> order.add("now"), 0);
        scheduler.schedule(() -> order.add("later"), 10);

        assertEquals(1, scheduler.runPending());

        assertEquals(List.of("now"), order);
        assertEquals(400, scheduler.now());
        assertEquals(1, scheduler.getPendingEventCount());
        assertEquals(0, scheduler.runPending());
    }

    @Test
    @DisplayName("Cancelled events never run")
    void cancellation() {
        TimerToken token = scheduler.schedule(() -> order.add("cancelled"), 100);

        assertTrue(token.cancel());
        assertFalse(token.cancel());
        assertEquals(0, scheduler.getPendingEventCount());
        scheduler.advance(200);

        assertTrue(order.isEmpty());
        assertTrue(token.isDone());
    }

    @Test
    @DisplayName("Fixed-rate tasks repeat until cancelled by name")
    void fixedRate() {
        int[] runs = {0};
        scheduler.scheduleAtFixedRate("pulse", () -> runs[0]++, 50, 50);

        scheduler.advance(500);
        assertEquals(10, runs[0]);

        assertTrue(scheduler.cancel("pulse"));
        assertFalse(scheduler.cancel("pulse"));
        scheduler.advance(500);
        assertEquals(10, runs[0]);
    }

    @Test
    @DisplayName("A failing event does not stop the rest")
    void failingEvent() {
        scheduler.schedule(() -> { throw new IllegalStateException("boom"); }, 10);
        scheduler.schedule(() -> order.add("after"), 20);

        assertDoesNotThrow(() -> scheduler.advance(100));
        assertEquals(List.of("after"), order);
    }

    @Test
    @DisplayName("Shutdown drops everything queued")
    void shutdown() {
        scheduler.schedule(() -> order.add("never"), 10);
        scheduler.scheduleAtFixedRate("pulse", () -> order.add("tick"), 10, 10);

        scheduler.shutdown();
        TimerToken late = scheduler.schedule(() -> order.add("late"), 10);
        scheduler.advance(100);

        assertTrue(order.isEmpty());
        assertTrue(late.isCancelled());
        assertEquals(0, scheduler.getRecurringEventCount());
    }

    @Test
    @DisplayName("Time cannot run backwards")
    void noBackwards() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.advance(-1));
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleAtFixedRate("bad", () -> { }, 0, 0));
    }
}
