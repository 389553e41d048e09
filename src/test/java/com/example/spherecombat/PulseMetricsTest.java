package com.example.spherecombat;

import com.example.spherecombat.combat.PulseMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PulseMetrics Tests")
class PulseMetricsTest {

    @Test
    @DisplayName("Empty metrics report zeros")
    void emptyMetrics() {
        PulseMetrics metrics = new PulseMetrics();
        assertEquals(0.0, metrics.getAverageTickMs());
        assertEquals(0.0, metrics.getMaxTickMs());
        assertEquals(0.0, metrics.getP99TickMs());
        assertEquals(0, metrics.getTotalTicks());
    }

    @Test
    @DisplayName("Average and max follow recorded ticks")
    void averageAndMax() {
        PulseMetrics metrics = new PulseMetrics();
        metrics.recordTick(1.0);
        metrics.recordTick(2.0);
        metrics.recordTick(6.0);

        assertEquals(3.0, metrics.getAverageTickMs(), 1e-9);
        assertEquals(6.0, metrics.getMaxTickMs(), 1e-9);
        assertEquals(3, metrics.getTotalTicks());
    }

    @Test
    @DisplayName("p99 needs ten samples")
    void p99NeedsSamples() {
        PulseMetrics metrics = new PulseMetrics();
        for (int i = 0; i < 9; i++) {
            metrics.recordTick(5.0);
        }
        assertEquals(0.0, metrics.getP99TickMs());
        metrics.recordTick(5.0);
        assertEquals(5.0, metrics.getP99TickMs(), 1e-9);
    }

    @Test
    @DisplayName("p99 picks the high tail of the window")
    void p99HighTail() {
        PulseMetrics metrics = new PulseMetrics();
        for (int i = 1; i <= 100; i++) {
            metrics.recordTick(i);
        }
        // index min(99, (int)(100 * 0.99)) = 99
        assertEquals(100.0, metrics.getP99TickMs(), 1e-9);
    }

    @Test
    @DisplayName("The sample window holds the last 1000 ticks; max stays all-time")
    void ringBufferWindow() {
        PulseMetrics metrics = new PulseMetrics();
        metrics.recordTick(500.0);
        for (int i = 0; i < PulseMetrics.SAMPLE_SIZE; i++) {
            metrics.recordTick(1.0);
        }

        assertEquals(PulseMetrics.SAMPLE_SIZE, metrics.getSampleCount());
        assertEquals(1.0, metrics.getAverageTickMs(), 1e-9);
        assertEquals(500.0, metrics.getMaxTickMs(), 1e-9);
        assertEquals(PulseMetrics.SAMPLE_SIZE + 1, metrics.getTotalTicks());
    }

    @Test
    @DisplayName("Throttles and faults are counted and reset")
    void countersAndReset() {
        PulseMetrics metrics = new PulseMetrics();
        metrics.recordThrottle();
        metrics.recordFault();
        metrics.recordFault();
        metrics.recordTick(3.0);

        PulseMetrics.Snapshot snapshot = metrics.snapshot(7);
        assertEquals(1, snapshot.getThrottleEvents());
        assertEquals(2, snapshot.getFaultCount());
        assertEquals(7, snapshot.getActiveCombatants());

        metrics.reset();
        assertEquals(0, metrics.getThrottleEvents());
        assertEquals(0, metrics.getFaultCount());
        assertEquals(0, metrics.getSampleCount());
    }
}
