package com.example.spherecombat.combat;

import java.util.Arrays;

/**
 * Tick-time statistics for the global pulse.
 * The last {@value #SAMPLE_SIZE} tick durations are kept in a ring buffer; the average
 * and 99th percentile come from that window, the maximum is all-time.
 */
public class PulseMetrics {

    public static final int SAMPLE_SIZE = 1000;

    /** Percentile needs this many samples before it is reported */
    static final int MIN_PERCENTILE_SAMPLES = 10;

    private final double[] samples = new double[SAMPLE_SIZE];
    private int sampleIndex;
    private int sampleCount;
    private long totalTicks;
    private double maxTickMs;
    private long throttleEvents;
    private long faultCount;

    public synchronized void recordTick(double tickMs) {
        samples[sampleIndex] = tickMs;
        sampleIndex = (sampleIndex + 1) % SAMPLE_SIZE;
        if (sampleCount < SAMPLE_SIZE) {
            sampleCount++;
        }
        totalTicks++;
        if (tickMs > maxTickMs) {
            maxTickMs = tickMs;
        }
    }

    public synchronized void recordThrottle() {
        throttleEvents++;
    }

    public synchronized void recordFault() {
        faultCount++;
    }

    public synchronized double getAverageTickMs() {
        if (sampleCount == 0) return 0;
        double sum = 0;
        for (int i = 0; i < sampleCount; i++) {
            sum += samples[i];
        }
        return sum / sampleCount;
    }

    public synchronized double getMaxTickMs() {
        return maxTickMs;
    }

    /**
     * 99th percentile over the sample window, or 0 with too few samples.
     */
    public synchronized double getP99TickMs() {
        if (sampleCount < MIN_PERCENTILE_SAMPLES) return 0;
        double[] sorted = Arrays.copyOf(samples, sampleCount);
        Arrays.sort(sorted);
        int index = Math.min(sampleCount - 1, (int) (sampleCount * 0.99));
        return sorted[index];
    }

    public synchronized long getTotalTicks() { return totalTicks; }
    public synchronized long getThrottleEvents() { return throttleEvents; }
    public synchronized long getFaultCount() { return faultCount; }
    public synchronized int getSampleCount() { return sampleCount; }

    public synchronized void reset() {
        Arrays.fill(samples, 0);
        sampleIndex = 0;
        sampleCount = 0;
        totalTicks = 0;
        maxTickMs = 0;
        throttleEvents = 0;
        faultCount = 0;
    }

    /**
     * Read-only copy of the current figures.
     */
    public synchronized Snapshot snapshot(int activeCombatants) {
        return new Snapshot(getAverageTickMs(), maxTickMs, getP99TickMs(), totalTicks,
                activeCombatants, throttleEvents, faultCount);
    }

    /**
     * Point-in-time metrics handed to reporting collaborators.
     */
    public static final class Snapshot {
        private final double averageTickMs;
        private final double maxTickMs;
        private final double p99TickMs;
        private final long totalTicks;
        private final int activeCombatants;
        private final long throttleEvents;
        private final long faultCount;

        Snapshot(double averageTickMs, double maxTickMs, double p99TickMs, long totalTicks,
                 int activeCombatants, long throttleEvents, long faultCount) {
            this.averageTickMs = averageTickMs;
            this.maxTickMs = maxTickMs;
            this.p99TickMs = p99TickMs;
            this.totalTicks = totalTicks;
            this.activeCombatants = activeCombatants;
            this.throttleEvents = throttleEvents;
            this.faultCount = faultCount;
        }

        public double getAverageTickMs() { return averageTickMs; }
        public double getMaxTickMs() { return maxTickMs; }
        public double getP99TickMs() { return p99TickMs; }
        public long getTotalTicks() { return totalTicks; }
        public int getActiveCombatants() { return activeCombatants; }
        public long getThrottleEvents() { return throttleEvents; }
        public long getFaultCount() { return faultCount; }

        @Override
        public String toString() {
            return String.format("Pulse[avg=%.3fms max=%.3fms p99=%.3fms ticks=%d active=%d throttled=%d faults=%d]",
                    averageTickMs, maxTickMs, p99TickMs, totalTicks, activeCombatants, throttleEvents, faultCount);
        }
    }
}
