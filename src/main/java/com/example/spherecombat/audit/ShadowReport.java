package com.example.spherecombat.audit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Variance summary over a set of provider comparisons, with a per-weapon breakdown
 * ordered by average variance, worst first.
 */
public final class ShadowReport {

    private final int totalComparisons;
    private final int minVarianceMs;
    private final int maxVarianceMs;
    private final double avgVarianceMs;
    private final int discrepancyCount;
    private final List<WeaponStats> weaponBreakdown;

    private ShadowReport(int totalComparisons, int minVarianceMs, int maxVarianceMs, double avgVarianceMs,
                         int discrepancyCount, List<WeaponStats> weaponBreakdown) {
        this.totalComparisons = totalComparisons;
        this.minVarianceMs = minVarianceMs;
        this.maxVarianceMs = maxVarianceMs;
        this.avgVarianceMs = avgVarianceMs;
        this.discrepancyCount = discrepancyCount;
        this.weaponBreakdown = weaponBreakdown;
    }

    /**
     * @param discrepancyThresholdMs variance above which a comparison counts as a discrepancy
     */
    public static ShadowReport of(List<TimingComparison> comparisons, double discrepancyThresholdMs) {
        if (comparisons.isEmpty()) {
            return new ShadowReport(0, 0, 0, 0, 0, Collections.emptyList());
        }
        int min = Integer.MAX_VALUE;
        int max = 0;
        long sum = 0;
        int discrepancies = 0;
        Map<String, List<TimingComparison>> byWeapon = new LinkedHashMap<>();
        for (TimingComparison c : comparisons) {
            int variance = c.getVarianceMs();
            min = Math.min(min, variance);
            max = Math.max(max, variance);
            sum += variance;
            if (variance > discrepancyThresholdMs) {
                discrepancies++;
            }
            byWeapon.computeIfAbsent(c.getWeaponName(), k -> new ArrayList<>()).add(c);
        }

        List<WeaponStats> breakdown = new ArrayList<>();
        for (Map.Entry<String, List<TimingComparison>> e : byWeapon.entrySet()) {
            int weaponMax = 0;
            long weaponSum = 0;
            for (TimingComparison c : e.getValue()) {
                weaponMax = Math.max(weaponMax, c.getVarianceMs());
                weaponSum += c.getVarianceMs();
            }
            breakdown.add(new WeaponStats(e.getKey(), e.getValue().size(),
                    (double) weaponSum / e.getValue().size(), weaponMax));
        }
        breakdown.sort(Comparator.comparingDouble(WeaponStats::getAvgVarianceMs).reversed());

        return new ShadowReport(comparisons.size(), min, max, (double) sum / comparisons.size(),
                discrepancies, Collections.unmodifiableList(breakdown));
    }

    public boolean isEmpty() { return totalComparisons == 0; }
    public int getTotalComparisons() { return totalComparisons; }
    public int getMinVarianceMs() { return minVarianceMs; }
    public int getMaxVarianceMs() { return maxVarianceMs; }
    public double getAvgVarianceMs() { return avgVarianceMs; }
    public int getDiscrepancyCount() { return discrepancyCount; }
    public List<WeaponStats> getWeaponBreakdown() { return weaponBreakdown; }

    public double getDiscrepancyPercentage() {
        return totalComparisons == 0 ? 0 : discrepancyCount * 100.0 / totalComparisons;
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "No shadow mode comparisons available";
        }
        return String.format("Shadow report: %d comparisons, variance min=%dms avg=%.1fms max=%dms, "
                        + "%d discrepancies (%.1f%%)",
                totalComparisons, minVarianceMs, avgVarianceMs, maxVarianceMs,
                discrepancyCount, getDiscrepancyPercentage());
    }

    /**
     * Comparison statistics for one weapon.
     */
    public static final class WeaponStats {
        private final String weaponName;
        private final int count;
        private final double avgVarianceMs;
        private final int maxVarianceMs;

        WeaponStats(String weaponName, int count, double avgVarianceMs, int maxVarianceMs) {
            this.weaponName = weaponName;
            this.count = count;
            this.avgVarianceMs = avgVarianceMs;
            this.maxVarianceMs = maxVarianceMs;
        }

        public String getWeaponName() { return weaponName; }
        public int getCount() { return count; }
        public double getAvgVarianceMs() { return avgVarianceMs; }
        public int getMaxVarianceMs() { return maxVarianceMs; }

        @Override
        public String toString() {
            return String.format("%s: %d comparisons, avg %.1fms, max %dms", weaponName, count, avgVarianceMs, maxVarianceMs);
        }
    }
}
