package com.example.spherecombat.audit;

import com.example.spherecombat.combat.TimingProvider;
import com.example.spherecombat.model.Actor;
import com.example.spherecombat.model.Implement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Runs a second timing provider beside the live one and records how far they disagree.
 * <p>
 * Used in place of the live provider: every value it hands out comes from the primary,
 * so gameplay never sees the shadow's numbers. A shadow provider that throws is logged
 * and the comparison skipped.
 */
public class ShadowModeVerifier implements TimingProvider {
    private static final Logger logger = LoggerFactory.getLogger(ShadowModeVerifier.class);

    private final TimingProvider primary;
    private final TimingProvider shadow;
    private final AuditConfig config;
    private final CombatAuditSystem audit;
    private final LongSupplier clock;

    private final Deque<TimingComparison> comparisons = new ArrayDeque<>();
    private long totalComparisons;
    private long discrepancyCount;

    /**
     * @param audit receives each comparison as a debug entry; may be null
     * @param clock time source for comparison timestamps, normally the scheduler's
     */
    public ShadowModeVerifier(TimingProvider primary, TimingProvider shadow, AuditConfig config,
                              CombatAuditSystem audit, LongSupplier clock) {
        this.primary = primary;
        this.shadow = shadow;
        this.config = config;
        this.audit = audit;
        this.clock = clock;
    }

    // ========== TimingProvider ==========

    @Override
    public int getAttackIntervalMs(Actor actor, Implement implement) {
        int primaryMs = primary.getAttackIntervalMs(actor, implement);
        compare(actor, implement, primaryMs);
        return primaryMs;
    }

    @Override
    public int getAnimationHitOffsetMs(Implement implement) {
        return primary.getAnimationHitOffsetMs(implement);
    }

    @Override
    public int getAnimationDurationMs(Implement implement) {
        return primary.getAnimationDurationMs(implement);
    }

    @Override
    public String getProviderName() {
        return primary.getProviderName();
    }

    // ========== Comparison ==========

    /**
     * Ask both providers for the attack interval and record the result.
     * @return the comparison, or null when there is no actor or weapon or the shadow failed
     */
    public TimingComparison compare(Actor actor, Implement implement) {
        return compare(actor, implement, primary.getAttackIntervalMs(actor, implement));
    }

    private TimingComparison compare(Actor actor, Implement implement, int primaryMs) {
        if (actor == null || implement == null) {
            return null;
        }
        int shadowMs;
        try {
            shadowMs = shadow.getAttackIntervalMs(actor, implement);
        } catch (RuntimeException e) {
            logger.warn("[ShadowMode] {} failed for {} with {}", shadow.getProviderName(), actor.getName(),
                    implement.getName(), e);
            return null;
        }
        TimingComparison comparison = new TimingComparison(clock.getAsLong(), actor.getSerial(), actor.getName(),
                implement.getItemId(), implement.getName(), actor.getDexterity(),
                primary.getProviderName(), primaryMs, shadow.getProviderName(), shadowMs);
        record(comparison);
        return comparison;
    }

    private void record(TimingComparison comparison) {
        boolean discrepancy = comparison.getVarianceMs() > config.getDiscrepancyThresholdMs();
        synchronized (this) {
            comparisons.addLast(comparison);
            while (comparisons.size() > config.getMaxComparisons()) {
                comparisons.removeFirst();
            }
            totalComparisons++;
            if (discrepancy) {
                discrepancyCount++;
            }
        }
        if (discrepancy) {
            logger.debug("[ShadowMode] Timing discrepancy: {}", comparison);
        }
        if (audit != null) {
            audit.recordEntry(new CombatLogEntry(comparison.getTimestamp(), comparison.getActorSerial(), 0L,
                    CombatLogEntry.SHADOW_COMPARISON, comparison.getPrimaryProvider(), AuditLevel.DEBUG,
                    comparison.getWeaponName(), comparison.getPrimaryMs(), comparison.getShadowMs(), true)
                    .addDetail("shadowProvider", comparison.getShadowProvider())
                    .addDetail("dexterity", comparison.getDexterity()));
        }
    }

    // ========== Queries ==========

    /** Every kept comparison, oldest first */
    public synchronized List<TimingComparison> getRecentComparisons() {
        return new ArrayList<>(comparisons);
    }

    /**
     * Comparisons no older than {@code windowMs} before {@code now}.
     */
    public synchronized List<TimingComparison> getRecentComparisons(long windowMs, long now) {
        List<TimingComparison> result = new ArrayList<>();
        long cutoff = now - windowMs;
        for (TimingComparison c : comparisons) {
            if (c.getTimestamp() >= cutoff) {
                result.add(c);
            }
        }
        return result;
    }

    public ShadowReport generateReport() {
        return ShadowReport.of(getRecentComparisons(), config.getDiscrepancyThresholdMs());
    }

    public ShadowReport generateReport(long windowMs, long now) {
        return ShadowReport.of(getRecentComparisons(windowMs, now), config.getDiscrepancyThresholdMs());
    }

    public synchronized long getTotalComparisons() { return totalComparisons; }
    public synchronized long getDiscrepancyCount() { return discrepancyCount; }
    public TimingProvider getPrimary() { return primary; }
    public TimingProvider getShadow() { return shadow; }

    public synchronized void clear() {
        comparisons.clear();
        totalComparisons = 0;
        discrepancyCount = 0;
        logger.info("[ShadowMode] Comparisons cleared");
    }
}
