package com.sentimento.service.core.window;

/**
 * Read-only statistics over the most recent samples of a {@link SampleWindow}.
 *
 * @param avgHope mean hope over the {@code recentCount} newest samples
 * @param avgSorrow mean sorrow over the same slice
 * @param hopeRatio {@code avgHope / (avgHope + avgSorrow)}, or {@code 0} when that denominator is zero
 * @param sampleCount samples currently held by the window
 * @param recentCount samples the averages were computed from
 * @param totalAccepted samples pushed since startup, including evicted ones
 */
public record MetricsSnapshot(
        double avgHope, double avgSorrow, double hopeRatio, int sampleCount, int recentCount, long totalAccepted) {

    public static final MetricsSnapshot EMPTY = new MetricsSnapshot(0d, 0d, 0d, 0, 0, 0L);

    static MetricsSnapshot of(double hopeSum, double sorrowSum, int recentCount, int sampleCount, long totalAccepted) {
        if (recentCount == 0) {
            return new MetricsSnapshot(0d, 0d, 0d, sampleCount, 0, totalAccepted);
        }
        double avgHope = hopeSum / recentCount;
        double avgSorrow = sorrowSum / recentCount;
        return new MetricsSnapshot(
                avgHope, avgSorrow, hopeRatio(avgHope, avgSorrow), sampleCount, recentCount, totalAccepted);
    }

    /** Zero denominators yield {@code 0}, never {@code NaN}. */
    static double hopeRatio(double avgHope, double avgSorrow) {
        double total = avgHope + avgSorrow;
        if (total == 0d) {
            return 0d;
        }
        return avgHope / total;
    }
}
