package com.mnp.stats.statistics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Pure summary statistics over score samples.
 *
 * Every percentile in the project goes through {@link #percentile(Collection, double)}:
 * nearest rank with linear interpolation between the two bracketing values.
 */
public class StatisticsOps {

    /** Sentinel returned by {@link #ratio(double, double)} when only the numerator has points. */
    public static final double INFINITY = Double.POSITIVE_INFINITY;

    private StatisticsOps() {
        // Utility class
    }

    public static double median(Collection<Long> values) {
        List<Long> sorted = sortedCopy(values, "median");
        int n = sorted.size();
        int mid = (n - 1) / 2;
        if (n % 2 == 1) {
            return sorted.get(mid);
        }
        // same arithmetic as percentile(values, 0.5) so the two agree exactly
        return sorted.get(mid) + 0.5 * (sorted.get(mid + 1) - sorted.get(mid));
    }

    public static double mean(Collection<Long> values) {
        requireNonEmpty(values, "mean");
        double sum = 0;
        for (Long v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    public static long min(Collection<Long> values) {
        requireNonEmpty(values, "min");
        return Collections.min(values);
    }

    public static long max(Collection<Long> values) {
        requireNonEmpty(values, "max");
        return Collections.max(values);
    }

    /**
     * Population standard deviation.
     */
    public static double standardDeviation(Collection<Long> values) {
        double mean = mean(values);
        double variance = 0;
        for (Long v : values) {
            double d = v - mean;
            variance += d * d;
        }
        return Math.sqrt(variance / values.size());
    }

    /**
     * Percentile for {@code p} in [0, 1].
     *
     * @throws EmptySampleException if values is empty
     * @throws IllegalArgumentException if p is outside [0, 1]
     */
    public static double percentile(Collection<Long> values, double p) {
        if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException("Percentile must be within [0, 1]. Got: " + p);
        }
        List<Long> sorted = sortedCopy(values, "percentile");
        int n = sorted.size();

        double idx = (n - 1) * p;
        int lower = (int) Math.floor(idx);
        int upper = lower + 1;
        if (upper >= n) {
            return sorted.get(lower);
        }
        return sorted.get(lower) + (idx - lower) * (sorted.get(upper) - sorted.get(lower));
    }

    /**
     * Ratio a / b with the league convention for an empty denominator:
     * {@link #INFINITY} when a has points, 1.0 when both are zero.
     */
    public static double ratio(double a, double b) {
        if (b == 0) {
            return a > 0 ? INFINITY : 1.0;
        }
        return a / b;
    }

    /**
     * Share of {@code part} in {@code total} as a percentage, 0 when nothing was available.
     */
    public static double percentage(double part, double total) {
        if (total == 0) {
            return 0.0;
        }
        return part / total * 100.0;
    }

    public static boolean isInfinite(double ratio) {
        return Double.isInfinite(ratio);
    }

    private static List<Long> sortedCopy(Collection<Long> values, String statistic) {
        requireNonEmpty(values, statistic);
        List<Long> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        return sorted;
    }

    private static void requireNonEmpty(Collection<Long> values, String statistic) {
        if (values == null || values.isEmpty()) {
            throw new EmptySampleException(statistic);
        }
    }
}
