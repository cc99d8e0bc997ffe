package com.mnp.stats.statistics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToLongFunction;

import lombok.Builder;
import lombok.Value;

/**
 * Removes extreme scores from a sample before it is summarised.
 *
 * Bounds are inclusive. Quartiles and percentile bounds come from
 * {@link StatisticsOps#percentile(java.util.Collection, double)}.
 */
@Value
@Builder(toBuilder = true)
public class OutlierFilter {

    public enum Method {
        NONE,
        /** Keep values within [Q1 - k*IQR, Q3 + k*IQR]. */
        IQR,
        /** Keep values within the configured lower/upper percentiles. */
        PERCENTILE,
        /** Keep values within fixed score bounds. */
        ABSOLUTE
    }

    /** IQR needs at least this many values to produce meaningful quartiles. */
    public static final int MIN_IQR_SAMPLE = 4;

    @Builder.Default
    Method method = Method.NONE;

    @Builder.Default
    double iqrMultiplier = 1.5;

    /** Lower percentile bound in [0, 1]. */
    @Builder.Default
    double lowerPercentile = 0.01;

    /** Upper percentile bound in [0, 1]. */
    @Builder.Default
    double upperPercentile = 0.99;

    @Builder.Default
    long minScore = 0L;

    @Builder.Default
    long maxScore = Long.MAX_VALUE;

    public static OutlierFilter none() {
        return OutlierFilter.builder().build();
    }

    /**
     * Splits the items into kept and removed according to their score.
     */
    public <T> Result<T> apply(List<T> items, ToLongFunction<T> score) {
        if (method == Method.NONE || items.isEmpty()) {
            return new Result<>(List.copyOf(items), List.of(), method, false);
        }

        List<Long> scores = items.stream().map(score::applyAsLong).toList();
        double lower;
        double upper;
        switch (method) {
            case IQR -> {
                if (scores.size() < MIN_IQR_SAMPLE) {
                    return new Result<>(List.copyOf(items), List.of(), method, true);
                }
                double q1 = StatisticsOps.percentile(scores, 0.25);
                double q3 = StatisticsOps.percentile(scores, 0.75);
                double iqr = q3 - q1;
                lower = q1 - iqrMultiplier * iqr;
                upper = q3 + iqrMultiplier * iqr;
            }
            case PERCENTILE -> {
                lower = StatisticsOps.percentile(scores, lowerPercentile);
                upper = StatisticsOps.percentile(scores, upperPercentile);
            }
            case ABSOLUTE -> {
                lower = minScore;
                upper = maxScore;
            }
            default -> throw new IllegalStateException("Unhandled outlier method: " + method);
        }

        List<T> kept = new ArrayList<>();
        List<T> removed = new ArrayList<>();
        for (T item : items) {
            long s = score.applyAsLong(item);
            if (s >= lower && s <= upper) {
                kept.add(item);
            } else {
                removed.add(item);
            }
        }
        removed.sort(Comparator.comparingLong(score).reversed());
        return new Result<>(kept, removed, method, false);
    }

    @Value
    public static class Result<T> {
        List<T> kept;
        /** Removed items, highest score first. */
        List<T> removed;
        Method method;
        /** True when the sample was too small for the method and left untouched. */
        boolean insufficientData;

        public int getRemovedCount() {
            return removed.size();
        }
    }
}
