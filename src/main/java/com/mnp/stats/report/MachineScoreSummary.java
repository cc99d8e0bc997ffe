package com.mnp.stats.report;

import java.util.List;
import java.util.Map;

import com.mnp.stats.statistics.OutlierFilter;

import lombok.Builder;
import lombok.Value;

/**
 * Score distribution of one machine after filtering.
 */
@Value
@Builder
public class MachineScoreSummary {
    String machineKey;
    String displayName;
    /** Scores kept after the outlier filter. */
    List<ScoreSample> samples;
    OutlierFilter.Result<ScoreSample> outliers;

    long min;
    long max;
    double mean;
    double median;
    double standardDeviation;
    /** Percentile (10, 25, ...) to interpolated score. */
    Map<Integer, Double> percentiles;
    List<ScoreSample> topScores;

    public int getCount() {
        return samples.size();
    }
}
