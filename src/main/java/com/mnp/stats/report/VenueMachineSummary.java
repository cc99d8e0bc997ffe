package com.mnp.stats.report;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Score statistics for one machine at one venue.
 */
@Value
@Builder
public class VenueMachineSummary {
    String machineKey;
    String displayName;
    int games;
    /** Games per round, index 0 holding round 1. */
    List<Integer> gamesByRound;
    int scoreCount;
    double median;
    double percentile75;
    double percentile90;
    ScoreSample high;
    long low;
    /** Best score by a home-side player, or null when the home side has none. */
    ScoreSample homeHigh;

    public String getMedianText() {
        return ReportFormat.score(median);
    }

    public String getPercentile75Text() {
        return ReportFormat.score(percentile75);
    }

    public String getPercentile90Text() {
        return ReportFormat.score(percentile90);
    }

    public String getLowText() {
        return ReportFormat.score(low);
    }
}
