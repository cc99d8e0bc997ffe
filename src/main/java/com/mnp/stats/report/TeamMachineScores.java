package com.mnp.stats.report;

import java.util.List;

import com.mnp.stats.statistics.StatisticsOps;

import lombok.Value;

/**
 * One team's scores on one machine, highest first.
 */
@Value
public class TeamMachineScores {
    String teamKey;
    String teamName;
    List<ScoreSample> samples;

    public int getCount() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public double getMedian() {
        return StatisticsOps.median(scores());
    }

    public double getMean() {
        return StatisticsOps.mean(scores());
    }

    public long getMax() {
        return StatisticsOps.max(scores());
    }

    public String getMedianText() {
        return isEmpty() ? "-" : ReportFormat.score(getMedian());
    }

    public String getMeanText() {
        return isEmpty() ? "-" : ReportFormat.score(getMean());
    }

    public String getMaxText() {
        return isEmpty() ? "-" : ReportFormat.score(getMax());
    }

    private List<Long> scores() {
        return samples.stream().map(ScoreSample::getScore).toList();
    }
}
