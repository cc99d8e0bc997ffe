package com.mnp.stats.report;

import lombok.Value;

/**
 * A team's points against its opponents on one machine.
 */
@Value
public class MachinePerformance {
    String machineKey;
    String displayName;
    double teamPoints;
    double opponentPoints;
    int games;
    /** Median of the team's own scores; null when the team has none. */
    Double medianScore;

    public double getTotalPoints() {
        return teamPoints + opponentPoints;
    }

    /** Points of possible points, in percent. */
    public double getPops() {
        return getTotalPoints() > 0 ? teamPoints / getTotalPoints() * 100 : 0;
    }

    public String getTeamPointsText() {
        return ReportFormat.points(teamPoints);
    }

    public String getOpponentPointsText() {
        return ReportFormat.points(opponentPoints);
    }

    public String getTotalPointsText() {
        return ReportFormat.points(getTotalPoints());
    }

    public String getPopsText() {
        return ReportFormat.percent(getPops());
    }

    public String getMedianText() {
        return medianScore != null ? ReportFormat.score(medianScore) : "-";
    }
}
