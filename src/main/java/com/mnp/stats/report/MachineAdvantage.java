package com.mnp.stats.report;

import lombok.Value;

/**
 * Home and away points earned on one machine at one venue.
 */
@Value
public class MachineAdvantage {
    String machineKey;
    String displayName;
    double homePoints;
    double awayPoints;
    int games;
    /** Home points over away points; infinite when the away side never scored. */
    double ratio;

    public double getTotalPoints() {
        return homePoints + awayPoints;
    }

    public double getHomePercentage() {
        return getTotalPoints() == 0 ? 0 : homePoints / getTotalPoints() * 100;
    }

    public double getAwayPercentage() {
        return getTotalPoints() == 0 ? 0 : awayPoints / getTotalPoints() * 100;
    }

    public String getRatioText() {
        return ReportFormat.ratio(ratio);
    }

    public String getHomePointsText() {
        return ReportFormat.points(homePoints);
    }

    public String getAwayPointsText() {
        return ReportFormat.points(awayPoints);
    }

    public String getHomePercentageText() {
        return ReportFormat.percent(getHomePercentage());
    }

    public String getAwayPercentageText() {
        return ReportFormat.percent(getAwayPercentage());
    }
}
