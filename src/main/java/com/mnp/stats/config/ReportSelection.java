package com.mnp.stats.config;

import java.util.List;
import java.util.stream.Collectors;

import com.mnp.stats.attribution.RoundAttributor;
import com.mnp.stats.attribution.RoundMode;
import com.mnp.stats.statistics.OutlierFilter;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * What a report run covers: seasons, venue, teams, machines and score filters.
 *
 * The reliable-position lists drop scores from seats whose entries are known to
 * be unreliable; they apply to the reports that list or summarise raw scores.
 */
@Value
@Builder(toBuilder = true)
public class ReportSelection {
    @Singular
    List<Integer> seasons;

    /** Venue key, or null for every venue. */
    String venue;

    String team;

    /** Second team of a comparison. */
    String opponent;

    /** Raw machine labels; resolved to canonical keys by the report. Empty means every machine seen. */
    @Singular
    List<String> machines;

    Integer minIpr;
    Integer maxIpr;

    @Builder.Default
    OutlierFilter outlierFilter = OutlierFilter.none();

    /** Restrict to the machines currently listed for the venue. */
    boolean currentMachinesOnly;

    /** Positions whose scores are trusted in doubles rounds (1 and 4). Empty means every position. */
    @Singular
    List<Integer> doublesPositions;

    /** Positions whose scores are trusted in singles rounds (2 and 3). Empty means every position. */
    @Singular
    List<Integer> singlesPositions;

    public boolean hasIprFilter() {
        return minIpr != null || maxIpr != null;
    }

    public boolean acceptsIpr(int ipr) {
        return (minIpr == null || ipr >= minIpr) && (maxIpr == null || ipr <= maxIpr);
    }

    /**
     * Whether a score from {@code position} in {@code round} counts toward score statistics.
     */
    public boolean acceptsPosition(int round, int position) {
        List<Integer> reliable = RoundAttributor.modeOf(round) == RoundMode.DOUBLES ? doublesPositions
                : singlesPositions;
        return reliable.isEmpty() || reliable.contains(position);
    }

    /**
     * Seasons joined for file names: {@code 22} or {@code 21-22}.
     */
    public String seasonsCode() {
        return seasons.stream().map(String::valueOf).collect(Collectors.joining("-"));
    }

    /**
     * Seasons for titles: {@code Season 22} or {@code Seasons 21, 22}.
     */
    public String seasonsTitle() {
        String joined = seasons.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return (seasons.size() > 1 ? "Seasons " : "Season ") + joined;
    }

    /**
     * File name suffix for the IPR range: {@code _ipr3-5}, {@code _ipr4plus}, {@code _ipr2minus} or empty.
     */
    public String iprCode() {
        if (minIpr != null && maxIpr != null) {
            return "_ipr" + minIpr + "-" + maxIpr;
        }
        if (minIpr != null) {
            return "_ipr" + minIpr + "plus";
        }
        if (maxIpr != null) {
            return "_ipr" + maxIpr + "minus";
        }
        return "";
    }

    /**
     * Fills every unset field of this selection from {@code defaults}.
     */
    public ReportSelection withDefaults(ReportSelection defaults) {
        ReportSelectionBuilder builder = toBuilder();
        if (seasons.isEmpty()) {
            builder.seasons(defaults.getSeasons());
        }
        if (venue == null) {
            builder.venue(defaults.getVenue());
        }
        if (team == null) {
            builder.team(defaults.getTeam());
        }
        if (opponent == null) {
            builder.opponent(defaults.getOpponent());
        }
        if (machines.isEmpty()) {
            builder.machines(defaults.getMachines());
        }
        if (minIpr == null) {
            builder.minIpr(defaults.getMinIpr());
        }
        if (maxIpr == null) {
            builder.maxIpr(defaults.getMaxIpr());
        }
        if (outlierFilter.getMethod() == OutlierFilter.Method.NONE) {
            builder.outlierFilter(defaults.getOutlierFilter());
        }
        if (!currentMachinesOnly) {
            builder.currentMachinesOnly(defaults.isCurrentMachinesOnly());
        }
        if (doublesPositions.isEmpty()) {
            builder.doublesPositions(defaults.getDoublesPositions());
        }
        if (singlesPositions.isEmpty()) {
            builder.singlesPositions(defaults.getSinglesPositions());
        }
        return builder.build();
    }
}
