package com.mnp.stats.cli.model;

import java.util.List;

import com.mnp.stats.statistics.OutlierFilter;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * What a report covers and how scores are filtered. Which fields are required depends on the report.
 */
@Getter
public class SelectionOptions {

    @Option(names = { "--venue" }, description = "Venue key")
    private String venue;

    @Option(names = { "--team", "-t" }, description = "Team key")
    private String team;

    @Option(names = { "--opponent" }, description = "Second team key for comparisons")
    private String opponent;

    @Option(names = { "--machine", "-m" }, split = ",", description = "Machine key(s) or variations, comma-separated")
    private List<String> machines;

    @Option(names = { "--min-ipr" }, description = "Only scores of players with at least this IPR")
    private Integer minIpr;

    @Option(names = { "--max-ipr" }, description = "Only scores of players with at most this IPR")
    private Integer maxIpr;

    @Option(names = {
            "--outlier-method" }, description = "Outlier filter: NONE, IQR, PERCENTILE or ABSOLUTE")
    private OutlierFilter.Method outlierMethod;

    @Option(names = { "--iqr-multiplier" }, description = "IQR multiplier (default 1.5)")
    private Double iqrMultiplier;

    @Option(names = { "--lower-percentile" }, description = "Lower bound for PERCENTILE filtering, 0-100 (default 1)")
    private Double lowerPercentile;

    @Option(names = { "--upper-percentile" }, description = "Upper bound for PERCENTILE filtering, 0-100 (default 99)")
    private Double upperPercentile;

    @Option(names = { "--min-score" }, description = "Lower bound for ABSOLUTE filtering")
    private Long minScore;

    @Option(names = { "--max-score" }, description = "Upper bound for ABSOLUTE filtering")
    private Long maxScore;

    @Option(names = {
            "--current-machines-only" }, description = "Only machines currently at the venue (or the --machine list)")
    private boolean currentMachinesOnly;

    @Option(names = { "--doubles-positions" }, split = ",",
            description = "Positions with reliable scores in rounds 1 and 4, comma-separated (default all)")
    private List<Integer> doublesPositions;

    @Option(names = { "--singles-positions" }, split = ",",
            description = "Positions with reliable scores in rounds 2 and 3, comma-separated (default all)")
    private List<Integer> singlesPositions;
}
