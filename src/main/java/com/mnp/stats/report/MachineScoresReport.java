package com.mnp.stats.report;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mnp.stats.archive.RunDiagnostics;
import com.mnp.stats.archive.model.MatchRecord;
import com.mnp.stats.attribution.AttributedScore;
import com.mnp.stats.attribution.MatchWalker;
import com.mnp.stats.config.ReportSelection;
import com.mnp.stats.statistics.OutlierFilter;
import com.mnp.stats.statistics.StatisticsOps;
import com.mnp.stats.util.FileWriteUtil;

import freemarker.template.TemplateException;

/**
 * Score distribution per machine: summary statistics, percentile breakdown and top scores.
 *
 * Optional filters: venue, player IPR range, reliable positions and an outlier filter. With no
 * machines selected every machine seen in the selection is reported.
 */
public class MachineScoresReport extends ReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(MachineScoresReport.class);

    public static final List<Integer> PERCENTILES = List.of(10, 25, 50, 75, 90, 95);
    static final int TOP_SCORES = 10;
    static final String ALL_VENUES = "all_venues";

    public MachineScoresReport(ReportContext context) {
        super(context);
    }

    @Override
    public String getName() {
        return "machine-scores";
    }

    @Override
    protected void produce(List<MatchRecord> matches, ReportSelection selection, RunDiagnostics diagnostics,
                           ReportResult.ReportResultBuilder result) throws IOException, TemplateException {
        Map<String, List<ScoreSample>> samples = collect(matches, selection, diagnostics, result);
        List<MachineScoreSummary> summaries = summarize(samples, selection, diagnostics);

        String venueTitle = selection.getVenue() == null ? ""
                : " at " + venueName(matches, selection.getVenue()) + " (" + selection.getVenue() + ")";
        for (MachineScoreSummary summary : summaries) {
            Map<String, Object> model = baseModel(selection);
            model.put("machineName", summary.getDisplayName());
            model.put("venueTitle", venueTitle);
            model.put("iprTitle", iprTitle(selection));
            model.put("totalGames", summary.getCount());
            model.put("minScore", ReportFormat.score(summary.getMin()));
            model.put("maxScore", ReportFormat.score(summary.getMax()));
            model.put("meanScore", ReportFormat.score(summary.getMean()));
            model.put("medianScore", ReportFormat.score(summary.getMedian()));
            model.put("stdDev", ReportFormat.score(summary.getStandardDeviation()));
            model.put("percentiles", percentileRows(summary));
            model.put("topScores", summary.getTopScores());
            model.put("outliersRemoved", summary.getOutliers().getRemovedCount());
            model.put("outlierMethod", summary.getOutliers().getMethod().name().toLowerCase(Locale.ROOT));
            model.put("removedScores", summary.getOutliers().getRemoved().stream()
                    .limit(5).map(ScoreSample::getScoreText).toList());

            Path file = write(fileName(summary.getMachineKey(), selection), "machine-scores.md.ftl", model);
            result.outputFile(file);
        }
        result.rowsReported(summaries.size());
    }

    /**
     * Scores per canonical machine key, in first-seen order.
     */
    Map<String, List<ScoreSample>> collect(List<MatchRecord> matches, ReportSelection selection,
                                           RunDiagnostics diagnostics, ReportResult.ReportResultBuilder result) {
        Set<String> targets = new LinkedHashSet<>();
        selection.getMachines().forEach(m -> targets.add(context.getResolver().resolveKey(m)));

        Map<String, List<ScoreSample>> samples = new LinkedHashMap<>();
        targets.forEach(t -> samples.put(t, new ArrayList<>()));

        List<MatchRecord> atVenue = matches.stream().filter(m -> atVenue(m, selection.getVenue())).toList();
        int[] games = {0};
        int visited = new MatchWalker(diagnostics).walk(atVenue, (match, game) -> {
            String machine = context.getResolver().resolveKey(game.getGame().getMachine());
            if (!targets.isEmpty() && !targets.contains(machine)) {
                return;
            }
            games[0]++;
            for (AttributedScore score : game.getScores()) {
                if (!selection.acceptsPosition(score.getRound(), score.getPosition())) {
                    continue;
                }
                ScoreSample sample = ScoreSample.of(match, score, machine);
                if (selection.hasIprFilter() && !selection.acceptsIpr(sample.getIpr())) {
                    continue;
                }
                samples.computeIfAbsent(machine, k -> new ArrayList<>()).add(sample);
            }
        });
        result.matchesProcessed(visited).gamesCounted(games[0]);

        if (targets.isEmpty()) {
            Map<String, List<ScoreSample>> sorted = new TreeMap<>(samples);
            log.info("Discovered {} unique machines: {}", sorted.size(), String.join(", ", sorted.keySet()));
            return new LinkedHashMap<>(sorted);
        }
        return samples;
    }

    List<MachineScoreSummary> summarize(Map<String, List<ScoreSample>> samples, ReportSelection selection,
                                        RunDiagnostics diagnostics) {
        List<MachineScoreSummary> summaries = new ArrayList<>();
        for (Map.Entry<String, List<ScoreSample>> entry : samples.entrySet()) {
            String machine = entry.getKey();
            if (entry.getValue().isEmpty()) {
                log.warn("No scores found for machine '{}'", machine);
                diagnostics.getInfos().add("No scores found for machine " + machine);
                continue;
            }

            OutlierFilter.Result<ScoreSample> filtered =
                    selection.getOutlierFilter().apply(entry.getValue(), ScoreSample::getScore);
            if (filtered.getRemovedCount() > 0) {
                log.info("  Outlier filtering ({}): removed {} outliers from {}",
                        filtered.getMethod(), filtered.getRemovedCount(), machine);
            }
            if (filtered.getKept().isEmpty()) {
                diagnostics.getInfos().add("Every score of " + machine + " was filtered out");
                continue;
            }
            summaries.add(summarize(machine, filtered));
        }
        return summaries;
    }

    MachineScoreSummary summarize(String machine, OutlierFilter.Result<ScoreSample> filtered) {
        List<ScoreSample> kept = filtered.getKept();
        List<Long> scores = kept.stream().map(ScoreSample::getScore).toList();

        Map<Integer, Double> percentiles = new LinkedHashMap<>();
        for (int p : PERCENTILES) {
            percentiles.put(p, StatisticsOps.percentile(scores, p / 100.0));
        }

        List<ScoreSample> top = kept.stream()
                .sorted(Comparator.comparingLong(ScoreSample::getScore).reversed())
                .limit(TOP_SCORES)
                .toList();

        return MachineScoreSummary.builder()
                .machineKey(machine)
                .displayName(context.getResolver().displayName(machine))
                .samples(kept)
                .outliers(filtered)
                .min(StatisticsOps.min(scores))
                .max(StatisticsOps.max(scores))
                .mean(StatisticsOps.mean(scores))
                .median(StatisticsOps.median(scores))
                .standardDeviation(StatisticsOps.standardDeviation(scores))
                .percentiles(percentiles)
                .topScores(top)
                .build();
    }

    static String fileName(String machineKey, ReportSelection selection) {
        String venue = selection.getVenue() != null ? selection.getVenue() : ALL_VENUES;
        return FileWriteUtil.safeFileName(machineKey) + "_percentile_season_" + selection.seasonsCode()
                + "_" + FileWriteUtil.safeFileName(venue) + selection.iprCode() + ".md";
    }

    static String iprTitle(ReportSelection selection) {
        Integer min = selection.getMinIpr();
        Integer max = selection.getMaxIpr();
        if (min != null && max != null) {
            return " - IPR " + min + "-" + max + " Players";
        }
        if (min != null) {
            return " - IPR ≥" + min + " Players";
        }
        if (max != null) {
            return " - IPR ≤" + max + " Players";
        }
        return "";
    }

    private static List<Map<String, String>> percentileRows(MachineScoreSummary summary) {
        List<Map<String, String>> rows = new ArrayList<>();
        summary.getPercentiles().forEach((p, value) -> rows.add(Map.of(
                "label", p + "th",
                "score", ReportFormat.score(value))));
        return rows;
    }
}
