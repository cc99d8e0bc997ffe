package com.mnp.stats.report;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mnp.stats.archive.RunDiagnostics;
import com.mnp.stats.archive.model.MatchRecord;
import com.mnp.stats.attribution.AttributedScore;
import com.mnp.stats.attribution.GameAttributor;
import com.mnp.stats.attribution.MatchWalker;
import com.mnp.stats.attribution.RoundAttributor;
import com.mnp.stats.attribution.Side;
import com.mnp.stats.config.ReportSelection;
import com.mnp.stats.statistics.StatisticsOps;
import com.mnp.stats.util.FileWriteUtil;

import freemarker.template.TemplateException;
import lombok.Getter;

/**
 * Everything played at one venue: overview counts, which machines the home and
 * away sides pick, and score statistics per machine.
 *
 * Picks are counted over every finished game. Score statistics use fully
 * attributed games and honour the reliable-position lists.
 */
public class VenueSummaryReport extends ReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(VenueSummaryReport.class);

    static final int TOP_PICKS = 10;

    public VenueSummaryReport(ReportContext context) {
        super(context);
    }

    @Override
    public String getName() {
        return "venue-summary";
    }

    @Override
    protected void produce(List<MatchRecord> matches, ReportSelection selection, RunDiagnostics diagnostics,
                           ReportResult.ReportResultBuilder result) throws IOException, TemplateException {
        String venue = selection.getVenue();
        Tally tally = tally(matches, selection, diagnostics);
        List<VenueMachineSummary> summaries = summarize(tally, diagnostics);
        log.info("Processed {} games on {} machines at {}", tally.getFinishedGames(), tally.getMachines().size(),
                venue);

        Map<String, Object> model = baseModel(selection);
        model.put("venueKey", venue);
        model.put("venueName", venueName(matches, venue));
        model.put("totalMatches", tally.getMatches());
        model.put("totalGames", tally.getFinishedGames());
        model.put("uniqueMachines", tally.getMachines().size());
        model.put("homePicks", topPicks(tally.getPicks().get(Side.HOME)));
        model.put("awayPicks", topPicks(tally.getPicks().get(Side.AWAY)));
        model.put("homeRounds", RoundAttributor.pickedRounds(Side.HOME));
        model.put("awayRounds", RoundAttributor.pickedRounds(Side.AWAY));
        model.put("machines", summaries);

        String fileName = FileWriteUtil.safeFileName(venue) + "_venue_summary_season_" + selection.seasonsCode()
                + ".md";
        Path file = write(fileName, "venue-summary.md.ftl", model);
        result.outputFile(file)
                .matchesProcessed(tally.getMatches())
                .gamesCounted(tally.getFinishedGames())
                .rowsReported(summaries.size());
    }

    /**
     * Folds every complete match at the venue in a single pass.
     */
    Tally tally(List<MatchRecord> matches, ReportSelection selection, RunDiagnostics diagnostics) {
        Tally tally = new Tally();
        GameAttributor attributor = new GameAttributor(diagnostics);
        List<MatchRecord> atVenue = matches.stream().filter(m -> atVenue(m, selection.getVenue())).toList();

        tally.matches = new MatchWalker(diagnostics).walkFinished(atVenue, (match, round, game) -> {
            String machine = context.getResolver().resolveKey(game.getMachine());
            tally.finishedGames++;
            tally.machines.add(machine);
            tally.picks.get(RoundAttributor.pickingSide(round.getNumber())).merge(machine, 1, Integer::sum);

            attributor.attribute(round.getNumber(), game).ifPresent(attributed -> {
                int[] rounds = tally.gamesByRound.computeIfAbsent(machine, k -> new int[RoundAttributor.LAST_ROUND]);
                rounds[round.getNumber() - 1]++;
                for (AttributedScore score : attributed.getScores()) {
                    if (selection.acceptsPosition(score.getRound(), score.getPosition())) {
                        tally.samples.computeIfAbsent(machine, k -> new ArrayList<>())
                                .add(ScoreSample.of(match, score, machine));
                    }
                }
            });
        });
        return tally;
    }

    /**
     * Machines with reliable scores, most games first.
     */
    List<VenueMachineSummary> summarize(Tally tally, RunDiagnostics diagnostics) {
        List<VenueMachineSummary> summaries = new ArrayList<>();
        tally.getGamesByRound().forEach((machine, rounds) -> {
            List<ScoreSample> samples = tally.getSamples().getOrDefault(machine, List.of());
            if (samples.isEmpty()) {
                diagnostics.getInfos().add("No reliable scores for machine " + machine);
                return;
            }
            summaries.add(summarize(machine, rounds, samples));
        });
        summaries.sort(Comparator.comparingInt(VenueMachineSummary::getGames).reversed()
                .thenComparing(VenueMachineSummary::getMachineKey));
        return summaries;
    }

    VenueMachineSummary summarize(String machine, int[] rounds, List<ScoreSample> samples) {
        List<Long> scores = samples.stream().map(ScoreSample::getScore).toList();
        Comparator<ScoreSample> byScore = Comparator.comparingLong(ScoreSample::getScore);
        List<Integer> byRound = new ArrayList<>();
        int games = 0;
        for (int count : rounds) {
            byRound.add(count);
            games += count;
        }
        return VenueMachineSummary.builder()
                .machineKey(machine)
                .displayName(context.getResolver().displayName(machine))
                .games(games)
                .gamesByRound(byRound)
                .scoreCount(scores.size())
                .median(StatisticsOps.median(scores))
                .percentile75(StatisticsOps.percentile(scores, 0.75))
                .percentile90(StatisticsOps.percentile(scores, 0.90))
                .high(samples.stream().max(byScore).orElseThrow())
                .low(StatisticsOps.min(scores))
                .homeHigh(samples.stream().filter(s -> s.getSide() == Side.HOME).max(byScore).orElse(null))
                .build();
    }

    private List<Map<String, Object>> topPicks(Map<String, Integer> picks) {
        return picks.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(e -> context.getResolver().displayName(e.getKey())))
                .limit(TOP_PICKS)
                .map(e -> Map.<String, Object>of(
                        "name", context.getResolver().displayName(e.getKey()),
                        "count", e.getValue()))
                .toList();
    }

    /**
     * Running counts for one venue.
     */
    @Getter
    static class Tally {
        private int matches;
        private int finishedGames;
        private final Set<String> machines = new LinkedHashSet<>();
        private final Map<Side, Map<String, Integer>> picks = new EnumMap<>(Side.class);
        private final Map<String, int[]> gamesByRound = new LinkedHashMap<>();
        private final Map<String, List<ScoreSample>> samples = new LinkedHashMap<>();

        Tally() {
            picks.put(Side.HOME, new LinkedHashMap<>());
            picks.put(Side.AWAY, new LinkedHashMap<>());
        }
    }
}
