package com.mnp.stats.report;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mnp.stats.aggregate.Accumulator;
import com.mnp.stats.aggregate.ScoreAggregator;
import com.mnp.stats.archive.RunDiagnostics;
import com.mnp.stats.archive.model.MatchRecord;
import com.mnp.stats.archive.model.TeamRecord;
import com.mnp.stats.attribution.AttributedScore;
import com.mnp.stats.attribution.MatchWalker;
import com.mnp.stats.config.ReportSelection;
import com.mnp.stats.util.FileWriteUtil;

import freemarker.template.TemplateException;

/**
 * Two teams' scores on the selected machines, across every venue.
 */
public class TeamComparisonReport extends ReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(TeamComparisonReport.class);

    public TeamComparisonReport(ReportContext context) {
        super(context);
    }

    @Override
    public String getName() {
        return "team-comparison";
    }

    @Override
    protected void produce(List<MatchRecord> matches, ReportSelection selection, RunDiagnostics diagnostics,
                           ReportResult.ReportResultBuilder result) throws IOException, TemplateException {
        String first = selection.getTeam();
        String second = selection.getOpponent();
        String firstName = teamName(matches, first);
        String secondName = teamName(matches, second);

        ScoreAggregator<TeamMachineKey> aggregator = new ScoreAggregator<>();
        Map<TeamMachineKey, List<ScoreSample>> samples = new LinkedHashMap<>();
        int visited = collect(matches, selection, diagnostics, aggregator, samples);

        List<MachineComparison> comparisons = compare(selection, firstName, secondName, aggregator, samples);
        log.info("Found data for {} machines", comparisons.size());

        Map<String, Object> model = baseModel(selection);
        model.put("firstName", firstName);
        model.put("secondName", secondName);
        model.put("machines", comparisons);

        String fileName = FileWriteUtil.safeFileName(first) + "_vs_" + FileWriteUtil.safeFileName(second)
                + "_machine_comparison_season_" + selection.seasonsCode() + ".md";
        Path file = write(fileName, "team-comparison.md.ftl", model);
        result.outputFile(file)
                .matchesProcessed(visited)
                .rowsReported(comparisons.size())
                .gamesCounted(aggregator.asMap().values().stream().mapToInt(Accumulator::getGames).sum());
    }

    int collect(List<MatchRecord> matches, ReportSelection selection, RunDiagnostics diagnostics,
                ScoreAggregator<TeamMachineKey> aggregator, Map<TeamMachineKey, List<ScoreSample>> samples) {
        Set<String> teams = Set.of(selection.getTeam(), selection.getOpponent());
        Set<String> targets = targetMachines(selection);
        List<MatchRecord> relevant = matches.stream()
                .filter(m -> m.sideOf(selection.getTeam()).isPresent() || m.sideOf(selection.getOpponent()).isPresent())
                .toList();

        return new MatchWalker(diagnostics).walk(relevant, (match, game) -> {
            String machine = context.getResolver().resolveKey(game.getGame().getMachine());
            if (!targets.contains(machine)) {
                return;
            }
            Set<TeamMachineKey> counted = new LinkedHashSet<>();
            for (AttributedScore score : game.getScores()) {
                TeamRecord owner = match.team(score.getSide());
                if (owner == null || !teams.contains(owner.getKey())) {
                    continue;
                }
                TeamMachineKey key = new TeamMachineKey(owner.getKey(), machine);
                aggregator.accumulate(key, score);
                samples.computeIfAbsent(key, k -> new ArrayList<>()).add(ScoreSample.of(match, score, machine));
                if (counted.add(key)) {
                    aggregator.countGame(key);
                }
            }
        });
    }

    List<MachineComparison> compare(ReportSelection selection, String firstName, String secondName,
                                    ScoreAggregator<TeamMachineKey> aggregator,
                                    Map<TeamMachineKey, List<ScoreSample>> samples) {
        List<MachineComparison> comparisons = new ArrayList<>();
        for (String machine : targetMachines(selection)) {
            TeamMachineKey firstKey = new TeamMachineKey(selection.getTeam(), machine);
            TeamMachineKey secondKey = new TeamMachineKey(selection.getOpponent(), machine);
            if (aggregator.get(firstKey).isEmpty() && aggregator.get(secondKey).isEmpty()) {
                continue;
            }
            comparisons.add(new MachineComparison(
                    machine,
                    context.getResolver().displayName(machine),
                    new TeamMachineScores(selection.getTeam(), firstName, sortedSamples(samples, firstKey)),
                    new TeamMachineScores(selection.getOpponent(), secondName, sortedSamples(samples, secondKey))));
        }
        comparisons.sort(Comparator.comparing(MachineComparison::getDisplayName));
        return comparisons;
    }

    private Set<String> targetMachines(ReportSelection selection) {
        Set<String> targets = new LinkedHashSet<>();
        selection.getMachines().forEach(m -> targets.add(context.getResolver().resolveKey(m)));
        return targets;
    }

    private static List<ScoreSample> sortedSamples(Map<TeamMachineKey, List<ScoreSample>> samples,
                                                   TeamMachineKey key) {
        return samples.getOrDefault(key, List.of()).stream()
                .sorted(Comparator.comparingLong(ScoreSample::getScore).reversed())
                .toList();
    }
}
