package com.mnp.stats.report;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
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
import com.mnp.stats.attribution.AttributedScore;
import com.mnp.stats.attribution.MatchWalker;
import com.mnp.stats.attribution.Side;
import com.mnp.stats.config.ReportSelection;
import com.mnp.stats.statistics.StatisticsOps;
import com.mnp.stats.util.FileWriteUtil;

import freemarker.template.TemplateException;

/**
 * Points a team earns against its opponents on each machine at one venue.
 *
 * Scores are attributed by position: the team's positions in a round depend
 * on whether it is the home or the away side of that match.
 */
public class TeamVenuePerformanceReport extends ReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(TeamVenuePerformanceReport.class);

    /** Aggregation key standing for whichever team the target team played. */
    static final String OPPONENTS = "*opponents*";

    public TeamVenuePerformanceReport(ReportContext context) {
        super(context);
    }

    @Override
    public String getName() {
        return "team-venue-performance";
    }

    @Override
    protected void produce(List<MatchRecord> matches, ReportSelection selection, RunDiagnostics diagnostics,
                           ReportResult.ReportResultBuilder result) throws IOException, TemplateException {
        String team = selection.getTeam();
        String venue = selection.getVenue();

        ScoreAggregator<TeamMachineKey> aggregator = new ScoreAggregator<>();
        Set<String> machines = new LinkedHashSet<>();
        int visited = aggregate(matches, selection, diagnostics, aggregator, machines);
        List<MachinePerformance> rows = performances(team, aggregator, machines);

        double teamPoints = rows.stream().mapToDouble(MachinePerformance::getTeamPoints).sum();
        double opponentPoints = rows.stream().mapToDouble(MachinePerformance::getOpponentPoints).sum();
        int games = rows.stream().mapToInt(MachinePerformance::getGames).sum();
        log.info("Processed {} games on {} machines for {} at {}", games, rows.size(), team, venue);

        Map<String, Object> model = baseModel(selection);
        model.put("teamName", teamName(matches, team));
        model.put("venueName", venueName(matches, venue));
        model.put("rows", rows);
        model.put("totalGames", games);
        model.put("teamPoints", ReportFormat.points(teamPoints));
        model.put("opponentPoints", ReportFormat.points(opponentPoints));
        model.put("totalPoints", ReportFormat.points(teamPoints + opponentPoints));
        model.put("teamPops", ReportFormat.percent(StatisticsOps.percentage(teamPoints, teamPoints + opponentPoints)));

        String fileName = FileWriteUtil.safeFileName(team) + "_" + FileWriteUtil.safeFileName(venue)
                + "_performance_season_" + selection.seasonsCode() + ".md";
        Path file = write(fileName, "team-venue-performance.md.ftl", model);
        result.outputFile(file)
                .matchesProcessed(visited)
                .gamesCounted(games)
                .rowsReported(rows.size());
    }

    int aggregate(List<MatchRecord> matches, ReportSelection selection, RunDiagnostics diagnostics,
                  ScoreAggregator<TeamMachineKey> aggregator, Set<String> machines) {
        String team = selection.getTeam();
        List<MatchRecord> relevant = matches.stream()
                .filter(m -> atVenue(m, selection.getVenue()))
                .filter(m -> m.sideOf(team).isPresent())
                .toList();

        return new MatchWalker(diagnostics).walk(relevant, (match, game) -> {
            Side teamSide = match.sideOf(team).orElseThrow();
            String machine = context.getResolver().resolveKey(game.getGame().getMachine());
            machines.add(machine);

            TeamMachineKey own = new TeamMachineKey(team, machine);
            TeamMachineKey opponents = new TeamMachineKey(OPPONENTS, machine);
            for (AttributedScore score : game.getScores()) {
                aggregator.accumulate(score.getSide() == teamSide ? own : opponents, score);
            }
            aggregator.countGame(own);
        });
    }

    /**
     * One row per machine, highest total points first.
     */
    List<MachinePerformance> performances(String team, ScoreAggregator<TeamMachineKey> aggregator,
                                          Set<String> machines) {
        List<MachinePerformance> rows = new ArrayList<>();
        for (String machine : machines) {
            Accumulator own = aggregator.get(new TeamMachineKey(team, machine)).orElse(null);
            Accumulator opponents = aggregator.get(new TeamMachineKey(OPPONENTS, machine)).orElse(null);
            double teamPoints = own != null ? own.getTotalPoints() : 0;
            double opponentPoints = opponents != null ? opponents.getTotalPoints() : 0;
            Double median = own != null && !own.getScores().isEmpty() ? StatisticsOps.median(own.getScores()) : null;
            rows.add(new MachinePerformance(machine, context.getResolver().displayName(machine),
                    teamPoints, opponentPoints, own != null ? own.getGames() : 0, median));
        }
        rows.sort(Comparator.comparingDouble(MachinePerformance::getTotalPoints).reversed()
                .thenComparing(MachinePerformance::getMachineKey));
        return rows;
    }
}
