package com.mnp.stats.report;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mnp.stats.aggregate.Accumulator;
import com.mnp.stats.aggregate.ScoreAggregator;
import com.mnp.stats.archive.RunDiagnostics;
import com.mnp.stats.archive.model.GameRecord;
import com.mnp.stats.archive.model.MatchRecord;
import com.mnp.stats.attribution.GameAttributor;
import com.mnp.stats.attribution.MatchWalker;
import com.mnp.stats.attribution.Side;
import com.mnp.stats.config.ReportSelection;
import com.mnp.stats.statistics.StatisticsOps;
import com.mnp.stats.util.FileWriteUtil;

import freemarker.template.TemplateException;

/**
 * Home versus away points per machine at one venue, ordered by home advantage.
 *
 * Uses the game-level home/away point totals; when a game lacks them the
 * per-position points are summed by side instead. A missing seat score only
 * drops a game that also lacks the game-level totals.
 */
public class HomeAdvantageReport extends ReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(HomeAdvantageReport.class);

    public HomeAdvantageReport(ReportContext context) {
        super(context);
    }

    @Override
    public String getName() {
        return "home-advantage";
    }

    @Override
    protected void produce(List<MatchRecord> matches, ReportSelection selection, RunDiagnostics diagnostics,
                           ReportResult.ReportResultBuilder result) throws IOException, TemplateException {
        String venue = selection.getVenue();
        ScoreAggregator<String> points = new ScoreAggregator<>();
        List<MatchRecord> atVenue = matches.stream().filter(m -> atVenue(m, venue)).toList();
        GameAttributor attributor = new GameAttributor(diagnostics);
        int visited = new MatchWalker(diagnostics).walkFinished(atVenue, (match, round, game) -> {
            Optional<double[]> split = pointSplit(attributor, round.getNumber(), game);
            if (split.isEmpty()) {
                return;
            }
            String machine = context.getResolver().resolveKey(game.getMachine());
            points.accumulateGamePoints(machine, split.get()[0], split.get()[1]);
            points.countGame(machine);
        });

        List<MachineAdvantage> rows = rank(points);
        int games = rows.stream().mapToInt(MachineAdvantage::getGames).sum();
        log.info("Processed {} games across {} machines", games, rows.size());

        double totalHome = rows.stream().mapToDouble(MachineAdvantage::getHomePoints).sum();
        double totalAway = rows.stream().mapToDouble(MachineAdvantage::getAwayPoints).sum();

        Map<String, Object> model = baseModel(selection);
        model.put("venueName", venueName(matches, venue));
        model.put("rows", rows);
        model.put("totalGames", games);
        model.put("totalHome", ReportFormat.points(totalHome));
        model.put("totalAway", ReportFormat.points(totalAway));
        model.put("overallHomePct", ReportFormat.percent(StatisticsOps.percentage(totalHome, totalHome + totalAway)));
        model.put("overallRatio", ReportFormat.ratio(StatisticsOps.ratio(totalHome, totalAway)));

        String fileName = FileWriteUtil.safeFileName(venue) + "_home_away_advantage_season_"
                + selection.seasonsCode() + ".md";
        Path file = write(fileName, "home-advantage.md.ftl", model);
        result.outputFile(file)
                .matchesProcessed(visited)
                .gamesCounted(games)
                .rowsReported(rows.size());
    }

    /**
     * {home, away} points of a finished game. The game-level totals win when both are
     * present; otherwise the seated positions are summed by side, which needs every seat scored.
     */
    static Optional<double[]> pointSplit(GameAttributor attributor, int round, GameRecord game) {
        if (game.getHomePoints() != null && game.getAwayPoints() != null) {
            return Optional.of(new double[] {game.getHomePoints(), game.getAwayPoints()});
        }
        return attributor.attribute(round, game)
                .map(g -> new double[] {g.pointsFor(Side.HOME), g.pointsFor(Side.AWAY)});
    }

    /**
     * Machines with any points, highest home/away ratio first.
     */
    List<MachineAdvantage> rank(ScoreAggregator<String> points) {
        List<MachineAdvantage> rows = new ArrayList<>();
        for (Map.Entry<String, Accumulator> entry : points.asMap().entrySet()) {
            Accumulator acc = entry.getValue();
            if (acc.getTotalPoints() == 0) {
                continue;
            }
            rows.add(new MachineAdvantage(
                    entry.getKey(),
                    context.getResolver().displayName(entry.getKey()),
                    acc.getHomePoints(),
                    acc.getAwayPoints(),
                    acc.getGames(),
                    StatisticsOps.ratio(acc.getHomePoints(), acc.getAwayPoints())));
        }
        rows.sort(Comparator.comparingDouble(MachineAdvantage::getRatio).reversed()
                .thenComparing(MachineAdvantage::getMachineKey));
        return rows;
    }
}
