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
import java.util.Optional;
import java.util.Set;
import java.util.function.ToIntFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mnp.stats.archive.RunDiagnostics;
import com.mnp.stats.archive.VenueCatalog;
import com.mnp.stats.archive.model.MatchRecord;
import com.mnp.stats.attribution.MatchWalker;
import com.mnp.stats.attribution.RoundAttributor;
import com.mnp.stats.attribution.RoundMode;
import com.mnp.stats.attribution.Side;
import com.mnp.stats.config.ReportSelection;
import com.mnp.stats.statistics.StatisticsOps;
import com.mnp.stats.util.FileWriteUtil;

import freemarker.template.TemplateException;

/**
 * Which machines a team picks at a venue, split into doubles and singles rounds.
 *
 * A game counts as the team's pick when the team's side in that match picks
 * the round: home picks rounds 2 and 4, away picks rounds 1 and 3. A pick is
 * counted for every finished game, even when a seat is missing its score.
 */
public class PickFrequencyReport extends ReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(PickFrequencyReport.class);

    public PickFrequencyReport(ReportContext context) {
        super(context);
    }

    @Override
    public String getName() {
        return "pick-frequency";
    }

    @Override
    protected void produce(List<MatchRecord> matches, ReportSelection selection, RunDiagnostics diagnostics,
                           ReportResult.ReportResultBuilder result) throws IOException, TemplateException {
        String team = selection.getTeam();
        String venue = selection.getVenue();

        Map<String, int[]> picks = new LinkedHashMap<>();
        int visited = count(matches, selection, diagnostics, picks);
        List<PickCount> counts = toCounts(picks);

        int totalDoubles = counts.stream().mapToInt(PickCount::getDoubles).sum();
        int totalSingles = counts.stream().mapToInt(PickCount::getSingles).sum();
        log.info("Processed {} matches at {} involving {}", visited, venue, team);
        log.info("Found {} doubles picks and {} singles picks", totalDoubles, totalSingles);

        boolean homeVenue = isHomeVenue(matches, team, venue);
        Side pickingSide = Side.of(homeVenue);

        Map<String, Object> model = baseModel(selection);
        model.put("teamName", teamName(matches, team));
        model.put("venueName", venueName(matches, venue));
        model.put("homeVenue", homeVenue);
        model.put("pickRounds", pickRounds(pickingSide));
        model.put("currentOnly", selection.isCurrentMachinesOnly());
        model.put("totalDoubles", totalDoubles);
        model.put("totalSingles", totalSingles);
        model.put("totalPicks", totalDoubles + totalSingles);
        model.put("doubles", ranked(counts, PickCount::getDoubles, totalDoubles));
        model.put("singles", ranked(counts, PickCount::getSingles, totalSingles));
        model.put("combined", rankedCombined(counts));

        String fileName = FileWriteUtil.safeFileName(team) + "_" + FileWriteUtil.safeFileName(venue)
                + "_pick_frequency_season_" + selection.seasonsCode() + ".md";
        Path file = write(fileName, "pick-frequency.md.ftl", model);
        result.outputFile(file)
                .matchesProcessed(visited)
                .gamesCounted(totalDoubles + totalSingles)
                .rowsReported(counts.size());
    }

    /**
     * Fills {@code picks} with machine key to {doubles, singles} pick counts.
     *
     * @return the number of matches visited
     */
    int count(List<MatchRecord> matches, ReportSelection selection, RunDiagnostics diagnostics,
              Map<String, int[]> picks) {
        String team = selection.getTeam();
        Optional<Set<String>> allowed = allowedMachines(selection);
        List<MatchRecord> relevant = matches.stream()
                .filter(m -> atVenue(m, selection.getVenue()))
                .filter(m -> m.sideOf(team).isPresent())
                .toList();

        return new MatchWalker(diagnostics).walkFinished(relevant, (match, round, game) -> {
            Side side = match.sideOf(team).orElseThrow();
            if (!RoundAttributor.isPickedBy(round.getNumber(), side)) {
                return;
            }
            String machine = context.getResolver().resolveKey(game.getMachine());
            if (allowed.isPresent() && !allowed.get().contains(machine)) {
                return;
            }
            int slot = RoundAttributor.modeOf(round.getNumber()) == RoundMode.DOUBLES ? 0 : 1;
            picks.computeIfAbsent(machine, k -> new int[2])[slot]++;
        });
    }

    /**
     * Machines to keep when the current-machines filter is on: the selected machines,
     * or else the venue's machine list from the venue catalog.
     */
    Optional<Set<String>> allowedMachines(ReportSelection selection) {
        if (!selection.isCurrentMachinesOnly()) {
            return Optional.empty();
        }
        List<String> labels = !selection.getMachines().isEmpty()
                ? selection.getMachines()
                : context.getVenues().machines(selection.getVenue());
        if (labels.isEmpty()) {
            log.warn("No current machines known for venue {}, filter ignored", selection.getVenue());
            return Optional.empty();
        }
        Set<String> keys = new LinkedHashSet<>();
        labels.forEach(l -> keys.add(context.getResolver().resolveKey(l)));
        return Optional.of(keys);
    }

    /**
     * The venue catalog decides when it names a home team; otherwise the team
     * counts as home if it ever played there as the home side.
     */
    boolean isHomeVenue(List<MatchRecord> matches, String team, String venue) {
        Optional<String> homeTeam = context.getVenues().venue(venue).map(VenueCatalog.Venue::getHomeTeam);
        if (homeTeam.isPresent()) {
            return homeTeam.get().equals(team);
        }
        return matches.stream()
                .filter(m -> atVenue(m, venue))
                .anyMatch(m -> m.sideOf(team).filter(s -> s == Side.HOME).isPresent());
    }

    private List<PickCount> toCounts(Map<String, int[]> picks) {
        List<PickCount> counts = new ArrayList<>();
        picks.forEach((machine, c) -> counts.add(
                new PickCount(machine, context.getResolver().displayName(machine), c[0], c[1])));
        return counts;
    }

    private static List<Map<String, Object>> ranked(List<PickCount> counts, ToIntFunction<PickCount> count,
                                                    int total) {
        List<Map<String, Object>> rows = new ArrayList<>();
        counts.stream()
                .filter(c -> count.applyAsInt(c) > 0)
                .sorted(Comparator.comparingInt(count).reversed().thenComparing(PickCount::getDisplayName))
                .forEach(c -> rows.add(Map.of(
                        "name", c.getDisplayName(),
                        "count", count.applyAsInt(c),
                        "percent", ReportFormat.percent(StatisticsOps.percentage(count.applyAsInt(c), total)))));
        return rows;
    }

    private static List<PickCount> rankedCombined(List<PickCount> counts) {
        return counts.stream()
                .sorted(Comparator.comparingInt(PickCount::getTotal).reversed()
                        .thenComparing(PickCount::getDisplayName))
                .toList();
    }

    private static List<String> pickRounds(Side side) {
        return RoundAttributor.pickedRounds(side).stream()
                .map(r -> "Round " + r + " (" + RoundAttributor.modeOf(r).name().toLowerCase(Locale.ROOT) + ")")
                .toList();
    }
}
