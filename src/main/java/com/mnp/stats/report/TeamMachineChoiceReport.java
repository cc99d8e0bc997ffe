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

import com.mnp.stats.archive.RunDiagnostics;
import com.mnp.stats.archive.model.MatchRecord;
import com.mnp.stats.attribution.AttributedScore;
import com.mnp.stats.attribution.MatchWalker;
import com.mnp.stats.attribution.RoundAttributor;
import com.mnp.stats.attribution.Side;
import com.mnp.stats.config.ReportSelection;
import com.mnp.stats.util.FileWriteUtil;

import freemarker.template.TemplateException;

/**
 * A team's own scores on the selected machines, split into games where the team
 * picked the machine and games where the opponent did.
 *
 * The picker follows the team's side in the match: home picks rounds 2 and 4,
 * away picks rounds 1 and 3. Every venue is covered.
 */
public class TeamMachineChoiceReport extends ReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(TeamMachineChoiceReport.class);

    public TeamMachineChoiceReport(ReportContext context) {
        super(context);
    }

    @Override
    public String getName() {
        return "team-machine-choice";
    }

    @Override
    protected void produce(List<MatchRecord> matches, ReportSelection selection, RunDiagnostics diagnostics,
                           ReportResult.ReportResultBuilder result) throws IOException, TemplateException {
        String team = selection.getTeam();
        String teamName = teamName(matches, team);

        Map<String, List<ScoreSample>> picked = new LinkedHashMap<>();
        Map<String, List<ScoreSample>> faced = new LinkedHashMap<>();
        int visited = collect(matches, selection, diagnostics, picked, faced);
        List<MachineChoice> choices = choices(selection, teamName, picked, faced);

        int teamPickedScores = choices.stream().mapToInt(c -> c.getTeamPicked().getCount()).sum();
        int opponentPickedScores = choices.stream().mapToInt(c -> c.getOpponentPicked().getCount()).sum();
        log.info("Extracted {} scores when {} picked the machine", teamPickedScores, team);
        log.info("Extracted {} scores when the opponent picked the machine", opponentPickedScores);

        Map<String, Object> model = baseModel(selection);
        model.put("teamName", teamName);
        model.put("machines", choices);
        model.put("machinesTracked", targetMachines(selection).size());
        model.put("machinesTeamPicked", choices.stream().filter(c -> !c.getTeamPicked().isEmpty()).count());
        model.put("machinesOpponentPicked", choices.stream().filter(c -> !c.getOpponentPicked().isEmpty()).count());
        model.put("teamPickedScores", teamPickedScores);
        model.put("opponentPickedScores", opponentPickedScores);
        model.put("homeRounds", RoundAttributor.pickedRounds(Side.HOME));
        model.put("awayRounds", RoundAttributor.pickedRounds(Side.AWAY));

        String fileName = "machine_choices_" + FileWriteUtil.safeFileName(team) + "_seasons_"
                + selection.seasonsCode() + ".md";
        Path file = write(fileName, "team-machine-choice.md.ftl", model);
        result.outputFile(file)
                .matchesProcessed(visited)
                .gamesCounted(teamPickedScores + opponentPickedScores)
                .rowsReported(choices.size());
    }

    /**
     * Fills the team's scores per target machine into {@code picked} or {@code faced}.
     *
     * @return the number of matches visited
     */
    int collect(List<MatchRecord> matches, ReportSelection selection, RunDiagnostics diagnostics,
                Map<String, List<ScoreSample>> picked, Map<String, List<ScoreSample>> faced) {
        String team = selection.getTeam();
        Set<String> targets = targetMachines(selection);
        List<MatchRecord> relevant = matches.stream().filter(m -> m.sideOf(team).isPresent()).toList();

        return new MatchWalker(diagnostics).walk(relevant, (match, game) -> {
            String machine = context.getResolver().resolveKey(game.getGame().getMachine());
            if (!targets.contains(machine)) {
                return;
            }
            Side side = match.sideOf(team).orElseThrow();
            Map<String, List<ScoreSample>> bucket = RoundAttributor.isPickedBy(game.getRound(), side) ? picked : faced;
            for (AttributedScore score : game.scoresFor(side)) {
                if (selection.acceptsPosition(score.getRound(), score.getPosition())) {
                    bucket.computeIfAbsent(machine, k -> new ArrayList<>()).add(ScoreSample.of(match, score, machine));
                }
            }
        });
    }

    /**
     * One entry per target machine with any score, ordered by display name.
     */
    List<MachineChoice> choices(ReportSelection selection, String teamName, Map<String, List<ScoreSample>> picked,
                                Map<String, List<ScoreSample>> faced) {
        List<MachineChoice> choices = new ArrayList<>();
        for (String machine : targetMachines(selection)) {
            List<ScoreSample> own = sorted(picked.get(machine));
            List<ScoreSample> other = sorted(faced.get(machine));
            if (own.isEmpty() && other.isEmpty()) {
                log.warn("No scores found for {} on machine '{}'", selection.getTeam(), machine);
                continue;
            }
            choices.add(new MachineChoice(
                    machine,
                    context.getResolver().displayName(machine),
                    new TeamMachineScores(selection.getTeam(), teamName, own),
                    new TeamMachineScores(selection.getTeam(), teamName, other)));
        }
        choices.sort(Comparator.comparing(MachineChoice::getDisplayName));
        return choices;
    }

    private Set<String> targetMachines(ReportSelection selection) {
        Set<String> targets = new LinkedHashSet<>();
        selection.getMachines().forEach(m -> targets.add(context.getResolver().resolveKey(m)));
        return targets;
    }

    private static List<ScoreSample> sorted(List<ScoreSample> samples) {
        if (samples == null) {
            return List.of();
        }
        return samples.stream()
                .sorted(Comparator.comparingLong(ScoreSample::getScore).reversed())
                .toList();
    }
}
