package com.mnp.stats.report;

import com.mnp.stats.aggregate.ScoreAggregator;
import com.mnp.stats.alias.AliasIndex;
import com.mnp.stats.alias.MachineEntry;
import com.mnp.stats.alias.MachineResolver;
import com.mnp.stats.archive.ArchiveLoader;
import com.mnp.stats.archive.RunDiagnostics;
import com.mnp.stats.archive.model.MatchRecord;
import com.mnp.stats.config.ReportSelection;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.mnp.stats.archive.MatchFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TeamComparisonReport.
 */
class TeamComparisonReportTest {

    @TempDir
    Path tempDir;

    @Test
    void testScoresSplitByTeamAcrossVenues() {
        TeamComparisonReport report = new TeamComparisonReport(ReportContext.builder()
                .archive(new ArchiveLoader(tempDir))
                .resolver(new MachineResolver(AliasIndex.build(List.of(
                        MachineEntry.builder().key("MB").name("Monster Bash").variation("Monster Bash").build(),
                        MachineEntry.builder().key("AFM").name("Attack From Mars").build()))))
                .outputDir(tempDir)
                .build());

        MatchRecord headToHead = match("m1", team("JUP"), team("DTP"), "JUP",
                round(1, game("Monster Bash",
                        slot(1, "d1", 100L, 0.0),
                        slot(2, "j1", 200L, 0.0),
                        slot(3, "d2", 300L, 0.0),
                        slot(4, "j2", 400L, 0.0))),
                round(2, game("TZ", slot(1, "j1", 1L, 0.0), slot(2, "d1", 2L, 0.0))));
        MatchRecord dtpElsewhere = match("m2", team("T4B"), team("DTP"), "T4B",
                round(3, game("MB", slot(1, "d1", 900L, 0.0), slot(2, "t1", 5L, 0.0))));
        ReportSelection selection = ReportSelection.builder()
                .season(22)
                .team("DTP")
                .opponent("JUP")
                .machine("MB")
                .machine("AFM")
                .build();
        ScoreAggregator<TeamMachineKey> aggregator = new ScoreAggregator<>();
        Map<TeamMachineKey, List<ScoreSample>> samples = new LinkedHashMap<>();

        int visited = report.collect(List.of(headToHead, dtpElsewhere), selection, new RunDiagnostics(),
                aggregator, samples);
        List<MachineComparison> comparisons = report.compare(selection, "DTP Team", "JUP Team", aggregator, samples);

        assertThat(visited).isEqualTo(2);
        assertThat(aggregator.get(new TeamMachineKey("DTP", "MB")).orElseThrow().getGames()).isEqualTo(2);
        assertThat(aggregator.get(new TeamMachineKey("T4B", "MB"))).isEmpty();
        assertThat(comparisons).singleElement().satisfies(c -> {
            assertThat(c.getDisplayName()).isEqualTo("Monster Bash");
            assertThat(c.getFirst().getSamples()).extracting(ScoreSample::getScore).containsExactly(900L, 300L, 100L);
            assertThat(c.getSecond().getSamples()).extracting(ScoreSample::getScore).containsExactly(400L, 200L);
            assertThat(c.getFirst().getMedianText()).isEqualTo("300");
            assertThat(c.getSecond().getMaxText()).isEqualTo("400");
        });
    }
}
