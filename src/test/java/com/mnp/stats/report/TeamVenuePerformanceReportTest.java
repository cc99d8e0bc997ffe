package com.mnp.stats.report;

import com.mnp.stats.aggregate.ScoreAggregator;
import com.mnp.stats.alias.AliasIndex;
import com.mnp.stats.alias.MachineEntry;
import com.mnp.stats.alias.MachineResolver;
import com.mnp.stats.archive.ArchiveLoader;
import com.mnp.stats.archive.RunDiagnostics;
import com.mnp.stats.archive.model.MatchRecord;
import com.mnp.stats.config.ReportSelection;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.mnp.stats.archive.MatchFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TeamVenuePerformanceReport.
 */
class TeamVenuePerformanceReportTest {

    @TempDir
    Path tempDir;

    private TeamVenuePerformanceReport report;

    @BeforeEach
    void setUp() {
        ReportContext context = ReportContext.builder()
                .archive(new ArchiveLoader(tempDir))
                .resolver(new MachineResolver(AliasIndex.build(List.of(
                        MachineEntry.builder().key("MB").name("Monster Bash").variation("Monster Bash").build()))))
                .outputDir(tempDir.resolve("out"))
                .build();
        report = new TeamVenuePerformanceReport(context);
    }

    @Test
    void testAwayTeamScoresComeFromAwayPositions() {
        // DTP plays away at JUP: in round 1 it holds positions 1 and 3, in round 2 position 2
        MatchRecord match = match("m1", team("JUP"), team("DTP"), "JUP",
                round(1, game("MB",
                        slot(1, "d1", 100L, 2.0),
                        slot(2, "j1", 200L, 0.5),
                        slot(3, "d2", 300L, 1.0),
                        slot(4, "j2", 400L, 1.5))),
                round(2, game("Monster Bash",
                        slot(1, "j1", 500L, 3.0),
                        slot(2, "d1", 50L, 0.0))));
        MatchRecord elsewhere = match("m2", team("T4B"), team("DTP"), "T4B",
                round(2, game("MB", slot(1, "t1", 9L, 3.0), slot(2, "d1", 9_999L, 0.0))));
        MatchRecord otherTeams = match("m3", team("JUP"), team("T4B"), "JUP",
                round(2, game("MB", slot(1, "j1", 7L, 3.0), slot(2, "t1", 8L, 0.0))));

        ReportSelection selection = ReportSelection.builder().season(22).team("DTP").venue("JUP").build();
        ScoreAggregator<TeamMachineKey> aggregator = new ScoreAggregator<>();
        Set<String> machines = new LinkedHashSet<>();

        int visited = report.aggregate(List.of(match, elsewhere, otherTeams), selection, new RunDiagnostics(),
                aggregator, machines);
        List<MachinePerformance> rows = report.performances("DTP", aggregator, machines);

        assertThat(visited).isEqualTo(1);
        assertThat(aggregator.get(new TeamMachineKey("DTP", "MB")).orElseThrow().getScores())
                .containsExactly(100L, 300L, 50L);
        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.getMachineKey()).isEqualTo("MB");
            assertThat(row.getTeamPoints()).isEqualTo(3.0);
            assertThat(row.getOpponentPoints()).isEqualTo(5.0);
            assertThat(row.getGames()).isEqualTo(2);
            assertThat(row.getMedianScore()).isEqualTo(100.0);
            assertThat(row.getPopsText()).isEqualTo("37.5%");
        });
    }

    @Test
    void testHomeTeamScoresComeFromHomePositions() {
        MatchRecord match = match("m1", team("DTP"), team("JUP"), "JUP",
                round(4, game("MB",
                        slot(1, "d1", 1_000L, 1.0),
                        slot(2, "j1", 10L, 0.0),
                        slot(3, "d2", 3_000L, 1.0),
                        slot(4, "j2", 20L, 0.0))));
        ReportSelection selection = ReportSelection.builder().season(22).team("DTP").venue("JUP").build();
        ScoreAggregator<TeamMachineKey> aggregator = new ScoreAggregator<>();

        report.aggregate(List.of(match), selection, new RunDiagnostics(), aggregator, new LinkedHashSet<>());

        assertThat(aggregator.get(new TeamMachineKey("DTP", "MB")).orElseThrow().getScores())
                .containsExactly(1_000L, 3_000L);
        assertThat(aggregator.get(new TeamMachineKey(TeamVenuePerformanceReport.OPPONENTS, "MB")).orElseThrow()
                .getScores()).containsExactly(10L, 20L);
    }

    @Test
    void testRowsOrderedByTotalPoints() {
        MatchRecord match = match("m1", team("JUP"), team("DTP"), "JUP",
                round(2, game("TZ", slot(1, "j1", 1L, 1.0), slot(2, "d1", 2L, 0.0))),
                round(3, game("MB", slot(1, "d1", 1L, 3.0), slot(2, "j1", 2L, 0.0))));
        ReportSelection selection = ReportSelection.builder().season(22).team("DTP").venue("JUP").build();
        ScoreAggregator<TeamMachineKey> aggregator = new ScoreAggregator<>();
        Set<String> machines = new LinkedHashSet<>();

        report.aggregate(List.of(match), selection, new RunDiagnostics(), aggregator, machines);

        assertThat(report.performances("DTP", aggregator, machines))
                .extracting(MachinePerformance::getMachineKey)
                .containsExactly("MB", "TZ");
    }
}
