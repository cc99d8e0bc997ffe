package com.mnp.stats.report;

import com.mnp.stats.alias.AliasIndex;
import com.mnp.stats.alias.MachineEntry;
import com.mnp.stats.alias.MachineResolver;
import com.mnp.stats.archive.ArchiveFixture;
import com.mnp.stats.archive.ArchiveLoader;
import com.mnp.stats.archive.RunDiagnostics;
import com.mnp.stats.archive.model.MatchRecord;
import com.mnp.stats.attribution.Side;
import com.mnp.stats.config.ReportSelection;

import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.mnp.stats.archive.MatchFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for VenueSummaryReport.
 */
class VenueSummaryReportTest {

    @TempDir
    Path tempDir;

    private ArchiveFixture archive;
    private VenueSummaryReport report;

    private final MatchRecord atJup = match("m1", team("JUP", player("j1", 5)), team("DTP"), "JUP",
            round(1, game("Monster Bash",
                    slot(1, "d1", 100L, 0.0),
                    slot(2, "j1", 200L, 0.0),
                    slot(3, "d2", 300L, 0.0),
                    slot(4, "j2", 400L, 0.0))),
            round(2, game("MB", slot(1, "j1", 500L, 3.0), slot(2, "d1", null, 0.0))),
            round(3, game("TZ", slot(1, "d1", 10L, 3.0), slot(2, "j1", 20L, 0.0))),
            round(4, game("TZ", slot(1, "j1", 30L, 0.0), slot(2, "d1", 40L, 0.0), slot(3, "j2", 50L, 0.0),
                    slot(4, "d2", 60L, 0.0))));

    @BeforeEach
    void setUp() {
        archive = new ArchiveFixture(tempDir.resolve("archive"));
        report = new VenueSummaryReport(ReportContext.builder()
                .archive(new ArchiveLoader(archive.getRoot()))
                .resolver(new MachineResolver(AliasIndex.build(List.of(
                        MachineEntry.builder().key("MB").name("Monster Bash").variation("Monster Bash").build(),
                        MachineEntry.builder().key("TZ").name("Twilight Zone").build()))))
                .outputDir(tempDir.resolve("out"))
                .clock(Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC))
                .build());
    }

    @Test
    void testTallyCountsPicksOverFinishedGames() {
        MatchRecord elsewhere = match("m2", team("T4B"), team("DTP"), "T4B",
                round(2, game("MB", slot(1, "t1", 1L, 3.0), slot(2, "d1", 2L, 0.0))));
        RunDiagnostics diagnostics = new RunDiagnostics();

        VenueSummaryReport.Tally tally = report.tally(List.of(atJup, elsewhere), selection(), diagnostics);

        assertThat(tally.getMatches()).isEqualTo(1);
        assertThat(tally.getFinishedGames()).isEqualTo(4);
        assertThat(tally.getMachines()).containsExactly("MB", "TZ");
        assertThat(tally.getPicks().get(Side.HOME)).containsEntry("MB", 1).containsEntry("TZ", 1);
        assertThat(tally.getPicks().get(Side.AWAY)).containsEntry("MB", 1).containsEntry("TZ", 1);
        assertThat(tally.getGamesByRound().get("MB")).containsExactly(1, 0, 0, 0);
        assertThat(tally.getSamples().get("MB")).extracting(ScoreSample::getScore)
                .containsExactly(100L, 200L, 300L, 400L);
        assertThat(diagnostics.getSkippedGames()).isEqualTo(1);
    }

    @Test
    void testMachineStatistics() {
        VenueSummaryReport.Tally tally = report.tally(List.of(atJup), selection(), new RunDiagnostics());

        List<VenueMachineSummary> summaries = report.summarize(tally, new RunDiagnostics());

        assertThat(summaries).extracting(VenueMachineSummary::getMachineKey).containsExactly("TZ", "MB");
        VenueMachineSummary tz = summaries.get(0);
        assertThat(tz.getGames()).isEqualTo(2);
        assertThat(tz.getGamesByRound()).containsExactly(0, 0, 1, 1);
        assertThat(tz.getScoreCount()).isEqualTo(6);
        assertThat(tz.getMedian()).isEqualTo(35.0);
        assertThat(tz.getPercentile75()).isCloseTo(47.5, within(1e-9));
        assertThat(tz.getHigh().getScore()).isEqualTo(60L);
        assertThat(tz.getLow()).isEqualTo(10L);
        assertThat(tz.getHomeHigh().getScore()).isEqualTo(50L);
        assertThat(tz.getHomeHigh().getSide()).isEqualTo(Side.HOME);
    }

    @Test
    void testReliablePositionsNarrowScoresButNotGames() {
        ReportSelection narrowed = selection().toBuilder().doublesPosition(1).singlesPosition(1).build();

        VenueSummaryReport.Tally tally = report.tally(List.of(atJup), narrowed, new RunDiagnostics());

        assertThat(tally.getSamples().get("MB")).extracting(ScoreSample::getScore).containsExactly(100L);
        assertThat(tally.getSamples().get("TZ")).extracting(ScoreSample::getScore).containsExactly(10L, 30L);
        assertThat(tally.getFinishedGames()).isEqualTo(4);
    }

    @Test
    void testGenerateWritesVenueSummary() throws IOException {
        ObjectNode match = archive.match("m1", "JUP", "DTP", "JUP");
        archive.player(match, "home", "j1", 5);
        archive.game(archive.round(match, 2), "Monster Bash", "j1", 1_500_000, 3, "d1", 900_000, 0);
        archive.game(archive.round(match, 3), "TZ", "d1", 2_000_000, 3, "j1", 10, 0);
        archive.write(22, match);

        ReportResult result = report.generate(selection());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRowsReported()).isEqualTo(2);
        String content = Files.readString(tempDir.resolve("out/JUP_venue_summary_season_22.md"));
        assertThat(content).contains("# JUP Arcade (JUP) - Season 22 Summary");
        assertThat(content).contains("| **Total Matches** | 1 |");
        assertThat(content).contains("| **Unique Machines Played** | 2 |");
        assertThat(content).contains("1. **Monster Bash** - 1 selections");
        assertThat(content).contains("1. **Twilight Zone** - 1 selections");
        assertThat(content).contains("| Round 2 (Home Pick) | 1 |");
        assertThat(content).contains("- **Overall High Score**: 2,000,000");
        assertThat(content).contains("- **Team**: JUP Team");
    }

    private static ReportSelection selection() {
        return ReportSelection.builder().season(22).venue("JUP").build();
    }
}
