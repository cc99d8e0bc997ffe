package com.mnp.stats.report;

import com.mnp.stats.aggregate.ScoreAggregator;
import com.mnp.stats.alias.AliasIndex;
import com.mnp.stats.alias.MachineResolver;
import com.mnp.stats.archive.ArchiveFixture;
import com.mnp.stats.archive.ArchiveLoader;
import com.mnp.stats.archive.RunDiagnostics;
import com.mnp.stats.archive.model.GameRecord;
import com.mnp.stats.attribution.GameAttributor;
import com.mnp.stats.config.ReportSelection;

import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.mnp.stats.archive.MatchFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for HomeAdvantageReport.
 */
class HomeAdvantageReportTest {

    @TempDir
    Path tempDir;

    private ArchiveFixture archive;
    private HomeAdvantageReport report;

    @BeforeEach
    void setUp() {
        archive = new ArchiveFixture(tempDir.resolve("archive"));
        report = new HomeAdvantageReport(ReportContext.builder()
                .archive(new ArchiveLoader(archive.getRoot()))
                .resolver(new MachineResolver(AliasIndex.empty()))
                .outputDir(tempDir.resolve("out"))
                .build());
    }

    @Test
    void testRankByRatioWithAllHomeFirst() {
        ScoreAggregator<String> points = new ScoreAggregator<>();
        points.accumulateGamePoints("AFM", 6, 4);
        points.accumulateGamePoints("BSD", 5, 0);
        points.accumulateGamePoints("CC", 0, 0);
        points.accumulateGamePoints("DM", 2, 4);

        assertThat(report.rank(points))
                .extracting(MachineAdvantage::getMachineKey, MachineAdvantage::getRatioText)
                .containsExactly(
                        tuple("BSD", ReportFormat.INFINITE_RATIO),
                        tuple("AFM", "1.50"),
                        tuple("DM", "0.50"));
    }

    @Test
    void testGeneratePrefersGamePointsAndFallsBackToPositions() throws IOException {
        ObjectNode match = archive.match("m1", "JUP", "DTP", "JUP");
        ObjectNode round2 = archive.round(match, 2);
        archive.game(round2, "MB", "j1", 100, 3, "d1", 50, 0)
                .put("home_points", 2.0)
                .put("away_points", 1.0);
        ObjectNode round3 = archive.round(match, 3);
        archive.game(round3, "MB", "d1", 10, 0, "j1", 20, 3);
        archive.write(22, match);
        ObjectNode other = archive.match("m2", "T4B", "DTP", "T4B");
        archive.game(archive.round(other, 2), "MB", "t1", 1, 0, "d1", 2, 3);
        archive.write(22, other);

        ReportResult result = report.generate(ReportSelection.builder().season(22).venue("JUP").build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMatchesProcessed()).isEqualTo(1);
        assertThat(result.getGamesCounted()).isEqualTo(2);
        String content = Files.readString(tempDir.resolve("out/JUP_home_away_advantage_season_22.md"));
        assertThat(content).contains("# Home vs Away Advantage: JUP Arcade");
        assertThat(content).contains("| 1 | MB | 5.0 | 1.0 | 83.3% | 16.7% | 5.00 | 2 |");
    }

    @Test
    void testMissingSeatScoreKeepsGameWithGamePoints() throws IOException {
        ObjectNode match = archive.match("m1", "JUP", "DTP", "JUP");
        ObjectNode withTotals = archive.game(archive.round(match, 2), "MB", "j1", 100, 3, "d1", 50, 0)
                .put("home_points", 3.0)
                .put("away_points", 0.0);
        withTotals.remove("score_2");
        ObjectNode withoutTotals = archive.game(archive.round(match, 3), "TZ", "d1", 10, 0, "j1", 20, 3);
        withoutTotals.remove("score_1");
        archive.write(22, match);

        ReportResult result = report.generate(ReportSelection.builder().season(22).venue("JUP").build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getGamesCounted()).isEqualTo(1);
        assertThat(result.getSkippedGames()).isEqualTo(1);
        String content = Files.readString(tempDir.resolve("out/JUP_home_away_advantage_season_22.md"));
        assertThat(content).contains("| 1 | MB | 3.0 | 0.0 |");
        assertThat(content).doesNotContain("| TZ |");
    }

    @Test
    void testPointSplitFallsBackToSeatsOnlyWhenTotalsMissing() {
        GameAttributor attributor = new GameAttributor(new RunDiagnostics());
        GameRecord onlyHomeTotal = game("MB", 4.0, null, slot(1, "j1", 10L, 2.5), slot(2, "d1", 5L, 0.5));
        GameRecord unscoredSeat = game("MB", 4.0, 1.0, slot(1, "j1", 10L, 2.5), slot(2, "d1", null, 0.5));

        assertThat(HomeAdvantageReport.pointSplit(attributor, 2, onlyHomeTotal).orElseThrow())
                .containsExactly(2.5, 0.5);
        assertThat(HomeAdvantageReport.pointSplit(attributor, 2, unscoredSeat).orElseThrow())
                .containsExactly(4.0, 1.0);
        assertThat(HomeAdvantageReport.pointSplit(attributor, 2,
                game("MB", slot(1, "j1", 10L, 2.5), slot(2, "d1", null, 0.5)))).isEmpty();
    }
}
