package com.mnp.stats.report;

import com.mnp.stats.alias.AliasIndex;
import com.mnp.stats.alias.MachineEntry;
import com.mnp.stats.alias.MachineResolver;
import com.mnp.stats.archive.ArchiveLoader;
import com.mnp.stats.archive.RunDiagnostics;
import com.mnp.stats.archive.VenueCatalog;
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
 * Unit tests for PickFrequencyReport.
 */
class PickFrequencyReportTest {

    @TempDir
    Path tempDir;

    private final MatchRecord dtpAwayAtJup = match("m1", team("JUP"), team("DTP"), "JUP",
            round(1, game("MB", slot(1, "d1", 1L, 0.0), slot(2, "j1", 1L, 0.0), slot(3, "d2", 1L, 0.0),
                    slot(4, "j2", 1L, 0.0))),
            round(2, game("TZ", slot(1, "j1", 1L, 0.0), slot(2, "d1", 1L, 0.0))),
            round(3, game("GZ", slot(1, "d1", 1L, 0.0), slot(2, "j1", 1L, 0.0))),
            round(4, game("AFM", slot(1, "j1", 1L, 0.0), slot(2, "d1", 1L, 0.0), slot(3, "j2", 1L, 0.0),
                    slot(4, "d2", 1L, 0.0))));

    @Test
    void testAwayTeamPicksRoundsOneAndThree() {
        PickFrequencyReport report = new PickFrequencyReport(context(VenueCatalog.empty()));
        Map<String, int[]> picks = new LinkedHashMap<>();

        int visited = report.count(List.of(dtpAwayAtJup), selection(false), new RunDiagnostics(), picks);

        assertThat(visited).isEqualTo(1);
        assertThat(picks).containsOnlyKeys("MB", "GZ");
        assertThat(picks.get("MB")).containsExactly(1, 0);
        assertThat(picks.get("GZ")).containsExactly(0, 1);
    }

    @Test
    void testHomeTeamPicksRoundsTwoAndFour() {
        PickFrequencyReport report = new PickFrequencyReport(context(VenueCatalog.empty()));
        Map<String, int[]> picks = new LinkedHashMap<>();
        ReportSelection selection = ReportSelection.builder().season(22).team("JUP").venue("JUP").build();

        report.count(List.of(dtpAwayAtJup), selection, new RunDiagnostics(), picks);

        assertThat(picks).containsOnlyKeys("TZ", "AFM");
        assertThat(picks.get("AFM")).containsExactly(1, 0);
    }

    @Test
    void testPickCountedWhenSeatScoreMissing() {
        MatchRecord unscoredSeat = match("m2", team("JUP"), team("DTP"), "JUP",
                round(1, game("MB", slot(1, "d1", 10L, 0.0), slot(2, "j1", 20L, 0.0), slot(3, "d2", null, 0.0),
                        slot(4, "j2", 40L, 0.0))));
        PickFrequencyReport report = new PickFrequencyReport(context(VenueCatalog.empty()));
        Map<String, int[]> picks = new LinkedHashMap<>();
        RunDiagnostics diagnostics = new RunDiagnostics();

        report.count(List.of(unscoredSeat), selection(false), diagnostics, picks);

        assertThat(picks.get("MB")).containsExactly(1, 0);
        assertThat(diagnostics.getSkippedGames()).isZero();
    }

    @Test
    void testCurrentMachinesFromVenueCatalog() {
        VenueCatalog venues = new VenueCatalog(Map.of("JUP",
                VenueCatalog.Venue.builder().key("JUP").name("Jupiter").homeTeam("JUP").machine("Monster Bash").build()));
        PickFrequencyReport report = new PickFrequencyReport(context(venues));
        Map<String, int[]> picks = new LinkedHashMap<>();

        report.count(List.of(dtpAwayAtJup), selection(true), new RunDiagnostics(), picks);

        assertThat(picks).containsOnlyKeys("MB");
    }

    @Test
    void testHomeVenueDecision() {
        VenueCatalog venues = new VenueCatalog(Map.of("JUP",
                VenueCatalog.Venue.builder().key("JUP").homeTeam("JUP").build()));

        PickFrequencyReport withCatalog = new PickFrequencyReport(context(venues));
        PickFrequencyReport withoutCatalog = new PickFrequencyReport(context(VenueCatalog.empty()));

        assertThat(withCatalog.isHomeVenue(List.of(dtpAwayAtJup), "JUP", "JUP")).isTrue();
        assertThat(withCatalog.isHomeVenue(List.of(dtpAwayAtJup), "DTP", "JUP")).isFalse();
        assertThat(withoutCatalog.isHomeVenue(List.of(dtpAwayAtJup), "JUP", "JUP")).isTrue();
        assertThat(withoutCatalog.isHomeVenue(List.of(dtpAwayAtJup), "DTP", "JUP")).isFalse();
    }

    private ReportSelection selection(boolean currentOnly) {
        return ReportSelection.builder().season(22).team("DTP").venue("JUP").currentMachinesOnly(currentOnly).build();
    }

    private ReportContext context(VenueCatalog venues) {
        return ReportContext.builder()
                .archive(new ArchiveLoader(tempDir))
                .resolver(new MachineResolver(AliasIndex.build(List.of(
                        MachineEntry.builder().key("MB").name("Monster Bash").variation("Monster Bash").build()))))
                .venues(venues)
                .outputDir(tempDir.resolve("out"))
                .build();
    }
}
