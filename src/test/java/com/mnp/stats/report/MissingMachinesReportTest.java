package com.mnp.stats.report;

import com.mnp.stats.alias.AliasChangeSet;
import com.mnp.stats.alias.AliasIndex;
import com.mnp.stats.alias.AliasStore;
import com.mnp.stats.alias.MachineEntry;
import com.mnp.stats.alias.MachineResolver;
import com.mnp.stats.archive.ArchiveFixture;
import com.mnp.stats.archive.ArchiveLoader;
import com.mnp.stats.archive.MachineCatalog;
import com.mnp.stats.archive.model.MatchRecord;
import com.mnp.stats.config.ReportSelection;

import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.mnp.stats.archive.MatchFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MissingMachinesReport.
 */
class MissingMachinesReportTest {

    @TempDir
    Path tempDir;

    private ArchiveFixture archive;
    private MissingMachinesReport report;

    @BeforeEach
    void setUp() {
        archive = new ArchiveFixture(tempDir.resolve("archive"));
        report = new MissingMachinesReport(ReportContext.builder()
                .archive(new ArchiveLoader(archive.getRoot()))
                .resolver(new MachineResolver(AliasIndex.build(List.of(
                        MachineEntry.builder().key("MB").name("Monster Bash").variation("Monster Bash").build()))))
                .machineCatalog(new MachineCatalog(Map.of("Godzilla", "Godzilla (Premium)")))
                .outputDir(tempDir.resolve("out"))
                .build());
    }

    @Test
    void testFindMissingCountsUnresolvedLabelsInEveryMatch() {
        MatchRecord match = match("m1", team("JUP"), team("DTP"), "JUP",
                round(2,
                        game("monster bash", slot(1, "j1", 1L, 0.0), slot(2, "d1", 1L, 0.0)),
                        game(" Godzilla ", slot(1, "j1", 1L, 0.0), slot(2, "d1", 1L, 0.0))),
                round(3, game("Godzilla", slot(1, "d1", 1L, 0.0), slot(2, "j1", 1L, 0.0))));
        MatchRecord unfinished = incomplete(match("m2", team("JUP"), team("DTP"), "JUP",
                round(1, game("Xenon"))));

        Map<String, Integer> missing = report.findMissing(List.of(match, unfinished));

        assertThat(missing).containsExactly(entry("Godzilla", 2), entry("Xenon", 1));
    }

    @Test
    void testSuggestionUsesOfficialName() {
        MachineEntry known = report.suggest("Godzilla");
        MachineEntry unknown = report.suggest("Xenon");

        assertThat(known.getDisplayName()).isEqualTo("Godzilla (Premium)");
        assertThat(known.getVariations()).containsExactly("godzilla", "Godzilla (Premium)");
        assertThat(unknown.getDisplayName()).isEqualTo("Xenon");
        assertThat(unknown.getVariations()).containsExactly("xenon");
    }

    @Test
    void testGenerateWritesChangeSet() throws IOException {
        ObjectNode match = archive.match("m1", "JUP", "DTP", "JUP");
        archive.game(archive.round(match, 2), "Godzilla", "j1", 1, 3, "d1", 2, 0);
        archive.write(22, match);

        ReportResult result = report.generate(ReportSelection.builder().season(22).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRowsReported()).isEqualTo(1);
        Path file = tempDir.resolve("out/missing_machines_season_22.json");
        assertThat(result.getOutputFiles()).containsExactly(file);
        AliasChangeSet changes = new AliasStore().readChangeSet(file);
        assertThat(changes.getNewMachines()).extracting(MachineEntry::getKey).containsExactly("Godzilla");
    }

    @Test
    void testNothingWrittenWhenEverythingResolves() throws IOException {
        ObjectNode match = archive.match("m1", "JUP", "DTP", "JUP");
        archive.game(archive.round(match, 2), "MB", "j1", 1, 3, "d1", 2, 0);
        archive.write(22, match);

        ReportResult result = report.generate(ReportSelection.builder().season(22).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutputFiles()).isEmpty();
        assertThat(tempDir.resolve("out/missing_machines_season_22.json")).doesNotExist();
    }
}
