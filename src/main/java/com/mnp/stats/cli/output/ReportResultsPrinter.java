package com.mnp.stats.cli.output;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mnp.stats.alias.AliasConflict;
import com.mnp.stats.alias.MaintenanceResult;
import com.mnp.stats.cli.exception.OptionsValidationException;
import com.mnp.stats.cli.model.ValidatedReportOptions;
import com.mnp.stats.config.ReportSelection;
import com.mnp.stats.report.ReportResult;

/**
 * Responsible only for printing CLI output. No validation, no execution.
 */
public class ReportResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ReportResultsPrinter.class);

    public void printBanner(String reportName, ValidatedReportOptions v) {
        ReportSelection s = v.getSelection();
        log.info("=================================================");
        log.info("MNP League Stats: {}", reportName);
        log.info("=================================================");
        log.info("Archive: {}", v.getArchiveDir().toAbsolutePath());
        log.info("Machine Variations: {}", v.getVariationsFile().toAbsolutePath());
        log.info("{}", s.seasonsTitle());
        if (s.getVenue() != null) {
            log.info("Venue: {}", s.getVenue());
        }
        if (s.getTeam() != null) {
            log.info("Team: {}", s.getTeam());
        }
        if (s.getOpponent() != null) {
            log.info("Opponent: {}", s.getOpponent());
        }
        if (!s.getMachines().isEmpty()) {
            log.info("Machines: {}", String.join(", ", s.getMachines()));
        }
        if (s.hasIprFilter()) {
            log.info("IPR Filter: {} to {}", s.getMinIpr() != null ? s.getMinIpr() : "any",
                    s.getMaxIpr() != null ? s.getMaxIpr() : "any");
        }
        log.info("Outlier Filter: {}", s.getOutlierFilter().getMethod());
        log.info("Output Directory: {}", v.getOutputDir());
        log.info("=================================================");
    }

    public void printSuccess(ReportResult result) {
        log.info("");
        log.info("=================================================");
        log.info("REPORT COMPLETE: {}", result.getReportName());
        log.info("=================================================");
        log.info("Matches Processed: {}", result.getMatchesProcessed());
        log.info("Games Counted: {}", result.getGamesCounted());
        log.info("Rows Reported: {}", result.getRowsReported());
        if (result.getSkippedGames() > 0 || result.getSkippedRounds() > 0) {
            log.warn("Skipped: {} games, {} rounds (incomplete records)", result.getSkippedGames(),
                    result.getSkippedRounds());
        }
        if (result.getOutputFiles().isEmpty()) {
            log.info("No files written");
        }
        for (Path file : result.getOutputFiles()) {
            log.info("Written: {}", file);
        }
        log.info("=================================================");
    }

    public void printFailure(ReportResult result) {
        log.error("Report failed: {}", result.getErrorMessage());
    }

    public void printValidationErrors(OptionsValidationException e) {
        log.error("Invalid options:");
        e.getErrors().forEach(error -> log.error("  - {}", error));
    }

    public void printMaintenance(MaintenanceResult result, Path store) {
        log.info("");
        log.info("=================================================");
        log.info(result.isDryRun() ? "ALIAS STORE UPDATE (DRY RUN)" : "ALIAS STORE UPDATED");
        log.info("=================================================");
        log.info("Store: {}", store.toAbsolutePath());
        log.info("Machines Added: {}", result.getAddedMachines().size());
        log.info("Machines Skipped (already present): {}", result.getSkippedMachines().size());
        log.info("Variations Added: {}", result.getAddedVariations().values().stream().mapToInt(List::size).sum());
        if (!result.getUnknownKeys().isEmpty()) {
            log.warn("Unknown Keys: {}", String.join(", ", result.getUnknownKeys()));
        }
        if (result.hasConflicts()) {
            log.warn("Conflicts Rejected: {}", result.getConflicts().size());
            for (AliasConflict conflict : result.getConflicts()) {
                log.warn("  - {}", conflict.describe());
            }
        }
        log.info("Total Changes: {}{}", result.getChangeCount(), result.isDryRun() ? " (not saved)" : "");
        log.info("=================================================");
    }
}
