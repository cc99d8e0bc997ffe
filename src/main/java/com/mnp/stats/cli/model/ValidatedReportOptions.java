package com.mnp.stats.cli.model;

import java.nio.file.Path;

import com.mnp.stats.config.ReportSelection;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the report commands. Keeps the commands thin.
 */
@Data
@AllArgsConstructor
public class ValidatedReportOptions {
    Path archiveDir;
    Path variationsFile;
    Path outputDir;
    ReportSelection selection;
}
