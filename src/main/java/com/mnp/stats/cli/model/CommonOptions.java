package com.mnp.stats.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options shared by every report command. No validation, no execution logic, no printing.
 */
@Getter
public class CommonOptions {

    @Option(names = { "--archive",
            "-a" }, defaultValue = "mnp-data-archive", description = "Match archive root containing season-N/matches (default: ${DEFAULT-VALUE})")
    private Path archiveDir;

    @Option(names = {
            "--variations" }, defaultValue = "machine_variations.json", description = "Machine alias store (default: ${DEFAULT-VALUE})")
    private Path variationsFile;

    @Option(names = { "--output-dir",
            "-o" }, defaultValue = "reports/output", description = "Directory reports are written to (default: ${DEFAULT-VALUE})")
    private Path outputDir;

    @Option(names = { "--season", "-s" }, split = ",", description = "Season number(s), comma-separated")
    private List<Integer> seasons;

    @Option(names = { "--config", "-c" }, description = "JSON report config; command-line options take precedence")
    private Path config;

    @Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
    private boolean verbose;
}
