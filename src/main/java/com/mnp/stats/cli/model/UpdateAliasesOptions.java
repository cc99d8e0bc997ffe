package com.mnp.stats.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds the CLI options for the "update-aliases" command.
 */
@Getter
public class UpdateAliasesOptions {

    @Option(names = {
            "--variations" }, defaultValue = "machine_variations.json", description = "Machine alias store (default: ${DEFAULT-VALUE})")
    private Path variationsFile;

    @Option(names = { "--changes" }, required = true, description = "Change set JSON with new_machines and add_variations")
    private Path changesFile;

    @Option(names = { "--dry-run" }, description = "Report what would change without writing the store")
    private boolean dryRun;

    @Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
    private boolean verbose;
}
