package com.mnp.stats;

import com.mnp.stats.cli.StatsCommand;

import picocli.CommandLine;

/**
 * Main entry point for the MNP league statistics tool.
 * Reads the match archive and writes Markdown reports; see {@link StatsCommand} for the commands.
 */
public class StatsApplication {

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine createCommandLine() {
        return new CommandLine(new StatsCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
