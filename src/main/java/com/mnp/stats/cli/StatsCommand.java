package com.mnp.stats.cli;

import java.util.concurrent.Callable;

import com.mnp.stats.cli.command.HomeAdvantageCommand;
import com.mnp.stats.cli.command.MachineScoresCommand;
import com.mnp.stats.cli.command.MissingMachinesCommand;
import com.mnp.stats.cli.command.PickFrequencyCommand;
import com.mnp.stats.cli.command.TeamComparisonCommand;
import com.mnp.stats.cli.command.TeamMachineChoiceCommand;
import com.mnp.stats.cli.command.TeamVenuePerformanceCommand;
import com.mnp.stats.cli.command.UpdateAliasesCommand;
import com.mnp.stats.cli.command.VenueSummaryCommand;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root command. Every report and maintenance task is a sub-command.
 */
@Command(
        name = "mnp-stats",
        mixinStandardHelpOptions = true,
        version = "mnp-stats 1.0.0",
        description = "Statistics and reports from the Monday Night Pinball match archive.",
        subcommands = {
                MachineScoresCommand.class,
                HomeAdvantageCommand.class,
                PickFrequencyCommand.class,
                TeamVenuePerformanceCommand.class,
                TeamComparisonCommand.class,
                TeamMachineChoiceCommand.class,
                VenueSummaryCommand.class,
                MissingMachinesCommand.class,
                UpdateAliasesCommand.class
        }
)
public class StatsCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required sub-command");
    }
}
