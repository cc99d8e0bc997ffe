package com.mnp.stats.cli.command;

import java.util.Set;

import com.mnp.stats.cli.model.ReportRequirement;
import com.mnp.stats.report.MachineScoresReport;
import com.mnp.stats.report.ReportContext;
import com.mnp.stats.report.ReportGenerator;

import picocli.CommandLine.Command;

@Command(
        name = "machine-scores",
        mixinStandardHelpOptions = true,
        description = "Score distribution, percentiles and top scores per machine."
)
public class MachineScoresCommand extends ReportCommand {

    @Override
    protected String reportName() {
        return "machine-scores";
    }

    @Override
    protected Set<ReportRequirement> requirements() {
        return Set.of();
    }

    @Override
    protected ReportGenerator createGenerator(ReportContext context) {
        return new MachineScoresReport(context);
    }
}
