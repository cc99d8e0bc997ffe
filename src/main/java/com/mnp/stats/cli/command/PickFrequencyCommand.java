package com.mnp.stats.cli.command;

import java.util.Set;

import com.mnp.stats.cli.model.ReportRequirement;
import com.mnp.stats.report.PickFrequencyReport;
import com.mnp.stats.report.ReportContext;
import com.mnp.stats.report.ReportGenerator;

import picocli.CommandLine.Command;

@Command(
        name = "pick-frequency",
        mixinStandardHelpOptions = true,
        description = "Machines a team picks at a venue, split by doubles and singles rounds."
)
public class PickFrequencyCommand extends ReportCommand {

    @Override
    protected String reportName() {
        return "pick-frequency";
    }

    @Override
    protected Set<ReportRequirement> requirements() {
        return Set.of(ReportRequirement.TEAM, ReportRequirement.VENUE);
    }

    @Override
    protected ReportGenerator createGenerator(ReportContext context) {
        return new PickFrequencyReport(context);
    }
}
