package com.mnp.stats.cli.command;

import java.util.Set;

import com.mnp.stats.cli.model.ReportRequirement;
import com.mnp.stats.report.TeamComparisonReport;
import com.mnp.stats.report.ReportContext;
import com.mnp.stats.report.ReportGenerator;

import picocli.CommandLine.Command;

@Command(
        name = "team-comparison",
        mixinStandardHelpOptions = true,
        description = "Two teams' scores on the selected machines across all venues."
)
public class TeamComparisonCommand extends ReportCommand {

    @Override
    protected String reportName() {
        return "team-comparison";
    }

    @Override
    protected Set<ReportRequirement> requirements() {
        return Set.of(ReportRequirement.TEAM, ReportRequirement.OPPONENT, ReportRequirement.MACHINES);
    }

    @Override
    protected ReportGenerator createGenerator(ReportContext context) {
        return new TeamComparisonReport(context);
    }
}
