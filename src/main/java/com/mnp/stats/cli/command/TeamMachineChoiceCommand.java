package com.mnp.stats.cli.command;

import java.util.Set;

import com.mnp.stats.cli.model.ReportRequirement;
import com.mnp.stats.report.ReportContext;
import com.mnp.stats.report.ReportGenerator;
import com.mnp.stats.report.TeamMachineChoiceReport;

import picocli.CommandLine.Command;

@Command(
        name = "team-machine-choice",
        mixinStandardHelpOptions = true,
        description = "A team's scores on the selected machines, split by who picked the machine."
)
public class TeamMachineChoiceCommand extends ReportCommand {

    @Override
    protected String reportName() {
        return "team-machine-choice";
    }

    @Override
    protected Set<ReportRequirement> requirements() {
        return Set.of(ReportRequirement.TEAM, ReportRequirement.MACHINES);
    }

    @Override
    protected ReportGenerator createGenerator(ReportContext context) {
        return new TeamMachineChoiceReport(context);
    }
}
