package com.mnp.stats.cli.command;

import java.util.Set;

import com.mnp.stats.cli.model.ReportRequirement;
import com.mnp.stats.report.TeamVenuePerformanceReport;
import com.mnp.stats.report.ReportContext;
import com.mnp.stats.report.ReportGenerator;

import picocli.CommandLine.Command;

@Command(
        name = "team-venue-performance",
        mixinStandardHelpOptions = true,
        description = "A team's points, POPS and median score per machine at a venue."
)
public class TeamVenuePerformanceCommand extends ReportCommand {

    @Override
    protected String reportName() {
        return "team-venue-performance";
    }

    @Override
    protected Set<ReportRequirement> requirements() {
        return Set.of(ReportRequirement.TEAM, ReportRequirement.VENUE);
    }

    @Override
    protected ReportGenerator createGenerator(ReportContext context) {
        return new TeamVenuePerformanceReport(context);
    }
}
