package com.mnp.stats.cli.command;

import java.util.Set;

import com.mnp.stats.cli.model.ReportRequirement;
import com.mnp.stats.report.HomeAdvantageReport;
import com.mnp.stats.report.ReportContext;
import com.mnp.stats.report.ReportGenerator;

import picocli.CommandLine.Command;

@Command(
        name = "home-advantage",
        mixinStandardHelpOptions = true,
        description = "Home vs away points per machine at a venue."
)
public class HomeAdvantageCommand extends ReportCommand {

    @Override
    protected String reportName() {
        return "home-advantage";
    }

    @Override
    protected Set<ReportRequirement> requirements() {
        return Set.of(ReportRequirement.VENUE);
    }

    @Override
    protected ReportGenerator createGenerator(ReportContext context) {
        return new HomeAdvantageReport(context);
    }
}
