package com.mnp.stats.cli.command;

import java.util.Set;

import com.mnp.stats.cli.model.ReportRequirement;
import com.mnp.stats.report.ReportContext;
import com.mnp.stats.report.ReportGenerator;
import com.mnp.stats.report.VenueSummaryReport;

import picocli.CommandLine.Command;

@Command(
        name = "venue-summary",
        mixinStandardHelpOptions = true,
        description = "Overview, home and away picks and per-machine score statistics for a venue."
)
public class VenueSummaryCommand extends ReportCommand {

    @Override
    protected String reportName() {
        return "venue-summary";
    }

    @Override
    protected Set<ReportRequirement> requirements() {
        return Set.of(ReportRequirement.VENUE);
    }

    @Override
    protected ReportGenerator createGenerator(ReportContext context) {
        return new VenueSummaryReport(context);
    }
}
