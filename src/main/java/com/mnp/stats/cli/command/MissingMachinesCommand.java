package com.mnp.stats.cli.command;

import java.util.Set;

import com.mnp.stats.cli.model.ReportRequirement;
import com.mnp.stats.report.MissingMachinesReport;
import com.mnp.stats.report.ReportContext;
import com.mnp.stats.report.ReportGenerator;

import picocli.CommandLine.Command;

@Command(
        name = "missing-machines",
        mixinStandardHelpOptions = true,
        description = "Machine labels in the archive that the alias store does not resolve."
)
public class MissingMachinesCommand extends ReportCommand {

    @Override
    protected String reportName() {
        return "missing-machines";
    }

    @Override
    protected Set<ReportRequirement> requirements() {
        return Set.of();
    }

    @Override
    protected ReportGenerator createGenerator(ReportContext context) {
        return new MissingMachinesReport(context);
    }
}
