package com.mnp.stats.cli.command;

import java.util.Set;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mnp.stats.alias.AliasIndex;
import com.mnp.stats.alias.AliasStore;
import com.mnp.stats.alias.AliasStoreException;
import com.mnp.stats.alias.MachineResolver;
import com.mnp.stats.archive.ArchiveLoadException;
import com.mnp.stats.archive.ArchiveLoader;
import com.mnp.stats.archive.MachineCatalog;
import com.mnp.stats.archive.VenueCatalog;
import com.mnp.stats.cli.exception.OptionsValidationException;
import com.mnp.stats.cli.model.CommonOptions;
import com.mnp.stats.cli.model.ReportRequirement;
import com.mnp.stats.cli.model.SelectionOptions;
import com.mnp.stats.cli.model.ValidatedReportOptions;
import com.mnp.stats.cli.output.LogVerbosity;
import com.mnp.stats.cli.output.ReportResultsPrinter;
import com.mnp.stats.cli.validation.ReportOptionsValidator;
import com.mnp.stats.report.ReportContext;
import com.mnp.stats.report.ReportGenerator;
import com.mnp.stats.report.ReportResult;

import picocli.CommandLine.Mixin;

/**
 * Shared flow of the report commands: validate, load the alias store and
 * reference files, run the report, print the outcome.
 *
 * Exit codes: 0 success, 1 load or report failure, 2 invalid options.
 */
public abstract class ReportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReportCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    @Mixin
    private CommonOptions common;

    @Mixin
    private SelectionOptions selection;

    private final ReportOptionsValidator validator = new ReportOptionsValidator();
    private final ReportResultsPrinter printer = new ReportResultsPrinter();

    protected abstract String reportName();

    protected abstract Set<ReportRequirement> requirements();

    protected abstract ReportGenerator createGenerator(ReportContext context);

    @Override
    public Integer call() {
        LogVerbosity.apply(common.isVerbose());

        ValidatedReportOptions validated;
        try {
            validated = validator.validate(common, selection, requirements());
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return EXIT_INVALID_OPTIONS;
        }

        printer.printBanner(reportName(), validated);
        try {
            ReportContext context = createContext(validated);
            ReportResult result = createGenerator(context).generate(validated.getSelection());
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return EXIT_FAILURE;
            }
            printer.printSuccess(result);
            return EXIT_OK;
        } catch (AliasStoreException | ArchiveLoadException e) {
            log.error("{}", e.getMessage(), e.getCause());
            return EXIT_FAILURE;
        }
    }

    static ReportContext createContext(ValidatedReportOptions v) {
        ObjectMapper mapper = new ObjectMapper();
        AliasIndex index = new AliasStore(mapper).loadIndex(v.getVariationsFile());
        return ReportContext.builder()
                .archive(new ArchiveLoader(v.getArchiveDir(), mapper))
                .resolver(new MachineResolver(index))
                .venues(VenueCatalog.load(v.getArchiveDir(), mapper))
                .machineCatalog(MachineCatalog.load(v.getArchiveDir(), mapper))
                .outputDir(v.getOutputDir())
                .build();
    }
}
