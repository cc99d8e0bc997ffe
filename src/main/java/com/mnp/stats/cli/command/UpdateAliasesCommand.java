package com.mnp.stats.cli.command;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mnp.stats.alias.AliasChangeSet;
import com.mnp.stats.alias.AliasDocument;
import com.mnp.stats.alias.AliasMaintenanceService;
import com.mnp.stats.alias.AliasStore;
import com.mnp.stats.alias.AliasStoreException;
import com.mnp.stats.alias.MaintenanceResult;
import com.mnp.stats.cli.exception.OptionsValidationException;
import com.mnp.stats.cli.model.UpdateAliasesOptions;
import com.mnp.stats.cli.output.LogVerbosity;
import com.mnp.stats.cli.output.ReportResultsPrinter;
import com.mnp.stats.cli.validation.UpdateAliasesOptionsValidator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Adds machines and variations to the alias store from a change set file.
 */
@Command(
        name = "update-aliases",
        mixinStandardHelpOptions = true,
        description = "Adds missing machines and variations to the machine alias store."
)
public class UpdateAliasesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(UpdateAliasesCommand.class);

    @Mixin
    private UpdateAliasesOptions options;

    private final UpdateAliasesOptionsValidator validator = new UpdateAliasesOptionsValidator();
    private final ReportResultsPrinter printer = new ReportResultsPrinter();

    @Override
    public Integer call() {
        LogVerbosity.apply(options.isVerbose());
        try {
            validator.validate(options);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return ReportCommand.EXIT_INVALID_OPTIONS;
        }

        try {
            AliasStore store = new AliasStore();
            AliasDocument document = store.load(options.getVariationsFile());
            AliasChangeSet changes = store.readChangeSet(options.getChangesFile());
            if (changes.isEmpty()) {
                log.info("Change set {} is empty, nothing to do", options.getChangesFile());
                return ReportCommand.EXIT_OK;
            }

            if (options.isDryRun()) {
                log.info("DRY RUN: no changes will be saved");
            }
            MaintenanceResult result = new AliasMaintenanceService().apply(document, changes, options.isDryRun());
            if (!options.isDryRun() && result.getChangeCount() > 0) {
                store.save(document, options.getVariationsFile());
            }
            printer.printMaintenance(result, options.getVariationsFile());
            return ReportCommand.EXIT_OK;
        } catch (AliasStoreException e) {
            log.error("{}", e.getMessage(), e.getCause());
            return ReportCommand.EXIT_FAILURE;
        }
    }
}
