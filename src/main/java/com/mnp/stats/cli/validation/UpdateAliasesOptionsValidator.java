package com.mnp.stats.cli.validation;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import com.mnp.stats.cli.exception.OptionsValidationException;
import com.mnp.stats.cli.model.UpdateAliasesOptions;

public class UpdateAliasesOptionsValidator {

    public void validate(UpdateAliasesOptions o) {
        List<String> errors = new ArrayList<>();

        if (o.getVariationsFile() == null || !Files.isRegularFile(o.getVariationsFile())) {
            errors.add("Machine variations file does not exist: " + o.getVariationsFile());
        }
        if (o.getChangesFile() == null || !Files.isRegularFile(o.getChangesFile())) {
            errors.add("Change set file does not exist: " + o.getChangesFile());
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
    }
}
