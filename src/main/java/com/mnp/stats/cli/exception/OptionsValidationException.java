package com.mnp.stats.cli.exception;

import java.util.List;

/**
 * Every problem found while checking the command-line options and config file of one run.
 *
 * The message lists the problems one per line, each prefixed with {@code "- "}.
 */
public class OptionsValidationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(describe(errors));
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("At least one validation error is required");
        }
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }

    private static String describe(List<String> errors) {
        StringBuilder message = new StringBuilder("Invalid options (").append(errors.size()).append("):");
        errors.forEach(error -> message.append(System.lineSeparator()).append("- ").append(error));
        return message.toString();
    }
}
