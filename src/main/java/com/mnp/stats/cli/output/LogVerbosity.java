package com.mnp.stats.cli.output;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

/**
 * Raises the application loggers to DEBUG for {@code --verbose}.
 */
public final class LogVerbosity {

    static final String ROOT_PACKAGE = "com.mnp.stats";

    private LogVerbosity() {
        // Utility class
    }

    public static void apply(boolean verbose) {
        if (!verbose) {
            return;
        }
        if (LoggerFactory.getLogger(ROOT_PACKAGE) instanceof Logger logger) {
            logger.setLevel(Level.DEBUG);
            logger.debug("Debug logging enabled");
        }
    }
}
