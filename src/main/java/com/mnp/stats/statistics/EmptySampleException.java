package com.mnp.stats.statistics;

/**
 * Raised when a summary statistic is requested for an empty sample.
 */
public class EmptySampleException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EmptySampleException(String statistic) {
        super("Cannot compute " + statistic + " of an empty sample");
    }
}
