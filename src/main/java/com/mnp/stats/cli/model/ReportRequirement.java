package com.mnp.stats.cli.model;

/**
 * Selection fields a report cannot run without.
 */
public enum ReportRequirement {
    VENUE,
    TEAM,
    OPPONENT,
    MACHINES
}
