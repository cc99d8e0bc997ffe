package com.mnp.stats.report;

import lombok.Value;

/**
 * Aggregation key for per-team, per-machine totals.
 */
@Value
public class TeamMachineKey {
    String teamKey;
    String machineKey;
}
