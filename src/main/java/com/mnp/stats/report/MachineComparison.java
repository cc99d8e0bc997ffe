package com.mnp.stats.report;

import lombok.Value;

@Value
public class MachineComparison {
    String machineKey;
    String displayName;
    TeamMachineScores first;
    TeamMachineScores second;
}
