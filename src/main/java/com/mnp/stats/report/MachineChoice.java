package com.mnp.stats.report;

import lombok.Value;

/**
 * A team's scores on one machine, split by which side picked the machine.
 */
@Value
public class MachineChoice {
    String machineKey;
    String displayName;
    TeamMachineScores teamPicked;
    TeamMachineScores opponentPicked;
}
