package com.mnp.stats.report;

import lombok.Value;

@Value
public class PickCount {
    String machineKey;
    String displayName;
    int doubles;
    int singles;

    public int getTotal() {
        return doubles + singles;
    }
}
