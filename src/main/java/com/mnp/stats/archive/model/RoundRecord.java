package com.mnp.stats.archive.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class RoundRecord {
    int number;
    @Singular
    List<GameRecord> games;
}
