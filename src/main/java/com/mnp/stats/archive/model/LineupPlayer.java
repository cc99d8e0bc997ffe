package com.mnp.stats.archive.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LineupPlayer {
    String key;
    String name;
    /** Individual player rating; null when the archive does not carry one. */
    Integer ipr;
}
