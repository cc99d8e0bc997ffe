package com.mnp.stats.archive.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class VenueRecord {
    String key;
    String name;
    /** Machines listed for the venue in the match file, possibly empty. */
    @Singular
    List<String> machines;
}
