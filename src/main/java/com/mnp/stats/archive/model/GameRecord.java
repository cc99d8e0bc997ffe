package com.mnp.stats.archive.model;

import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A single game played on one machine within a round.
 */
@Value
@Builder
public class GameRecord {
    /** Machine label exactly as it appears in the archive. */
    String machine;
    boolean done;

    /** Slots keyed by position 1..4; only positions present in the source are included. */
    @Singular
    Map<Integer, PlayerSlot> slots;

    Double homePoints;
    Double awayPoints;

    public Optional<PlayerSlot> slot(int position) {
        return Optional.ofNullable(slots.get(position));
    }
}
