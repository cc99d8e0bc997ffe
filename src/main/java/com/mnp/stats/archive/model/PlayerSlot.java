package com.mnp.stats.archive.model;

import lombok.Builder;
import lombok.Value;

/**
 * One player position within a game. Player and score may be absent in the source data.
 */
@Value
@Builder
public class PlayerSlot {
    int position;
    String playerKey;
    Long score;
    double points;

    public boolean isComplete() {
        return playerKey != null && !playerKey.isBlank() && score != null;
    }
}
