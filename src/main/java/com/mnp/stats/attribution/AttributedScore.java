package com.mnp.stats.attribution;

import lombok.Value;

/**
 * A score of a completed game with the side it counts for.
 */
@Value
public class AttributedScore {
    int round;
    int position;
    String playerKey;
    long score;
    double points;
    Side side;
}
