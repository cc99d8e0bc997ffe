package com.mnp.stats.attribution;

/**
 * Doubles rounds seat four players, singles rounds two.
 */
public enum RoundMode {
    DOUBLES(4),
    SINGLES(2);

    private final int playerCount;

    RoundMode(int playerCount) {
        this.playerCount = playerCount;
    }

    public int getPlayerCount() {
        return playerCount;
    }
}
