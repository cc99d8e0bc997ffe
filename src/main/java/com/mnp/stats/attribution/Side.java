package com.mnp.stats.attribution;

public enum Side {
    HOME,
    AWAY;

    public Side opposite() {
        return this == HOME ? AWAY : HOME;
    }

    public static Side of(boolean home) {
        return home ? HOME : AWAY;
    }
}
