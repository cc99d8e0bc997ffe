package com.mnp.stats.archive.model;

import java.util.List;
import java.util.Optional;

import com.mnp.stats.attribution.Side;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One league match as read from {@code season-N/matches/*.json}.
 */
@Value
@Builder
public class MatchRecord {
    public static final String STATE_COMPLETE = "complete";

    String key;
    int season;
    int week;
    String date;
    TeamRecord home;
    TeamRecord away;
    VenueRecord venue;
    String state;
    @Singular
    List<RoundRecord> rounds;

    public boolean isComplete() {
        return STATE_COMPLETE.equals(state);
    }

    public TeamRecord team(Side side) {
        return side == Side.HOME ? home : away;
    }

    /**
     * The side the given team plays on in this match, if it played at all.
     */
    public Optional<Side> sideOf(String teamKey) {
        if (home != null && teamKey.equals(home.getKey())) {
            return Optional.of(Side.HOME);
        }
        if (away != null && teamKey.equals(away.getKey())) {
            return Optional.of(Side.AWAY);
        }
        return Optional.empty();
    }

    /**
     * Looks a player up in either lineup.
     */
    public Optional<LineupPlayer> player(String playerKey) {
        return Optional.ofNullable(home).flatMap(t -> t.player(playerKey))
                .or(() -> Optional.ofNullable(away).flatMap(t -> t.player(playerKey)));
    }
}
