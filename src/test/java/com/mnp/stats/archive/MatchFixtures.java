package com.mnp.stats.archive;

import com.mnp.stats.archive.model.GameRecord;
import com.mnp.stats.archive.model.LineupPlayer;
import com.mnp.stats.archive.model.MatchRecord;
import com.mnp.stats.archive.model.PlayerSlot;
import com.mnp.stats.archive.model.RoundRecord;
import com.mnp.stats.archive.model.TeamRecord;
import com.mnp.stats.archive.model.VenueRecord;

import java.util.List;

/**
 * Builders for in-memory match records used across the unit tests.
 */
public final class MatchFixtures {

    private MatchFixtures() {
        // Utility class
    }

    public static MatchRecord match(String key, TeamRecord home, TeamRecord away, String venueKey,
                                    RoundRecord... rounds) {
        return MatchRecord.builder()
                .key(key)
                .season(22)
                .week(1)
                .date("2025-01-15")
                .state(MatchRecord.STATE_COMPLETE)
                .home(home)
                .away(away)
                .venue(VenueRecord.builder().key(venueKey).name(venueKey + " Arcade").build())
                .rounds(List.of(rounds))
                .build();
    }

    public static MatchRecord incomplete(MatchRecord match) {
        return MatchRecord.builder()
                .key(match.getKey())
                .season(match.getSeason())
                .week(match.getWeek())
                .date(match.getDate())
                .state("playing")
                .home(match.getHome())
                .away(match.getAway())
                .venue(match.getVenue())
                .rounds(match.getRounds())
                .build();
    }

    public static TeamRecord team(String key, LineupPlayer... players) {
        return TeamRecord.builder()
                .key(key)
                .name(key + " Team")
                .lineup(List.of(players))
                .build();
    }

    public static LineupPlayer player(String key, Integer ipr) {
        return LineupPlayer.builder().key(key).name("Player " + key).ipr(ipr).build();
    }

    public static RoundRecord round(int number, GameRecord... games) {
        return RoundRecord.builder().number(number).games(List.of(games)).build();
    }

    public static GameRecord game(String machine, PlayerSlot... slots) {
        GameRecord.GameRecordBuilder builder = GameRecord.builder().machine(machine).done(true);
        for (PlayerSlot slot : slots) {
            builder.slot(slot.getPosition(), slot);
        }
        return builder.build();
    }

    public static GameRecord game(String machine, Double homePoints, Double awayPoints, PlayerSlot... slots) {
        GameRecord.GameRecordBuilder builder = GameRecord.builder()
                .machine(machine)
                .done(true)
                .homePoints(homePoints)
                .awayPoints(awayPoints);
        for (PlayerSlot slot : slots) {
            builder.slot(slot.getPosition(), slot);
        }
        return builder.build();
    }

    public static PlayerSlot slot(int position, String player, Long score, double points) {
        return PlayerSlot.builder()
                .position(position)
                .playerKey(player)
                .score(score)
                .points(points)
                .build();
    }
}
