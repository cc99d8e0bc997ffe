package com.mnp.stats.report;

import com.mnp.stats.archive.model.LineupPlayer;
import com.mnp.stats.archive.model.MatchRecord;
import com.mnp.stats.archive.model.TeamRecord;
import com.mnp.stats.attribution.AttributedScore;
import com.mnp.stats.attribution.Side;

import lombok.Builder;
import lombok.Value;

/**
 * One attributed score with the match context the reports print next to it.
 */
@Value
@Builder
public class ScoreSample {
    String machineKey;
    long score;
    String playerKey;
    String playerName;
    /** Player rating from the lineup, 0 when unknown. */
    int ipr;
    String teamKey;
    String teamName;
    /** Key of the team on the other side of the match. */
    String opponentKey;
    Side side;
    int round;
    int position;
    String matchKey;
    int week;
    String date;
    String venueKey;
    String venueName;

    public static ScoreSample of(MatchRecord match, AttributedScore attributed, String machineKey) {
        TeamRecord team = match.team(attributed.getSide());
        TeamRecord opponent = match.team(attributed.getSide().opposite());
        LineupPlayer player = match.player(attributed.getPlayerKey()).orElse(null);
        return ScoreSample.builder()
                .machineKey(machineKey)
                .score(attributed.getScore())
                .playerKey(attributed.getPlayerKey())
                .playerName(player != null && player.getName() != null ? player.getName() : attributed.getPlayerKey())
                .ipr(player != null && player.getIpr() != null ? player.getIpr() : 0)
                .teamKey(team != null ? team.getKey() : null)
                .teamName(team != null ? team.getName() : null)
                .opponentKey(opponent != null ? opponent.getKey() : null)
                .side(attributed.getSide())
                .round(attributed.getRound())
                .position(attributed.getPosition())
                .matchKey(match.getKey())
                .week(match.getWeek())
                .date(match.getDate() != null ? match.getDate() : "Unknown")
                .venueKey(match.getVenue() != null ? match.getVenue().getKey() : null)
                .venueName(match.getVenue() != null && match.getVenue().getName() != null
                        ? match.getVenue().getName() : "Unknown")
                .build();
    }

    public String getScoreText() {
        return ReportFormat.score(score);
    }
}
