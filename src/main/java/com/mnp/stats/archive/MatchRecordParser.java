package com.mnp.stats.archive;

import com.fasterxml.jackson.databind.JsonNode;
import com.mnp.stats.archive.model.GameRecord;
import com.mnp.stats.archive.model.LineupPlayer;
import com.mnp.stats.archive.model.MatchRecord;
import com.mnp.stats.archive.model.PlayerSlot;
import com.mnp.stats.archive.model.RoundRecord;
import com.mnp.stats.archive.model.TeamRecord;
import com.mnp.stats.archive.model.VenueRecord;

/**
 * Maps the JSON tree of one match file onto {@link MatchRecord}.
 *
 * No schema validation: absent fields become nulls, zeros or empty lists,
 * and it is up to the consumers to skip what they cannot use.
 */
public class MatchRecordParser {
    static final int MAX_POSITIONS = 4;

    public MatchRecord parse(JsonNode root, int season) {
        MatchRecord.MatchRecordBuilder builder = MatchRecord.builder()
                .key(text(root, "key"))
                .season(season)
                .week(root.path("week").asInt(0))
                .date(text(root, "date"))
                .state(text(root, "state"))
                .home(parseTeam(root.path("home")))
                .away(parseTeam(root.path("away")))
                .venue(parseVenue(root.path("venue")));

        for (JsonNode round : root.path("rounds")) {
            builder.round(parseRound(round));
        }
        return builder.build();
    }

    TeamRecord parseTeam(JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        TeamRecord.TeamRecordBuilder builder = TeamRecord.builder()
                .key(text(node, "key"))
                .name(text(node, "name"));
        for (JsonNode player : node.path("lineup")) {
            JsonNode ipr = player.path("IPR");
            builder.player(LineupPlayer.builder()
                    .key(text(player, "key"))
                    .name(text(player, "name"))
                    .ipr(ipr.canConvertToInt() ? ipr.asInt() : null)
                    .build());
        }
        return builder.build();
    }

    VenueRecord parseVenue(JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        VenueRecord.VenueRecordBuilder builder = VenueRecord.builder()
                .key(text(node, "key"))
                .name(text(node, "name"));
        for (JsonNode machine : node.path("machines")) {
            if (machine.isTextual()) {
                builder.machine(machine.asText());
            }
        }
        return builder.build();
    }

    RoundRecord parseRound(JsonNode node) {
        RoundRecord.RoundRecordBuilder builder = RoundRecord.builder()
                .number(node.path("n").asInt(0));
        for (JsonNode game : node.path("games")) {
            builder.game(parseGame(game));
        }
        return builder.build();
    }

    GameRecord parseGame(JsonNode node) {
        GameRecord.GameRecordBuilder builder = GameRecord.builder()
                .machine(text(node, "machine"))
                .done(node.path("done").asBoolean(false))
                .homePoints(optionalDouble(node.path("home_points")))
                .awayPoints(optionalDouble(node.path("away_points")));

        for (int position = 1; position <= MAX_POSITIONS; position++) {
            String player = text(node, "player_" + position);
            Long score = optionalLong(node.path("score_" + position));
            if (player == null && score == null) {
                continue;
            }
            Double points = optionalDouble(node.path("points_" + position));
            builder.slot(position, PlayerSlot.builder()
                    .position(position)
                    .playerKey(player)
                    .score(score)
                    .points(points != null ? points : 0.0)
                    .build());
        }
        return builder.build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Long optionalLong(JsonNode node) {
        if (node.isNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Double optionalDouble(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        return null;
    }
}
