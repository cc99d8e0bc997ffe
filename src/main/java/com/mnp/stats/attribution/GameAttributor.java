package com.mnp.stats.attribution;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mnp.stats.archive.RunDiagnostics;
import com.mnp.stats.archive.model.GameRecord;
import com.mnp.stats.archive.model.PlayerSlot;

/**
 * Turns a game record into side-attributed scores.
 *
 * Games that are not done produce nothing. A seated position without a player
 * or score causes the whole game to be skipped and recorded in the diagnostics.
 */
public class GameAttributor {
    private static final Logger log = LoggerFactory.getLogger(GameAttributor.class);

    private final RunDiagnostics diagnostics;

    public GameAttributor(RunDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public Optional<AttributedGame> attribute(int round, GameRecord game) {
        if (!game.isDone()) {
            return Optional.empty();
        }
        if (!RoundAttributor.isValidRound(round)) {
            String reason = "Skipped game on " + game.getMachine() + ": invalid round " + round;
            log.warn(reason);
            diagnostics.skipGame(reason);
            return Optional.empty();
        }

        List<AttributedScore> scores = new ArrayList<>();
        for (int position : RoundAttributor.presentPositions(round).stream().sorted().toList()) {
            Optional<PlayerSlot> slot = game.slot(position).filter(PlayerSlot::isComplete);
            if (slot.isEmpty()) {
                String reason = "Skipped game on " + game.getMachine() + " in round " + round
                        + ": position " + position + " has no player or score";
                log.warn(reason);
                diagnostics.skipGame(reason);
                return Optional.empty();
            }
            PlayerSlot s = slot.get();
            scores.add(new AttributedScore(round, position, s.getPlayerKey(), s.getScore(), s.getPoints(),
                    RoundAttributor.sideOf(round, position)));
        }
        return Optional.of(new AttributedGame(round, game, List.copyOf(scores)));
    }
}
