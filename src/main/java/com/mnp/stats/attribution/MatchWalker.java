package com.mnp.stats.attribution;

import java.util.Collection;
import java.util.function.BiConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mnp.stats.archive.RunDiagnostics;
import com.mnp.stats.archive.model.GameRecord;
import com.mnp.stats.archive.model.MatchRecord;
import com.mnp.stats.archive.model.RoundRecord;

/**
 * Visits the games of the complete matches in a selection.
 *
 * Incomplete matches are ignored. Rounds numbered outside 1..4 are skipped and
 * recorded in the diagnostics.
 */
public class MatchWalker {
    private static final Logger log = LoggerFactory.getLogger(MatchWalker.class);

    /**
     * Receives a finished game together with its match and round.
     */
    @FunctionalInterface
    public interface FinishedGameVisitor {
        void visit(MatchRecord match, RoundRecord round, GameRecord game);
    }

    private final RunDiagnostics diagnostics;
    private final GameAttributor attributor;

    public MatchWalker(RunDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
        this.attributor = new GameAttributor(diagnostics);
    }

    /**
     * Visits every attributable game: done, in a valid round, with every seat holding a player and score.
     *
     * @return the number of complete matches visited
     */
    public int walk(Collection<MatchRecord> matches, BiConsumer<MatchRecord, AttributedGame> visitor) {
        return walkFinished(matches, (match, round, game) ->
                attributor.attribute(round.getNumber(), game).ifPresent(g -> visitor.accept(match, g)));
    }

    /**
     * Visits every done game in a valid round, whether or not its seats are fully scored.
     * Used where only the machine, round or game-level points matter.
     *
     * @return the number of complete matches visited
     */
    public int walkFinished(Collection<MatchRecord> matches, FinishedGameVisitor visitor) {
        int visited = 0;
        for (MatchRecord match : matches) {
            if (!match.isComplete()) {
                continue;
            }
            visited++;
            for (RoundRecord round : match.getRounds()) {
                if (!RoundAttributor.isValidRound(round.getNumber())) {
                    String reason = "Skipped round " + round.getNumber() + " of match " + match.getKey();
                    log.warn(reason);
                    diagnostics.skipRound(reason);
                    continue;
                }
                for (GameRecord game : round.getGames()) {
                    if (game.isDone()) {
                        visitor.visit(match, round, game);
                    }
                }
            }
        }
        log.debug("Visited {} complete matches", visited);
        return visited;
    }
}
