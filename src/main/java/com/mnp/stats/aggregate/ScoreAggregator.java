package com.mnp.stats.aggregate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.mnp.stats.attribution.AttributedScore;
import com.mnp.stats.attribution.Side;

/**
 * Key-scoped accumulators. Keys are kept in first-seen order and never share state.
 *
 * Accumulating the same record twice counts it twice.
 *
 * @param <K> aggregation key, typically a canonical machine key or a (team, machine) pair
 */
public class ScoreAggregator<K> {
    private final Map<K, Accumulator> accumulators = new LinkedHashMap<>();

    /**
     * Adds {@code points} to the side's total and appends {@code score} to the key's
     * score list and to its per-position list.
     */
    public void accumulate(K key, int position, long score, double points, Side side) {
        accumulatorFor(key).add(side, position, score, points);
    }

    public void accumulate(K key, AttributedScore attributed) {
        Accumulator accumulator = accumulatorFor(key);
        accumulator.add(attributed.getSide(), attributed.getPosition(), attributed.getScore(),
                attributed.getPoints());
        accumulator.addEntry(attributed);
    }

    /**
     * Folds game-level point totals without touching the score lists.
     */
    public void accumulateGamePoints(K key, double homePoints, double awayPoints) {
        accumulatorFor(key).addPoints(homePoints, awayPoints);
    }

    public void countGame(K key) {
        accumulatorFor(key).countGame();
    }

    public Optional<Accumulator> get(K key) {
        return Optional.ofNullable(accumulators.get(key));
    }

    public Map<K, Accumulator> asMap() {
        return Collections.unmodifiableMap(accumulators);
    }

    public boolean isEmpty() {
        return accumulators.isEmpty();
    }

    private Accumulator accumulatorFor(K key) {
        return accumulators.computeIfAbsent(key, k -> new Accumulator());
    }
}
