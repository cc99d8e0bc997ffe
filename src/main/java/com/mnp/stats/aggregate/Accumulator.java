package com.mnp.stats.aggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.mnp.stats.attribution.AttributedScore;
import com.mnp.stats.attribution.Side;

import lombok.Getter;

/**
 * Running totals for one aggregation key. Grows monotonically; never persisted.
 */
@Getter
public class Accumulator {
    private double homePoints;
    private double awayPoints;
    private int games;
    private final List<Long> scores = new ArrayList<>();
    private final List<AttributedScore> entries = new ArrayList<>();
    private final Map<Side, List<Long>> scoresBySide = new EnumMap<>(Side.class);
    private final Map<Integer, List<Long>> scoresByPosition = new TreeMap<>();

    void add(Side side, int position, long score, double points) {
        if (side == Side.HOME) {
            homePoints += points;
        } else {
            awayPoints += points;
        }
        scores.add(score);
        scoresBySide.computeIfAbsent(side, s -> new ArrayList<>()).add(score);
        scoresByPosition.computeIfAbsent(position, p -> new ArrayList<>()).add(score);
    }

    void addEntry(AttributedScore entry) {
        entries.add(entry);
    }

    void addPoints(double home, double away) {
        homePoints += home;
        awayPoints += away;
    }

    void countGame() {
        games++;
    }

    public double getPoints(Side side) {
        return side == Side.HOME ? homePoints : awayPoints;
    }

    public double getTotalPoints() {
        return homePoints + awayPoints;
    }

    public List<Long> getScores(Side side) {
        return Collections.unmodifiableList(scoresBySide.getOrDefault(side, List.of()));
    }

    /**
     * Scores recorded at a player position, in arrival order.
     */
    public List<Long> getScoresAt(int position) {
        return Collections.unmodifiableList(scoresByPosition.getOrDefault(position, List.of()));
    }

    public List<Long> getScores() {
        return Collections.unmodifiableList(scores);
    }

    public List<AttributedScore> getEntries() {
        return Collections.unmodifiableList(entries);
    }
}
