package com.mnp.stats.attribution;

import java.util.List;

import com.mnp.stats.archive.model.GameRecord;

import lombok.Value;

@Value
public class AttributedGame {
    int round;
    GameRecord game;
    List<AttributedScore> scores;

    public List<AttributedScore> scoresFor(Side side) {
        return scores.stream().filter(s -> s.getSide() == side).toList();
    }

    public double pointsFor(Side side) {
        return scoresFor(side).stream().mapToDouble(AttributedScore::getPoints).sum();
    }
}
