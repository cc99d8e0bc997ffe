package com.mnp.stats.archive.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class TeamRecord {
    String key;
    String name;
    @Singular("player")
    List<LineupPlayer> lineup;

    public Optional<LineupPlayer> player(String playerKey) {
        return lineup.stream().filter(p -> playerKey != null && playerKey.equals(p.getKey())).findFirst();
    }
}
