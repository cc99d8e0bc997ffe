package com.mnp.stats.archive;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Diagnostics (skipped records, warnings, info) accumulated during one report run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class RunDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();
    private int skippedGames;
    private int skippedRounds;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void skipGame(String reason) {
        skippedGames++;
        warnings.add(reason);
    }

    public void skipRound(String reason) {
        skippedRounds++;
        warnings.add(reason);
    }
}
