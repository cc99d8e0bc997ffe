package com.mnp.stats.alias;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * What an alias maintenance run added, skipped and rejected.
 */
@Getter
public class MaintenanceResult {
    private final boolean dryRun;
    private final List<MachineEntry> addedMachines = new ArrayList<>();
    private final List<String> skippedMachines = new ArrayList<>();
    private final Map<String, List<String>> addedVariations = new LinkedHashMap<>();
    private final List<String> unknownKeys = new ArrayList<>();
    private final List<AliasConflict> conflicts = new ArrayList<>();

    public MaintenanceResult(boolean dryRun) {
        this.dryRun = dryRun;
    }

    void recordVariation(String key, String variation) {
        addedVariations.computeIfAbsent(key, k -> new ArrayList<>()).add(variation);
    }

    public int getChangeCount() {
        int variations = addedVariations.values().stream().mapToInt(List::size).sum();
        return addedMachines.size() + variations;
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
