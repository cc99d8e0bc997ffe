package com.mnp.stats.alias;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds machines and variations to the alias store.
 *
 * Rules:
 * - a new machine whose key already exists is skipped;
 * - variations are de-duplicated case-insensitively per entry;
 * - a variation with typographic quotes is also added in its ASCII form;
 * - a variation that already resolves to a different machine is rejected
 *   and reported as a conflict, never overwritten.
 */
public class AliasMaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(AliasMaintenanceService.class);

    public MaintenanceResult addMachine(AliasDocument document, MachineEntry entry, boolean dryRun) {
        return apply(document, AliasChangeSet.builder().newMachine(entry).build(), dryRun);
    }

    public MaintenanceResult addVariations(AliasDocument document, String key, List<String> variations,
                                           boolean dryRun) {
        return apply(document, AliasChangeSet.builder().addVariation(key, variations).build(), dryRun);
    }

    public MaintenanceResult apply(AliasDocument document, AliasChangeSet changes, boolean dryRun) {
        MaintenanceResult result = new MaintenanceResult(dryRun);
        Claims claims = new Claims(document.toIndex());
        Map<String, MachineEntry> pendingMachines = new LinkedHashMap<>();

        for (MachineEntry requested : changes.getNewMachines()) {
            String key = requested.getKey();
            if (document.containsKey(key) || pendingMachines.containsKey(key)) {
                log.info("  SKIP: {} already exists", key);
                result.getSkippedMachines().add(key);
                continue;
            }

            Optional<String> owner = claims.ownerOf(key).filter(o -> !o.equals(key));
            if (owner.isPresent()) {
                AliasConflict conflict = new AliasConflict(key, owner.get(), key);
                log.warn("  REJECT: {}", conflict.describe());
                result.getConflicts().add(conflict);
                continue;
            }

            claims.claim(key, key);
            Set<String> seen = new LinkedHashSet<>();
            seen.add(AliasIndex.normalize(key));
            List<String> accepted = new ArrayList<>();
            for (String variation : requested.getVariations()) {
                for (String form : TypographicPunctuation.withAsciiTwin(variation)) {
                    if (acceptVariation(key, form, seen, claims, result)) {
                        accepted.add(form);
                    }
                }
            }

            MachineEntry entry = requested.toBuilder().clearVariations().variations(accepted).build();
            pendingMachines.put(key, entry);
            result.getAddedMachines().add(entry);
            log.info("  ADD:  {} -> {}", key, entry.getDisplayName());
            if (!dryRun) {
                document.putEntry(entry);
            }
        }

        for (Map.Entry<String, List<String>> change : changes.getAddVariations().entrySet()) {
            String key = change.getKey();
            Optional<MachineEntry> existing = document.entry(key)
                    .or(() -> Optional.ofNullable(pendingMachines.get(key)));
            if (existing.isEmpty()) {
                log.warn("  WARN: {} not found in alias store", key);
                result.getUnknownKeys().add(key);
                continue;
            }

            Set<String> seen = new LinkedHashSet<>();
            seen.add(AliasIndex.normalize(key));
            existing.get().getVariations().forEach(v -> seen.add(AliasIndex.normalize(v)));

            int before = result.getAddedVariations().getOrDefault(key, List.of()).size();
            for (String variation : change.getValue()) {
                for (String form : TypographicPunctuation.withAsciiTwin(variation)) {
                    if (acceptVariation(key, form, seen, claims, result)) {
                        result.recordVariation(key, form);
                        if (!dryRun) {
                            document.appendVariation(key, form);
                        }
                    }
                }
            }
            int added = result.getAddedVariations().getOrDefault(key, List.of()).size() - before;
            if (added > 0) {
                log.info("  {}: +{} variations", key, added);
            } else {
                log.info("  {}: all variations already present", key);
            }
        }

        log.info("Summary: {} changes {}made", result.getChangeCount(), dryRun ? "would be " : "");
        return result;
    }

    private boolean acceptVariation(String key, String variation, Set<String> seen, Claims claims,
                                    MaintenanceResult result) {
        String normalized = AliasIndex.normalize(variation);
        if (normalized.isEmpty() || !seen.add(normalized)) {
            return false;
        }
        Optional<String> owner = claims.ownerOf(variation);
        if (owner.isPresent() && !owner.get().equals(key)) {
            AliasConflict conflict = new AliasConflict(variation, owner.get(), key);
            log.warn("  REJECT: {}", conflict.describe());
            result.getConflicts().add(conflict);
            return false;
        }
        claims.claim(variation, key);
        return true;
    }

    /**
     * Case-insensitive ownership of labels: the store as loaded plus what this run added.
     */
    private static final class Claims {
        private final AliasIndex index;
        private final Map<String, String> added = new HashMap<>();

        Claims(AliasIndex index) {
            this.index = index;
        }

        Optional<String> ownerOf(String label) {
            String normalized = AliasIndex.normalize(label);
            String pending = added.get(normalized);
            if (pending != null) {
                return Optional.of(pending);
            }
            return index.lookupNormalized(normalized);
        }

        void claim(String label, String key) {
            added.putIfAbsent(AliasIndex.normalize(label), key);
        }
    }
}
