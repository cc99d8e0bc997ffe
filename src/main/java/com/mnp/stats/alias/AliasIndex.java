package com.mnp.stats.alias;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable lookup from machine label to canonical key.
 *
 * Two maps are kept: one keyed by the exact variation text (so case-sensitive
 * abbreviations keep their meaning) and one keyed by the trimmed, lower-cased
 * text. Canonical keys are registered first and map to themselves. When two
 * entries claim the same label the first one in file order keeps it and the
 * collision is recorded in {@link #getConflicts()}.
 */
public final class AliasIndex {
    private static final Logger log = LoggerFactory.getLogger(AliasIndex.class);

    private final Map<String, MachineEntry> entriesByKey;
    private final Map<String, String> exact;
    private final Map<String, String> normalized;
    private final List<AliasConflict> conflicts;

    private AliasIndex(Map<String, MachineEntry> entriesByKey, Map<String, String> exact,
                       Map<String, String> normalized, List<AliasConflict> conflicts) {
        this.entriesByKey = Collections.unmodifiableMap(entriesByKey);
        this.exact = Collections.unmodifiableMap(exact);
        this.normalized = Collections.unmodifiableMap(normalized);
        this.conflicts = List.copyOf(conflicts);
    }

    public static AliasIndex empty() {
        return build(List.of());
    }

    public static AliasIndex build(Collection<MachineEntry> entries) {
        Map<String, MachineEntry> byKey = new LinkedHashMap<>();
        Map<String, String> exact = new HashMap<>();
        Map<String, String> normalized = new HashMap<>();
        List<AliasConflict> conflicts = new ArrayList<>();

        for (MachineEntry entry : entries) {
            if (byKey.putIfAbsent(entry.getKey(), entry) != null) {
                log.warn("Duplicate canonical key '{}' ignored", entry.getKey());
                continue;
            }
            register(exact, entry.getKey(), entry.getKey(), conflicts);
            register(normalized, normalize(entry.getKey()), entry.getKey(), conflicts);
        }

        for (MachineEntry entry : byKey.values()) {
            for (String variation : entry.getVariations()) {
                if (variation == null) {
                    continue;
                }
                register(exact, variation, entry.getKey(), conflicts);
                register(exact, variation.strip(), entry.getKey(), conflicts);
                register(normalized, normalize(variation), entry.getKey(), conflicts);
            }
        }

        for (AliasConflict conflict : conflicts) {
            log.warn("Alias conflict: {}", conflict.describe());
        }
        log.debug("Built alias index: {} machines, {} exact labels, {} normalized labels",
                byKey.size(), exact.size(), normalized.size());

        return new AliasIndex(byKey, exact, normalized, conflicts);
    }

    /**
     * Trimmed, locale-independent lower-case form used for case-insensitive lookups.
     */
    public static String normalize(String label) {
        if (label == null) return "";
        return label.strip().toLowerCase(Locale.ROOT);
    }

    public Optional<String> lookupExact(String label) {
        if (label == null) return Optional.empty();
        return Optional.ofNullable(exact.get(label));
    }

    public Optional<String> lookupNormalized(String label) {
        if (label == null) return Optional.empty();
        return Optional.ofNullable(normalized.get(normalize(label)));
    }

    public Optional<MachineEntry> entry(String canonicalKey) {
        return Optional.ofNullable(entriesByKey.get(canonicalKey));
    }

    public boolean containsKey(String canonicalKey) {
        return entriesByKey.containsKey(canonicalKey);
    }

    /** Entries in store order. */
    public Collection<MachineEntry> entries() {
        return entriesByKey.values();
    }

    public int size() {
        return entriesByKey.size();
    }

    public List<AliasConflict> getConflicts() {
        return conflicts;
    }

    private static void register(Map<String, String> map, String label, String key, List<AliasConflict> conflicts) {
        if (label.isEmpty()) {
            return;
        }
        String existing = map.putIfAbsent(label, key);
        if (existing != null && !existing.equals(key)) {
            AliasConflict conflict = new AliasConflict(label, existing, key);
            if (!conflicts.contains(conflict)) {
                conflicts.add(conflict);
            }
        }
    }
}
