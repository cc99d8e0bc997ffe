package com.mnp.stats.alias;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.NonNull;

/**
 * Maps raw machine labels from the archive to canonical machine keys.
 *
 * Lookup order: raw label exactly, trimmed label exactly, trimmed label
 * case-insensitively. A label that matches nothing is passed through trimmed,
 * so a report never fails because of an unknown machine.
 */
public class MachineResolver {
    private static final Logger log = LoggerFactory.getLogger(MachineResolver.class);

    private final AliasIndex index;
    private final Set<String> reportedUnknown = new HashSet<>();

    public MachineResolver(@NonNull AliasIndex index) {
        this.index = index;
    }

    public ResolvedMachine resolve(String rawLabel) {
        String cleaned = rawLabel == null ? "" : rawLabel.strip();

        Optional<String> key = index.lookupExact(rawLabel)
                .or(() -> index.lookupExact(cleaned))
                .or(() -> index.lookupNormalized(cleaned));

        if (key.isPresent()) {
            return new ResolvedMachine(key.get(), displayName(key.get()), true);
        }

        if (!cleaned.isEmpty() && reportedUnknown.add(cleaned)) {
            log.debug("No canonical key for machine '{}', using as-is", cleaned);
        }
        return new ResolvedMachine(cleaned, cleaned, false);
    }

    public String resolveKey(String rawLabel) {
        return resolve(rawLabel).getCanonicalKey();
    }

    /**
     * Declared display name for a canonical key, or the key itself.
     */
    public String displayName(String canonicalKey) {
        return index.entry(canonicalKey)
                .map(MachineEntry::getDisplayName)
                .orElse(canonicalKey);
    }

    public AliasIndex getIndex() {
        return index;
    }
}
