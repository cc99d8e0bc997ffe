package com.mnp.stats.alias;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One canonical machine from the alias store.
 */
@Value
@Builder(toBuilder = true)
public class MachineEntry {

    @NonNull
    String key;

    String name;

    String manufacturer;

    Integer year;

    /** Alternate spellings in file order. */
    @Singular
    List<String> variations;

    /**
     * Declared name, falling back to the canonical key when none was given.
     */
    public String getDisplayName() {
        return (name == null || name.isBlank()) ? key : name;
    }

    public Optional<String> getManufacturerOptional() {
        return Optional.ofNullable(manufacturer).filter(m -> !m.isBlank());
    }

    public Optional<Integer> getYearOptional() {
        return Optional.ofNullable(year);
    }
}
