package com.mnp.stats.alias;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Additions to apply to the alias store in one maintenance run.
 */
@Value
@Builder
public class AliasChangeSet {

    /** New canonical entries, in the order they should be appended. */
    @Singular
    List<MachineEntry> newMachines;

    /** Extra variations per existing canonical key. */
    @Singular
    Map<String, List<String>> addVariations;

    public boolean isEmpty() {
        return newMachines.isEmpty() && addVariations.isEmpty();
    }
}
