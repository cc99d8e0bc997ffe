package com.mnp.stats.alias;

import lombok.Value;

/**
 * A variation that is already claimed by a different canonical key.
 */
@Value
public class AliasConflict {
    String variation;
    String existingKey;
    String rejectedKey;

    public String describe() {
        return "'" + variation + "' already resolves to " + existingKey + ", not added to " + rejectedKey;
    }
}
