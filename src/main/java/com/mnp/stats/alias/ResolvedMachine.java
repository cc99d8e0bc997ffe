package com.mnp.stats.alias;

import lombok.Value;

/**
 * Outcome of resolving a raw machine label.
 */
@Value
public class ResolvedMachine {
    String canonicalKey;
    String displayName;
    /** False when the label matched nothing and was passed through. */
    boolean known;
}
