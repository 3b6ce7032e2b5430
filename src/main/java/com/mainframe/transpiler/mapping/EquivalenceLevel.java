package com.mainframe.transpiler.mapping;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How closely a generated method is believed to reproduce its paragraph, with the confidence a
 * mapping of that level starts from.
 */
@Getter
@RequiredArgsConstructor
public enum EquivalenceLevel {
    /** Translated without any edge case. */
    EXACT(1.0),

    /** Only informational edge cases. */
    HIGH(0.9),

    /** Best-effort translation with an augmentation hint attached. */
    MEDIUM(0.75),

    /** Best-effort translation that augmentation could not help with. */
    LOW(0.5),

    /** Blocked: the method only raises. */
    PARTIAL(0.2);

    private final double confidence;
}
