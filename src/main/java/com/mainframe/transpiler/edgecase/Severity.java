package com.mainframe.transpiler.edgecase;

/**
 * How an edge case affects translation of its paragraph.
 */
public enum Severity {
    /** Lowered normally; reported only. */
    INFORMATIONAL,

    /** Lowered best effort; the IR node carries the edge case id and augmentation is requested. */
    NEEDS_AUGMENTATION,

    /** The enclosing paragraph is not lowered and the program fails. */
    BLOCKING
}
