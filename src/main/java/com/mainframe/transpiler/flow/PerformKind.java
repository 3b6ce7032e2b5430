package com.mainframe.transpiler.flow;

/**
 * How a transfer of control is structured: an in-line loop, a call of a paragraph range, or a GO TO
 * left to region structuring.
 */
public enum PerformKind {
    INLINE,
    OUT_OF_LINE,
    GOTO
}
