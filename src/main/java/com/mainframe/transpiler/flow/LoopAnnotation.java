package com.mainframe.transpiler.flow;

/**
 * Iteration phrase of a PERFORM edge.
 */
public enum LoopAnnotation {
    ONCE,
    TIMES,
    UNTIL,
    VARYING
}
