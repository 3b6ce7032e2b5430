package com.mainframe.transpiler.flow;

public enum RegionShape {
    /** No GO TO: the members are called in order. */
    SEQUENTIAL,

    /** Reducible GO TO graph: a dispatch loop over a control variable. */
    DISPATCH,

    /** A cyclic part with several entries; not lowered. */
    IRREDUCIBLE
}
