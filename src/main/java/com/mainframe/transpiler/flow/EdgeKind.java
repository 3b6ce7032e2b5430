package com.mainframe.transpiler.flow;

public enum EdgeKind {
    PERFORM,
    FALL_THROUGH,
    GOTO
}
