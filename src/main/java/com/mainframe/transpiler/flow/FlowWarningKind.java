package com.mainframe.transpiler.flow;

public enum FlowWarningKind {
    UNREACHABLE_PARAGRAPH,
    INFINITE_LOOP_RISK
}
