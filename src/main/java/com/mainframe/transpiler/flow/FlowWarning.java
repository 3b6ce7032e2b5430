package com.mainframe.transpiler.flow;

import com.mainframe.transpiler.lst.SourceSpan;

import lombok.Value;

@Value
public class FlowWarning {
    FlowWarningKind kind;
    String paragraph;
    String message;
    SourceSpan span;
}
