package com.mainframe.transpiler.flow;

import com.mainframe.transpiler.lst.StatementNode;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

@Value
public class FlowEdge {
    FlowNode from;
    FlowNode to;
    EdgeKind kind;
    LoopAnnotation annotation;

    /** The PERFORM or GO TO creating the edge; null for fall-through. */
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    StatementNode statement;
}
