package com.mainframe.transpiler.flow;

import com.mainframe.transpiler.lst.StatementNode;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * Classification of one PERFORM or GO TO statement.
 */
@Value
public class PerformSite {
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    StatementNode statement;

    String paragraph;
    PerformKind kind;
    LoopAnnotation annotation;

    /** Region performed; null for in-line performs and GO TO. */
    Region region;
}
