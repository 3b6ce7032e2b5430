package com.mainframe.transpiler.flow;

import java.util.List;

import com.mainframe.transpiler.lst.LstNode;
import com.mainframe.transpiler.lst.SourceSpan;
import com.mainframe.transpiler.lst.StatementNode;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * A paragraph (or section header) of the procedure division with its top-level statements.
 */
@Value
public class FlowNode {
    String name;

    /** 1-based position in source order. */
    int ordinal;

    /** Section this paragraph belongs to; null outside sections. */
    String sectionName;

    boolean sectionHeader;
    boolean implicit;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    LstNode source;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    List<StatementNode> statements;

    public SourceSpan getSpan() {
        return source.getSpan();
    }

    /**
     * The last top-level statement, if any.
     */
    public StatementNode lastStatement() {
        return statements.isEmpty() ? null : statements.get(statements.size() - 1);
    }
}
