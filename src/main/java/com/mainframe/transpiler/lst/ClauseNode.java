package com.mainframe.transpiler.lst;

import java.util.List;

import lombok.Getter;

/**
 * A named part of a statement or expression. Expression clauses also carry their operator.
 */
@Getter
public class ClauseNode extends LstNode {
    private final ClauseRole role;
    private final String operator;

    public ClauseNode(ClauseRole role, String operator, SourceSpan span, List<? extends LstNode> children) {
        super(LstKind.CLAUSE, span, children);
        this.role = role;
        this.operator = operator;
    }

    public ClauseNode(ClauseRole role, SourceSpan span, List<? extends LstNode> children) {
        this(role, null, span, children);
    }

    /**
     * Non-literal child nodes: sub-clauses and nested statements.
     */
    public List<LstNode> operands() {
        return getChildren().stream()
                .filter(c -> !(c instanceof LiteralNode) && !(c instanceof CommentNode))
                .toList();
    }

    public List<ClauseNode> subClauses() {
        return childrenOfType(ClauseNode.class);
    }

    public List<LiteralNode> literals() {
        return childrenOfType(LiteralNode.class);
    }

    @Override
    public <R> R accept(LstVisitor<R> visitor) {
        return visitor.visitClause(this);
    }

    @Override
    public String toString() {
        return role + (operator != null ? "(" + operator + ")" : "") + "[" + toSourceText() + "]";
    }
}
