package com.mainframe.transpiler.lst;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * Base of the Lossless Semantic Tree. Every token of the program is reachable as a
 * {@link LiteralNode} or {@link CommentNode} leaf, so the original text can be rebuilt.
 */
@Getter
public abstract class LstNode {
    private final LstKind kind;
    private final SourceSpan span;
    private final List<LstNode> children;

    protected LstNode(LstKind kind, SourceSpan span, List<? extends LstNode> children) {
        this.kind = kind;
        this.span = span;
        this.children = List.copyOf(children);
    }

    public abstract <R> R accept(LstVisitor<R> visitor);

    /**
     * Literal leaves in source order.
     */
    public List<LiteralNode> tokens() {
        List<LiteralNode> out = new ArrayList<>();
        collectTokens(this, out);
        return out;
    }

    private static void collectTokens(LstNode node, List<LiteralNode> out) {
        if (node instanceof LiteralNode literal) {
            out.add(literal);
            return;
        }
        for (LstNode child : node.getChildren()) {
            collectTokens(child, out);
        }
    }

    /**
     * Source text rebuilt from the node's tokens, separated by single spaces.
     */
    public String toSourceText() {
        return tokens().stream()
                .map(t -> t.getToken().sourceText())
                .collect(Collectors.joining(" "));
    }

    public <T extends LstNode> List<T> childrenOfType(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (LstNode child : children) {
            if (type.isInstance(child)) {
                out.add(type.cast(child));
            }
        }
        return out;
    }

    public List<ClauseNode> clauses(ClauseRole role) {
        List<ClauseNode> out = new ArrayList<>();
        for (LstNode child : children) {
            if (child instanceof ClauseNode clause && clause.getRole() == role) {
                out.add(clause);
            }
        }
        return out;
    }

    public Optional<ClauseNode> clause(ClauseRole role) {
        for (LstNode child : children) {
            if (child instanceof ClauseNode clause && clause.getRole() == role) {
                return Optional.of(clause);
            }
        }
        return Optional.empty();
    }

    public boolean hasClause(ClauseRole role) {
        return clause(role).isPresent();
    }

    /**
     * Comment nodes directly attached to this node.
     */
    public List<CommentNode> comments() {
        return childrenOfType(CommentNode.class);
    }
}
