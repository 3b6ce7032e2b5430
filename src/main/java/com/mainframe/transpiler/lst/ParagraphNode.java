package com.mainframe.transpiler.lst;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

@Getter
public class ParagraphNode extends LstNode {
    private final String name;

    /** True for the unnamed paragraph holding statements that precede the first header. */
    private final boolean implicit;

    public ParagraphNode(String name, boolean implicit, SourceSpan span, List<? extends LstNode> children) {
        super(LstKind.PARAGRAPH, span, children);
        this.name = name;
        this.implicit = implicit;
    }

    public List<SentenceNode> sentences() {
        return childrenOfType(SentenceNode.class);
    }

    /**
     * Top-level statements of all sentences, in order.
     */
    public List<StatementNode> statements() {
        List<StatementNode> out = new ArrayList<>(childrenOfType(StatementNode.class));
        for (SentenceNode sentence : sentences()) {
            out.addAll(sentence.statements());
        }
        return out;
    }

    @Override
    public <R> R accept(LstVisitor<R> visitor) {
        return visitor.visitParagraph(this);
    }
}
