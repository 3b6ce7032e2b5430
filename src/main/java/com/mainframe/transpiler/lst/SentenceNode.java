package com.mainframe.transpiler.lst;

import java.util.List;

public class SentenceNode extends LstNode {

    public SentenceNode(SourceSpan span, List<? extends LstNode> children) {
        super(LstKind.SENTENCE, span, children);
    }

    public List<StatementNode> statements() {
        return childrenOfType(StatementNode.class);
    }

    @Override
    public <R> R accept(LstVisitor<R> visitor) {
        return visitor.visitSentence(this);
    }
}
