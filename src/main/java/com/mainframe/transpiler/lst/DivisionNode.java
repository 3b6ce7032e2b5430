package com.mainframe.transpiler.lst;

import java.util.List;

import lombok.Getter;

@Getter
public class DivisionNode extends LstNode {
    private final String name;

    public DivisionNode(String name, SourceSpan span, List<? extends LstNode> children) {
        super(LstKind.DIVISION, span, children);
        this.name = name;
    }

    public List<SectionNode> sections() {
        return childrenOfType(SectionNode.class);
    }

    public List<ParagraphNode> paragraphs() {
        return childrenOfType(ParagraphNode.class);
    }

    @Override
    public <R> R accept(LstVisitor<R> visitor) {
        return visitor.visitDivision(this);
    }
}
