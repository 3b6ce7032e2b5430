package com.mainframe.transpiler.lst;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

@Getter
public class SectionNode extends LstNode {
    private final String name;

    public SectionNode(String name, SourceSpan span, List<? extends LstNode> children) {
        super(LstKind.SECTION, span, children);
        this.name = name;
    }

    public List<ParagraphNode> paragraphs() {
        return childrenOfType(ParagraphNode.class);
    }

    public List<SentenceNode> sentences() {
        return childrenOfType(SentenceNode.class);
    }

    /**
     * Entries of a data division section, or the statements between a procedure section header
     * and its first paragraph.
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
        return visitor.visitSection(this);
    }
}
