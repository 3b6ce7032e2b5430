package com.mainframe.transpiler.lst;

import java.util.List;

import com.mainframe.transpiler.lexer.CobolToken;

import lombok.Getter;

@Getter
public class CommentNode extends LstNode {
    private final String text;

    public CommentNode(CobolToken token) {
        super(LstKind.COMMENT, SourceSpan.of(token), List.of());
        this.text = token.getText();
    }

    @Override
    public <R> R accept(LstVisitor<R> visitor) {
        return visitor.visitComment(this);
    }
}
