package com.mainframe.transpiler.lst;

import java.util.List;

import com.mainframe.transpiler.lexer.CobolToken;

import lombok.Getter;

/**
 * A single source token.
 */
@Getter
public class LiteralNode extends LstNode {
    private final CobolToken token;
    private final LiteralKind literalKind;

    public LiteralNode(CobolToken token, LiteralKind literalKind) {
        super(LstKind.LITERAL, SourceSpan.of(token), List.of());
        this.token = token;
        this.literalKind = literalKind;
    }

    public String text() {
        return token.getText();
    }

    public String upper() {
        return token.upper();
    }

    @Override
    public <R> R accept(LstVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return literalKind + "(" + token.getText() + ")";
    }
}
