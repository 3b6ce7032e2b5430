package com.mainframe.transpiler.parser;

import java.util.List;

import com.mainframe.transpiler.lexer.CobolToken;
import com.mainframe.transpiler.lexer.ReservedWords;
import com.mainframe.transpiler.lexer.TokenType;
import com.mainframe.transpiler.lst.ClauseNode;
import com.mainframe.transpiler.lst.ClauseRole;
import com.mainframe.transpiler.lst.LiteralKind;
import com.mainframe.transpiler.lst.LiteralNode;
import com.mainframe.transpiler.lst.LstNode;
import com.mainframe.transpiler.lst.SourceSpan;
import com.mainframe.transpiler.lst.StatementNode;

import lombok.experimental.UtilityClass;

/**
 * Node factories that derive spans from the tokens a node covers.
 */
@UtilityClass
class Nodes {

    static LiteralNode literal(CobolToken token) {
        return new LiteralNode(token, kindOf(token));
    }

    static LiteralNode identifier(CobolToken token) {
        return new LiteralNode(token, LiteralKind.IDENTIFIER);
    }

    static LiteralKind kindOf(CobolToken token) {
        TokenType type = token.getType();
        switch (type) {
            case NUMBER:
                return LiteralKind.NUMERIC;
            case STRING:
                return LiteralKind.STRING;
            case PICTURE_STRING:
                return LiteralKind.PICTURE;
            case OPERATOR:
                return LiteralKind.OPERATOR;
            case WORD:
                if (ReservedWords.isFigurative(token.getText())) {
                    return LiteralKind.FIGURATIVE;
                }
                return ReservedWords.isReserved(token.getText()) ? LiteralKind.KEYWORD : LiteralKind.IDENTIFIER;
            default:
                return LiteralKind.PUNCTUATION;
        }
    }

    static ClauseNode clause(ClauseRole role, String operator, List<? extends LstNode> children) {
        return new ClauseNode(role, operator, spanOf(children), children);
    }

    static ClauseNode clause(ClauseRole role, List<? extends LstNode> children) {
        return clause(role, null, children);
    }

    static StatementNode statement(String verb, List<? extends LstNode> children) {
        return new StatementNode(verb, spanOf(children), children);
    }

    /**
     * Span from the first to the last token below {@code children}.
     */
    static SourceSpan spanOf(List<? extends LstNode> children) {
        SourceSpan first = null;
        SourceSpan last = null;
        for (LstNode child : children) {
            List<LiteralNode> tokens = child instanceof LiteralNode literal ? List.of(literal) : child.tokens();
            if (tokens.isEmpty()) {
                continue;
            }
            if (first == null) {
                first = tokens.get(0).getSpan();
            }
            last = tokens.get(tokens.size() - 1).getSpan();
        }
        if (first == null) {
            // Comment-only node
            if (children.isEmpty()) {
                throw new IllegalArgumentException("Cannot derive a span from an empty node");
            }
            return children.get(0).getSpan();
        }
        return SourceSpan.between(first, last);
    }
}
