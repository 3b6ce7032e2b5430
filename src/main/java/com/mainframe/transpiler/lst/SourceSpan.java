package com.mainframe.transpiler.lst;

import com.mainframe.transpiler.lexer.CobolToken;

import lombok.Value;

/**
 * Immutable source location of a node: first line and column through last line and column.
 */
@Value
public class SourceSpan {
    String fileName;
    int line;
    int startColumn;
    int endLine;
    int endColumn;

    public static SourceSpan of(CobolToken token) {
        return new SourceSpan(token.getFileName(), token.getLine(), token.getColumn(), token.getLine(), token.getEndColumn());
    }

    public static SourceSpan between(CobolToken first, CobolToken last) {
        return new SourceSpan(first.getFileName(), first.getLine(), first.getColumn(), last.getLine(), last.getEndColumn());
    }

    public static SourceSpan between(SourceSpan first, SourceSpan last) {
        return new SourceSpan(first.getFileName(), first.getLine(), first.getStartColumn(), last.getEndLine(), last.getEndColumn());
    }

    public String location() {
        return fileName + ":" + line;
    }

    @Override
    public String toString() {
        return fileName + ":" + line + ":" + startColumn;
    }
}
