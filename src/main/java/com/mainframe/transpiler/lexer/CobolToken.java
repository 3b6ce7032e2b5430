package com.mainframe.transpiler.lexer;

import java.util.Locale;

import lombok.Value;

/**
 * Represents a token of COBOL program text.
 *
 * {@code text} is the token as written, except for string literals where it holds the literal's
 * value (quotes removed, doubled quotes collapsed, continuation lines spliced).
 */
@Value
public class CobolToken {
    TokenType type;
    String text;
    String fileName;
    int line;
    int column;
    int endColumn;

    public String upper() {
        return text.toUpperCase(Locale.ROOT);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Case-insensitive keyword match on a WORD token.
     */
    public boolean isWord(String word) {
        return type == TokenType.WORD && text.equalsIgnoreCase(word);
    }

    public boolean isOperator(String op) {
        return type == TokenType.OPERATOR && text.equals(op);
    }

    /**
     * Text as it appears in the source, with string literals re-quoted.
     */
    public String sourceText() {
        if (type == TokenType.STRING) {
            return "\"" + text.replace("\"", "\"\"") + "\"";
        }
        return text;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
