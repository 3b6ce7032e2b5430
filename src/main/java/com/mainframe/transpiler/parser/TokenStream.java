package com.mainframe.transpiler.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import com.mainframe.transpiler.lexer.CobolToken;
import com.mainframe.transpiler.lexer.ReservedWords;
import com.mainframe.transpiler.lexer.TokenType;
import com.mainframe.transpiler.lst.CommentNode;

/**
 * Cursor over the significant tokens of a program. Comment tokens are set aside, keyed by the
 * position of the token they precede, and handed to whichever node claims that range.
 */
class TokenStream {
    private final List<CobolToken> tokens = new ArrayList<>();
    private final NavigableMap<Integer, List<CobolToken>> commentsBefore = new TreeMap<>();
    private int pos = 0;

    TokenStream(List<CobolToken> source) {
        List<CobolToken> pending = new ArrayList<>();
        for (CobolToken token : source) {
            if (token.getType() == TokenType.COMMENT) {
                pending.add(token);
                continue;
            }
            if (!pending.isEmpty()) {
                commentsBefore.put(tokens.size(), pending);
                pending = new ArrayList<>();
            }
            tokens.add(token);
        }
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != TokenType.EOF) {
            String fileName = source.isEmpty() ? "" : source.get(0).getFileName();
            tokens.add(new CobolToken(TokenType.EOF, "", fileName, 1, 1, 1));
        }
        if (!pending.isEmpty()) {
            commentsBefore.put(tokens.size() - 1, pending);
        }
    }

    CobolToken peek() {
        return tokens.get(pos);
    }

    CobolToken peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    CobolToken previous() {
        return tokens.get(Math.max(0, pos - 1));
    }

    boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    CobolToken advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }

    int mark() {
        return pos;
    }

    void reset(int mark) {
        pos = mark;
    }

    boolean check(TokenType type) {
        return peek().getType() == type;
    }

    boolean checkWord(String... words) {
        CobolToken token = peek();
        if (token.getType() != TokenType.WORD) return false;
        for (String word : words) {
            if (token.getText().equalsIgnoreCase(word)) return true;
        }
        return false;
    }

    boolean checkWordAt(int ahead, String word) {
        return peek(ahead).isWord(word);
    }

    boolean checkOperator(String op) {
        return peek().isOperator(op);
    }

    /**
     * A user-defined word: a WORD that is not reserved.
     */
    boolean checkIdentifier() {
        return isIdentifier(peek());
    }

    static boolean isIdentifier(CobolToken token) {
        return token.getType() == TokenType.WORD && !ReservedWords.isReserved(token.getText());
    }

    CobolToken expectWord(String word) {
        if (checkWord(word)) {
            return advance();
        }
        throw new ParseException(peek(), word);
    }

    CobolToken expect(TokenType type, String description) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(peek(), description);
    }

    CobolToken expectIdentifier(String description) {
        if (checkIdentifier()) {
            return advance();
        }
        throw new ParseException(peek(), description);
    }

    /**
     * Removes and returns the comments preceding tokens {@code from} (inclusive) to {@code to} (exclusive).
     */
    List<CommentNode> takeComments(int from, int to) {
        List<CommentNode> out = new ArrayList<>();
        Map<Integer, List<CobolToken>> range = commentsBefore.subMap(from, true, to, false);
        for (List<CobolToken> list : range.values()) {
            for (CobolToken token : list) {
                out.add(new CommentNode(token));
            }
        }
        range.clear();
        return out;
    }

    List<CommentNode> takeRemainingComments() {
        return takeComments(0, Integer.MAX_VALUE);
    }
}
