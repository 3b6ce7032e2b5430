package com.mainframe.transpiler.lexer;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.diagnostics.SyntaxError;

/**
 * Tokenizer for COBOL program text, working on lines already split into reference-format areas.
 *
 * Comment and debug lines become COMMENT tokens so the parser can keep them in the tree. A string
 * literal left open at the right margin resumes after the first quote of the next continuation line.
 */
public class CobolTokenizer {
    private static final Logger log = LoggerFactory.getLogger(CobolTokenizer.class);

    private final List<SourceLine> lines;
    private final int contentWidth;

    private final List<CobolToken> tokens = new ArrayList<>();
    private final List<SyntaxError> errors = new ArrayList<>();

    private int lineIndex;
    private SourceLine current;
    private String content;
    private int pos;
    private boolean expectPicture;

    /**
     * @param contentWidth width of the fixed-format text area, used to pad a literal that continues
     *                     on the next line; 0 in free format
     */
    public CobolTokenizer(List<SourceLine> lines, int contentWidth) {
        this.lines = lines;
        this.contentWidth = contentWidth;
    }

    /**
     * Tokenize all lines.
     */
    public TokenizeResult tokenize() {
        for (lineIndex = 0; lineIndex < lines.size(); lineIndex++) {
            SourceLine line = lines.get(lineIndex);
            switch (line.getKind()) {
                case BLANK:
                    break;
                case COMMENT:
                case DEBUG:
                    tokens.add(new CobolToken(TokenType.COMMENT, line.getContent().strip(), line.getFileName(),
                            line.getNumber(), line.getContentColumn(), line.getContentColumn() + line.getContent().length()));
                    break;
                default:
                    scanLine(line);
            }
        }

        SourceLine last = lines.isEmpty() ? null : lines.get(lines.size() - 1);
        String fileName = last == null ? "" : last.getFileName();
        int lineNo = last == null ? 1 : last.getNumber() + 1;
        tokens.add(new CobolToken(TokenType.EOF, "", fileName, lineNo, 1, 1));

        log.debug("Tokenized {} lines into {} tokens", lines.size(), tokens.size());
        return new TokenizeResult(List.copyOf(tokens), List.copyOf(errors));
    }

    private void scanLine(SourceLine line) {
        current = line;
        content = line.getContent();
        pos = 0;

        while (pos < content.length()) {
            char c = content.charAt(pos);

            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }

            // Separator comma / semicolon
            if ((c == ',' || c == ';') && !expectPicture) {
                pos++;
                continue;
            }

            if (c == '*' && peekChar(1) == '>') {
                String text = content.substring(pos + 2).strip();
                add(TokenType.COMMENT, text, pos, content.length());
                pos = content.length();
                continue;
            }

            if (expectPicture && !startsWord("IS")) {
                readPicture();
                continue;
            }

            if (c == '"' || c == '\'') {
                readString(c, false);
                continue;
            }

            if ((c == 'X' || c == 'x') && (peekChar(1) == '"' || peekChar(1) == '\'')) {
                pos++;
                readString(content.charAt(pos), true);
                continue;
            }

            if (c == '.') {
                if (Character.isDigit(peekChar(1)) && (pos == 0 || Character.isWhitespace(content.charAt(pos - 1)))) {
                    readNumberOrWord();
                } else {
                    add(TokenType.PERIOD, ".", pos, pos + 1);
                    pos++;
                }
                continue;
            }

            if (c == '(') {
                add(TokenType.LPAREN, "(", pos, pos + 1);
                pos++;
                continue;
            }
            if (c == ')') {
                add(TokenType.RPAREN, ")", pos, pos + 1);
                pos++;
                continue;
            }

            if ((c == '+' || c == '-') && (Character.isDigit(peekChar(1)) || peekChar(1) == '.') && !previousIsOperand()) {
                readNumberOrWord();
                continue;
            }

            if (Character.isLetterOrDigit(c)) {
                readNumberOrWord();
                continue;
            }

            if (readOperator()) {
                continue;
            }

            add(TokenType.UNKNOWN, String.valueOf(c), pos, pos + 1);
            log.debug("Unknown character '{}' at {}:{}", c, current.getNumber(), column(pos));
            pos++;
        }
    }

    private boolean readOperator() {
        char c = content.charAt(pos);
        char next = peekChar(1);
        String op;
        if (c == '*' && next == '*') {
            op = "**";
        } else if ((c == '>' || c == '<') && next == '=') {
            op = c + "=";
        } else if (c == '<' && next == '>') {
            op = "<>";
        } else if ("+-*/=<>:&".indexOf(c) >= 0) {
            op = String.valueOf(c);
        } else {
            return false;
        }
        add(TokenType.OPERATOR, op, pos, pos + op.length());
        pos += op.length();
        return true;
    }

    private void readNumberOrWord() {
        int start = pos;
        StringBuilder sb = new StringBuilder();

        char first = content.charAt(pos);
        if (first == '+' || first == '-') {
            sb.append(first);
            pos++;
        }

        while (pos < content.length()) {
            char c = content.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '-' || c == '_') {
                sb.append(c);
                pos++;
            } else {
                break;
            }
        }

        String text = sb.toString();
        String digits = text.startsWith("+") || text.startsWith("-") ? text.substring(1) : text;
        boolean numeric = digits.isEmpty() || digits.chars().allMatch(Character::isDigit);

        if (numeric && pos < content.length() && content.charAt(pos) == '.' && Character.isDigit(peekChar(1))) {
            sb.append('.');
            pos++;
            while (pos < content.length() && Character.isDigit(content.charAt(pos))) {
                sb.append(content.charAt(pos));
                pos++;
            }
            text = sb.toString();
        }

        TokenType type = numeric ? TokenType.NUMBER : TokenType.WORD;
        add(type, text, start, pos);

        boolean pictureKeyword = type == TokenType.WORD && (text.equalsIgnoreCase("PIC") || text.equalsIgnoreCase("PICTURE"));
        boolean optionalIs = expectPicture && type == TokenType.WORD && text.equalsIgnoreCase("IS");
        expectPicture = pictureKeyword || optionalIs;
    }

    private void readPicture() {
        int start = pos;
        while (pos < content.length() && !Character.isWhitespace(content.charAt(pos))) {
            pos++;
        }
        int end = pos;
        // A trailing period or comma followed by a separator ends the entry, not the picture.
        if (end - start > 1 && (content.charAt(end - 1) == '.' || content.charAt(end - 1) == ',')) {
            end--;
        }
        expectPicture = false;
        add(TokenType.PICTURE_STRING, content.substring(start, end), start, end);
        if (end < pos) {
            if (content.charAt(end) == '.') {
                add(TokenType.PERIOD, ".", end, end + 1);
            }
        }
    }

    private void readString(char quote, boolean hex) {
        int start = hex ? pos - 1 : pos;
        SourceLine startLine = current;
        StringBuilder sb = new StringBuilder();
        pos++; // Skip opening quote

        while (true) {
            if (pos >= content.length()) {
                if (!continueLiteral(sb)) {
                    errors.add(new SyntaxError(current.getFileName(), current.getNumber(), column(pos),
                            List.of("closing quote"), "end of line", null));
                    log.warn("Unterminated literal at {}:{}", current.getFileName(), current.getNumber());
                    break;
                }
                continue;
            }

            char c = content.charAt(pos);
            if (c == quote) {
                pos++;
                // Check for escaped quote (doubled)
                if (pos < content.length() && content.charAt(pos) == quote) {
                    sb.append(quote);
                    pos++;
                } else {
                    break;
                }
            } else {
                sb.append(c);
                pos++;
            }
        }

        String value = hex ? decodeHex(sb.toString(), startLine) : sb.toString();
        int startColumn = startLine.getContentColumn() + start;
        int endColumn = startLine == current ? column(pos) : startLine.getContentColumn() + startLine.getContent().length();
        tokens.add(new CobolToken(TokenType.STRING, value, startLine.getFileName(), startLine.getNumber(),
                startColumn, endColumn));
    }

    /**
     * Moves to the continuation line of an open literal, padding the literal to the right margin.
     */
    private boolean continueLiteral(StringBuilder sb) {
        int next = lineIndex + 1;
        while (next < lines.size() && (lines.get(next).getKind() == LineKind.BLANK)) {
            next++;
        }
        if (next >= lines.size() || lines.get(next).getKind() != LineKind.CONTINUATION) {
            return false;
        }

        for (int i = content.length(); i < contentWidth; i++) {
            sb.append(' ');
        }

        lineIndex = next;
        current = lines.get(next);
        content = current.getContent();
        pos = 0;
        while (pos < content.length() && Character.isWhitespace(content.charAt(pos))) {
            pos++;
        }
        if (pos < content.length() && (content.charAt(pos) == '"' || content.charAt(pos) == '\'')) {
            pos++;
        }
        return true;
    }

    private String decodeHex(String hex, SourceLine line) {
        if (hex.length() % 2 != 0 || !hex.chars().allMatch(ch -> Character.digit(ch, 16) >= 0)) {
            errors.add(new SyntaxError(line.getFileName(), line.getNumber(), line.getContentColumn(),
                    List.of("hexadecimal digits"), hex, null));
            return hex;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < hex.length(); i += 2) {
            sb.append((char) Integer.parseInt(hex.substring(i, i + 2), 16));
        }
        return sb.toString();
    }

    private boolean previousIsOperand() {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            CobolToken t = tokens.get(i);
            if (t.getType() == TokenType.COMMENT) {
                continue;
            }
            switch (t.getType()) {
                case NUMBER:
                case STRING:
                case RPAREN:
                    return true;
                case WORD:
                    return !ReservedWords.isReserved(t.getText()) || ReservedWords.isFigurative(t.getText());
                default:
                    return false;
            }
        }
        return false;
    }

    private boolean startsWord(String word) {
        int end = pos + word.length();
        return content.regionMatches(true, pos, word, 0, word.length())
                && (end == content.length() || Character.isWhitespace(content.charAt(end)));
    }

    private char peekChar(int offset) {
        int index = pos + offset;
        return index < content.length() ? content.charAt(index) : '\0';
    }

    private int column(int index) {
        return current.getContentColumn() + index;
    }

    private void add(TokenType type, String text, int start, int end) {
        tokens.add(new CobolToken(type, text, current.getFileName(), current.getNumber(), column(start), column(end)));
    }
}
