package com.mainframe.transpiler.lexer;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for COBOL tokenization.
 */
class CobolTokenizerTest {

    private final CobolLineReader reader = new CobolLineReader();

    private TokenizeResult tokenize(String... lines) {
        List<SourceLine> read = reader.read(String.join("\n", lines), "PROG.cbl");
        return new CobolTokenizer(read, reader.contentWidth()).tokenize();
    }

    @Test
    void testPictureStringAfterPic() {
        List<CobolToken> tokens = tokenize("           05 AMOUNT PIC S9(5)V99 COMP-3.").getTokens();

        assertThat(tokens).extracting(CobolToken::getType).containsExactly(
                TokenType.NUMBER, TokenType.WORD, TokenType.WORD, TokenType.PICTURE_STRING,
                TokenType.WORD, TokenType.PERIOD, TokenType.EOF);
        assertThat(tokens.get(3).getText()).isEqualTo("S9(5)V99");
    }

    @Test
    void testPictureIsAndTrailingPeriod() {
        List<CobolToken> tokens = tokenize("           05 NAME PICTURE IS X(10).").getTokens();

        assertThat(tokens.get(4).getType()).isEqualTo(TokenType.PICTURE_STRING);
        assertThat(tokens.get(4).getText()).isEqualTo("X(10)");
        assertThat(tokens.get(5).getType()).isEqualTo(TokenType.PERIOD);
    }

    @Test
    void testStringLiteralWithDoubledQuote() {
        List<CobolToken> tokens = tokenize("           DISPLAY 'IT''S'.").getTokens();

        CobolToken literal = tokens.get(1);
        assertThat(literal.getType()).isEqualTo(TokenType.STRING);
        assertThat(literal.getText()).isEqualTo("IT'S");
        assertThat(literal.getColumn()).isEqualTo(20);
        assertThat(literal.getLine()).isEqualTo(1);
    }

    @Test
    void testContinuedLiteralIsPaddedToMargin() {
        TokenizeResult result = tokenize(
                "       MOVE 'ABC",
                "      -    'DEF' TO X.");

        CobolToken literal = result.getTokens().get(1);
        assertThat(result.getErrors()).isEmpty();
        assertThat(literal.getType()).isEqualTo(TokenType.STRING);
        assertThat(literal.getText()).startsWith("ABC").endsWith("DEF").hasSize(62);
        assertThat(result.getTokens().get(2).isWord("TO")).isTrue();
    }

    @Test
    void testUnterminatedLiteralIsReported() {
        TokenizeResult result = tokenize("           DISPLAY 'OPEN");

        assertThat(result.getErrors()).hasSize(1);
        assertThat(result.getErrors().get(0).getExpected()).containsExactly("closing quote");
    }

    @Test
    void testOperatorsAndNumbers() {
        List<CobolToken> tokens = tokenize("           COMPUTE X = (A + 1.5) ** 2 - -3.").getTokens();

        assertThat(tokens).extracting(CobolToken::getText).containsExactly(
                "COMPUTE", "X", "=", "(", "A", "+", "1.5", ")", "**", "2", "-", "-3", ".", "");
        assertThat(tokens.get(6).getType()).isEqualTo(TokenType.NUMBER);
        assertThat(tokens.get(11).getType()).isEqualTo(TokenType.NUMBER);
    }

    @Test
    void testCommentLinesBecomeCommentTokens() {
        List<CobolToken> tokens = tokenize(
                "      * explains the next line",
                "           STOP RUN.").getTokens();

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.COMMENT);
        assertThat(tokens.get(0).getText()).isEqualTo("explains the next line");
        assertThat(tokens.get(1).isWord("STOP")).isTrue();
    }

    @Test
    void testHexLiteral() {
        List<CobolToken> tokens = tokenize("           MOVE X'4142' TO Y.").getTokens();

        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(1).getText()).isEqualTo("AB");
    }
}
