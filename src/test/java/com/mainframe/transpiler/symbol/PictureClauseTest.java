package com.mainframe.transpiler.symbol;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PictureClause parsing and categorization.
 */
class PictureClauseTest {

    @Test
    void testParseAlphanumericSimple() {
        PictureClause pic = PictureClause.parse("X(10)");

        assertThat(pic.getCategory()).isEqualTo(PictureCategory.ALPHANUMERIC);
        assertThat(pic.isNumeric()).isFalse();
        assertThat(pic.getLength()).isEqualTo(10);
    }

    @Test
    void testParseAlphabetic() {
        PictureClause pic = PictureClause.parse("A(4)");

        assertThat(pic.getCategory()).isEqualTo(PictureCategory.ALPHABETIC);
        assertThat(pic.getLength()).isEqualTo(4);
    }

    @Test
    void testParseNumericInteger() {
        PictureClause pic = PictureClause.parse("9(5)");

        assertThat(pic.isNumeric()).isTrue();
        assertThat(pic.getIntegerDigits()).isEqualTo(5);
        assertThat(pic.getFractionDigits()).isEqualTo(0);
        assertThat(pic.isSigned()).isFalse();
    }

    @Test
    void testParseSignedDecimal() {
        PictureClause pic = PictureClause.parse("S9(9)V99");

        assertThat(pic.isNumeric()).isTrue();
        assertThat(pic.isSigned()).isTrue();
        assertThat(pic.getIntegerDigits()).isEqualTo(9);
        assertThat(pic.getFractionDigits()).isEqualTo(2);
        assertThat(pic.getLength()).isEqualTo(11);
    }

    @Test
    void testScalingPositionsCountAsDigits() {
        PictureClause pic = PictureClause.parse("99PPP");

        assertThat(pic.isNumeric()).isTrue();
        assertThat(pic.getIntegerDigits()).isEqualTo(5);
        assertThat(pic.getLength()).isEqualTo(2);
    }

    @Test
    void testNumericEdited() {
        PictureClause pic = PictureClause.parse("ZZ,ZZ9.99-");

        assertThat(pic.getCategory()).isEqualTo(PictureCategory.NUMERIC_EDITED);
        assertThat(pic.isEdited()).isTrue();
        assertThat(pic.isSigned()).isTrue();
        assertThat(pic.getIntegerDigits()).isEqualTo(5);
        assertThat(pic.getFractionDigits()).isEqualTo(2);
        assertThat(pic.getLength()).isEqualTo(10);
    }

    @Test
    void testFloatingInsertionHoldsOneDigitLess() {
        PictureClause pic = PictureClause.parse("$$$9.99");

        assertThat(pic.getCategory()).isEqualTo(PictureCategory.NUMERIC_EDITED);
        assertThat(pic.getIntegerDigits()).isEqualTo(3);
        assertThat(pic.getFractionDigits()).isEqualTo(2);
    }

    @Test
    void testAlphanumericEdited() {
        PictureClause pic = PictureClause.parse("XXBXX/XX");

        assertThat(pic.getCategory()).isEqualTo(PictureCategory.ALPHANUMERIC_EDITED);
        assertThat(pic.getLength()).isEqualTo(8);
    }

    @ParameterizedTest
    @CsvSource({
        "X(10), DISPLAY, 10",
        "9(5), DISPLAY, 5",
        "S9(7)V99, DISPLAY, 9",
        // IBM Enterprise COBOL BINARY sizing: 1-4 digits=2, 5-9 digits=4, 10-18 digits=8
        "9(1), BINARY, 2",
        "9(4), BINARY, 2",
        "9(5), BINARY, 4",
        "9(9), BINARY, 4",
        "9(10), BINARY, 8",
        "9(18), BINARY, 8",
        "9(4), COMP_5, 2",
        // COMP-3 packed decimal: digits / 2 + 1
        "9(1), PACKED_DECIMAL, 1",
        "9(3), PACKED_DECIMAL, 2",
        "9(5), PACKED_DECIMAL, 3",
        "S9(9)V99, PACKED_DECIMAL, 6",
        "S9(7)V99, PACKED_DECIMAL, 5",
        "9(15), PACKED_DECIMAL, 8"
    })
    void testByteLengthCalculation(String pic, String usage, int expectedLength) {
        PictureClause clause = PictureClause.parse(pic);

        assertThat(clause.getByteLength(Usage.valueOf(usage), false)).isEqualTo(expectedLength);
    }

    @Test
    void testSeparateSignAddsOneByte() {
        assertThat(PictureClause.parse("S9(5)").getByteLength(Usage.DISPLAY, true)).isEqualTo(6);
    }

    @Test
    void testExpandedPicture() {
        PictureClause pic = PictureClause.parse("X(3)9(2)");

        assertThat(pic.getExpandedPicture()).isEqualTo("XXX99");
    }

    @Test
    void testNullAndEmptyInput() {
        assertThatThrownBy(() -> PictureClause.parse(null)).isInstanceOf(InvalidPictureException.class);
        assertThatThrownBy(() -> PictureClause.parse("")).isInstanceOf(InvalidPictureException.class);
        assertThatThrownBy(() -> PictureClause.parse("   ")).isInstanceOf(InvalidPictureException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"9S9", "9V9V9", "X(0)", "X(3", "9(5)Q", "XV9", "SX(3)", "9(32)"})
    void testInvalidPicturesAreRejected(String pic) {
        assertThatThrownBy(() -> PictureClause.parse(pic)).isInstanceOf(InvalidPictureException.class);
    }
}
