package com.mainframe.transpiler.runtime;

import java.math.BigDecimal;
import java.math.RoundingMode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for COBOL data semantics.
 */
class CobolSemanticsTest {

    @Test
    void testStoreTruncatesHighOrderDigits() {
        assertThat(CobolSemantics.store(new BigDecimal("104"), 2, 0, false)).isEqualByComparingTo("4");
        assertThat(CobolSemantics.store(new BigDecimal("-12.345"), 3, 2, true)).isEqualByComparingTo("-12.34");
        assertThat(CobolSemantics.store(new BigDecimal("-7"), 1, 0, false)).isEqualByComparingTo("7");
    }

    @Test
    void testStoreRounded() {
        BigDecimal stored = CobolSemantics.store(new BigDecimal("12.345"), 3, 2, true, RoundingMode.HALF_UP);

        assertThat(stored).isEqualByComparingTo("12.35");
        assertThat(stored.scale()).isEqualTo(2);
    }

    @Test
    void testFits() {
        assertThat(CobolSemantics.fits(new BigDecimal("99"), 2, 0, RoundingMode.DOWN)).isTrue();
        assertThat(CobolSemantics.fits(new BigDecimal("100"), 2, 0, RoundingMode.DOWN)).isFalse();
        assertThat(CobolSemantics.fits(new BigDecimal("99.999"), 2, 2, RoundingMode.HALF_UP)).isFalse();
    }

    @Test
    void testDivide() {
        assertThat(CobolSemantics.divide(BigDecimal.TEN, new BigDecimal("3"), 2)).isEqualByComparingTo("3.33");
        assertThatThrownBy(() -> CobolSemantics.divide(BigDecimal.ONE, BigDecimal.ZERO, 2))
                .isInstanceOf(SizeErrorException.class);
    }

    @Test
    void testPower() {
        assertThat(CobolSemantics.power(new BigDecimal("2"), new BigDecimal("3"), 0)).isEqualByComparingTo("8");
        assertThat(CobolSemantics.power(new BigDecimal("2"), new BigDecimal("-1"), 2)).isEqualByComparingTo("0.5");
        assertThatThrownBy(() -> CobolSemantics.power(BigDecimal.ZERO, new BigDecimal("-1"), 2))
                .isInstanceOf(SizeErrorException.class);
    }

    @Test
    void testAlphanumericMove() {
        assertThat(CobolSemantics.alphanumeric("HELLO", 3)).isEqualTo("HEL");
        assertThat(CobolSemantics.alphanumeric("HI", 4)).isEqualTo("HI  ");
        assertThat(CobolSemantics.repeat("AB", 5)).isEqualTo("ABABA");
        assertThat(CobolSemantics.fill('0', 3)).isEqualTo("000");
    }

    @Test
    void testDigitsAndParse() {
        assertThat(CobolSemantics.digits(new BigDecimal("-12.5"), 3, 2)).isEqualTo("01250");
        assertThat(CobolSemantics.digits(new BigDecimal("12345"), 3, 0)).isEqualTo("345");
        assertThat(CobolSemantics.parseDigits("1A3")).isEqualByComparingTo("103");
        assertThat(CobolSemantics.parseDigits("")).isEqualByComparingTo("0");
    }

    @Test
    void testZonedSign() {
        assertThat(CobolSemantics.zoned(new BigDecimal("-123"), 3, 0, true)).isEqualTo("12L");
        assertThat(CobolSemantics.zoned(new BigDecimal("-120"), 3, 0, true)).isEqualTo("12}");
        assertThat(CobolSemantics.zoned(new BigDecimal("-123"), 3, 0, false)).isEqualTo("123");
        assertThat(CobolSemantics.unzoned("12L", 3, 0, true)).isEqualByComparingTo("-123");
        assertThat(CobolSemantics.unzoned("12C", 3, 0, true)).isEqualByComparingTo("123");
        assertThat(CobolSemantics.displayNumeric(new BigDecimal("-4.5"), 2, 1)).isEqualTo("-045");
    }

    @Test
    void testTextComparison() {
        assertThat(CobolSemantics.compareText("AB", "AB  ")).isZero();
        assertThat(CobolSemantics.compareText("A", "B")).isNegative();
        assertThat(CobolSemantics.compareText("AB", "A")).isPositive();
    }

    @Test
    void testClassConditions() {
        assertThat(CobolSemantics.isNumericText("123")).isTrue();
        assertThat(CobolSemantics.isNumericText("12 ")).isFalse();
        assertThat(CobolSemantics.isNumericText("")).isFalse();
        assertThat(CobolSemantics.isAlphabetic("Hello World", false, false)).isTrue();
        assertThat(CobolSemantics.isAlphabetic("abc", false, true)).isFalse();
        assertThat(CobolSemantics.isAlphabetic("ABC", false, true)).isTrue();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "5.5     | ZZ9.99    | '  5.50'",
        "1234.5  | ZZ,ZZ9.99 | ' 1,234.50'",
        "-12     | ZZ9-      | ' 12-'",
        "12      | ZZ9-      | ' 12 '",
        "42      | $$$9      | ' $42'",
        "7       | ***9      | ***7",
        "-5      | 99CR      | 05CR",
        "5       | 99CR      | '05  '"
    })
    void testNumericEditing(String value, String picture, String expected) {
        assertThat(CobolSemantics.edit(new BigDecimal(value), picture)).isEqualTo(expected);
    }

    @Test
    void testAlphanumericEditing() {
        assertThat(CobolSemantics.editText("ABCD", "XXBXX")).isEqualTo("AB CD");
        assertThat(CobolSemantics.editText("311224", "XX/XX/XX")).isEqualTo("31/12/24");
    }
}
