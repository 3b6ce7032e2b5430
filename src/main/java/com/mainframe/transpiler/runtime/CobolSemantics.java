package com.mainframe.transpiler.runtime;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

import lombok.experimental.UtilityClass;

/**
 * Data semantics shared by the IR interpreter and mirrored by the runtime helpers of generated
 * code: MOVE conversions, numeric storage, comparisons and editing.
 *
 * Numeric values are {@link BigDecimal}s scaled to the field's fraction digits; alphanumeric and
 * edited values are strings of exactly the field's length.
 */
@UtilityClass
public class CobolSemantics {

    // ------------------------------------------------------------------ numeric storage

    /**
     * Value a numeric field holds after receiving {@code value}: the fraction scaled with
     * {@code mode}, integer digits beyond {@code integerDigits} dropped, the sign dropped when the
     * field is unsigned.
     */
    public static BigDecimal store(BigDecimal value, int integerDigits, int fractionDigits, boolean signed,
                                   RoundingMode mode) {
        BigDecimal scaled = value.setScale(fractionDigits, mode);
        BigDecimal truncated = scaled.remainder(BigDecimal.TEN.pow(integerDigits));
        if (!signed) {
            truncated = truncated.abs();
        }
        return truncated.setScale(fractionDigits, RoundingMode.UNNECESSARY);
    }

    public static BigDecimal store(BigDecimal value, int integerDigits, int fractionDigits, boolean signed) {
        return store(value, integerDigits, fractionDigits, signed, RoundingMode.DOWN);
    }

    /**
     * True when {@code value}, scaled to the field, keeps all its integer digits.
     */
    public static boolean fits(BigDecimal value, int integerDigits, int fractionDigits, RoundingMode mode) {
        BigDecimal scaled = value.setScale(fractionDigits, mode);
        return scaled.abs().compareTo(BigDecimal.TEN.pow(integerDigits)) < 0;
    }

    /**
     * Quotient with the given scale; division by zero raises {@link SizeErrorException}.
     */
    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor, int scale) {
        if (divisor.signum() == 0) {
            throw new SizeErrorException("division by zero");
        }
        return dividend.divide(divisor, scale, RoundingMode.DOWN);
    }

    /**
     * Exponentiation; integral exponents are exact, others go through double.
     */
    public static BigDecimal power(BigDecimal base, BigDecimal exponent, int scale) {
        if (exponent.signum() == 0) {
            return BigDecimal.ONE;
        }
        if (exponent.stripTrailingZeros().scale() <= 0) {
            int n = exponent.intValueExact();
            if (n > 0) {
                return base.pow(n);
            }
            if (base.signum() == 0) {
                throw new SizeErrorException("zero raised to a negative power");
            }
            return BigDecimal.ONE.divide(base.pow(-n), scale, RoundingMode.DOWN);
        }
        double result = Math.pow(base.doubleValue(), exponent.doubleValue());
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw new SizeErrorException("exponentiation out of range");
        }
        return new BigDecimal(result).setScale(scale, RoundingMode.DOWN);
    }

    // ------------------------------------------------------------------ MOVE

    /**
     * Alphanumeric receiving rules: left-justified, truncated on the right or padded with spaces.
     */
    public static String alphanumeric(String value, int length) {
        if (value.length() >= length) {
            return value.substring(0, length);
        }
        StringBuilder out = new StringBuilder(length).append(value);
        while (out.length() < length) {
            out.append(' ');
        }
        return out.toString();
    }

    public static String fill(char c, int length) {
        return String.valueOf(c).repeat(Math.max(0, length));
    }

    /**
     * {@code ALL literal}: the pattern repeated to the length.
     */
    public static String repeat(String pattern, int length) {
        if (pattern.isEmpty()) {
            return fill(' ', length);
        }
        StringBuilder out = new StringBuilder(length);
        while (out.length() < length) {
            out.append(pattern);
        }
        return out.substring(0, length);
    }

    /**
     * Unsigned digits of a numeric value, integer part zero-padded to {@code integerDigits} and
     * the fraction to {@code fractionDigits}, without a decimal point. The form a numeric item
     * takes when moved to an alphanumeric one.
     */
    public static String digits(BigDecimal value, int integerDigits, int fractionDigits) {
        int width = integerDigits + fractionDigits;
        if (width == 0) {
            return "";
        }
        BigInteger unscaled = value.abs().setScale(fractionDigits, RoundingMode.DOWN).unscaledValue();
        String text = unscaled.toString();
        if (text.length() > width) {
            return text.substring(text.length() - width);
        }
        return "0".repeat(width - text.length()) + text;
    }

    /**
     * Numeric value of alphanumeric data: every character that is not a digit counts as zero and
     * the result is an unsigned integer.
     */
    public static BigDecimal parseDigits(String value) {
        if (value.isEmpty()) {
            return BigDecimal.ZERO;
        }
        StringBuilder digits = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            digits.append(c >= '0' && c <= '9' ? c : '0');
        }
        return new BigDecimal(digits.toString());
    }

    // ------------------------------------------------------------------ display images

    /**
     * Zoned-decimal image of a numeric field; a negative signed value carries its sign in the last
     * position ({@code }} for 0, {@code J}..{@code R} for 1..9).
     */
    public static String zoned(BigDecimal value, int integerDigits, int fractionDigits, boolean signed) {
        String digits = digits(value, integerDigits, fractionDigits);
        if (!signed || value.signum() >= 0 || digits.isEmpty()) {
            return digits;
        }
        char last = digits.charAt(digits.length() - 1);
        char punched = last == '0' ? '}' : (char) ('J' + (last - '1'));
        return digits.substring(0, digits.length() - 1) + punched;
    }

    /**
     * Reverse of {@link #zoned}; positive overpunches ({@code {}, {@code A}..{@code I}) are read too.
     */
    public static BigDecimal unzoned(String image, int integerDigits, int fractionDigits, boolean signed) {
        if (image.isEmpty()) {
            return BigDecimal.ZERO.setScale(fractionDigits);
        }
        boolean negative = false;
        char last = image.charAt(image.length() - 1);
        char digit = last;
        if (last == '}') {
            negative = true;
            digit = '0';
        } else if (last >= 'J' && last <= 'R') {
            negative = true;
            digit = (char) ('1' + (last - 'J'));
        } else if (last == '{') {
            digit = '0';
        } else if (last >= 'A' && last <= 'I') {
            digit = (char) ('1' + (last - 'A'));
        }
        BigDecimal unsigned = parseDigits(image.substring(0, image.length() - 1) + digit)
                .movePointLeft(fractionDigits);
        BigDecimal value = negative && signed ? unsigned.negate() : unsigned;
        return store(value, integerDigits, fractionDigits, signed);
    }

    /**
     * DISPLAY form of a numeric field: its digits, preceded by '-' when negative.
     */
    public static String displayNumeric(BigDecimal value, int integerDigits, int fractionDigits) {
        String digits = digits(value, integerDigits, fractionDigits);
        return value.signum() < 0 ? "-" + digits : digits;
    }

    // ------------------------------------------------------------------ comparison

    /**
     * Alphanumeric comparison: the shorter operand is padded with spaces.
     */
    public static int compareText(String left, String right) {
        int length = Math.max(left.length(), right.length());
        for (int i = 0; i < length; i++) {
            char l = i < left.length() ? left.charAt(i) : ' ';
            char r = i < right.length() ? right.charAt(i) : ' ';
            if (l != r) {
                return l < r ? -1 : 1;
            }
        }
        return 0;
    }

    public static boolean isNumericText(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isAlphabetic(String value, boolean lower, boolean upper) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean ok = c == ' '
                    || (!upper && c >= 'a' && c <= 'z')
                    || (!lower && c >= 'A' && c <= 'Z');
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    // ------------------------------------------------------------------ editing

    /**
     * Approximate numeric editing: digits go right-aligned into the digit positions of the
     * expanded picture, leading zeros under Z, * and floating symbols are suppressed, insertion
     * characters are kept, and sign, CR and DB positions show the sign.
     */
    public static String edit(BigDecimal value, String picture) {
        boolean negative = value.signum() < 0;
        String pic = picture;
        String suffix = "";
        if (pic.endsWith("CR") || pic.endsWith("DB")) {
            suffix = negative ? pic.substring(pic.length() - 2) : "  ";
            pic = pic.substring(0, pic.length() - 2);
        }

        char floating = 0;
        for (char symbol : new char[] {'+', '-', '$'}) {
            if (pic.indexOf(symbol) != pic.lastIndexOf(symbol)) {
                floating = symbol;
            }
        }
        int point = pic.length();
        for (int i = 0; i < pic.length(); i++) {
            if (pic.charAt(i) == '.' || pic.charAt(i) == 'V') {
                point = i;
                break;
            }
        }

        int integerPositions = 0;
        int fractionPositions = 0;
        boolean seenFloating = false;
        for (int i = 0; i < pic.length(); i++) {
            char c = pic.charAt(i);
            boolean digit = c == '9' || c == 'Z' || c == '*';
            if (c == floating) {
                digit = seenFloating;
                seenFloating = true;
            }
            if (digit) {
                if (i < point) {
                    integerPositions++;
                } else {
                    fractionPositions++;
                }
            }
        }

        String digits = digits(value, integerPositions, fractionPositions);
        char fillChar = pic.indexOf('*') >= 0 ? '*' : ' ';
        StringBuilder out = new StringBuilder();
        int next = 0;
        int floatingSlot = -1;
        boolean significant = false;
        seenFloating = false;
        for (int i = 0; i < pic.length(); i++) {
            char c = pic.charAt(i);
            if (i >= point) {
                significant = true;
            }
            if (c == floating) {
                if (!seenFloating) {
                    seenFloating = true;
                    floatingSlot = out.length();
                    out.append(' ');
                    continue;
                }
                char d = digits.charAt(next++);
                if (!significant && d == '0') {
                    floatingSlot = out.length();
                    out.append(' ');
                } else {
                    significant = true;
                    out.append(d);
                }
                continue;
            }
            switch (c) {
                case '9':
                    significant = true;
                    out.append(digits.charAt(next++));
                    break;
                case 'Z':
                case '*': {
                    char d = digits.charAt(next++);
                    if (!significant && d == '0') {
                        out.append(c == '*' ? '*' : ' ');
                    } else {
                        significant = true;
                        out.append(d);
                    }
                    break;
                }
                case ',':
                    out.append(significant ? ',' : fillChar);
                    break;
                case 'V':
                case 'S':
                case 'P':
                    break;
                case 'B':
                    out.append(' ');
                    break;
                case '+':
                    out.append(negative ? '-' : '+');
                    break;
                case '-':
                    out.append(negative ? '-' : ' ');
                    break;
                default:
                    out.append(c);
            }
        }
        if (floatingSlot >= 0) {
            char symbol = floating == '$' ? '$' : floating == '+' ? (negative ? '-' : '+') : (negative ? '-' : ' ');
            out.setCharAt(floatingSlot, symbol);
        }
        return out.append(suffix).toString();
    }

    /**
     * Alphanumeric editing: X, A and 9 positions take the next source character; B, 0 and / are inserted.
     */
    public static String editText(String value, String picture) {
        StringBuilder out = new StringBuilder(picture.length());
        int next = 0;
        for (int i = 0; i < picture.length(); i++) {
            char c = picture.charAt(i);
            switch (c) {
                case 'X':
                case 'A':
                case '9':
                    out.append(next < value.length() ? value.charAt(next) : ' ');
                    next++;
                    break;
                case 'B':
                    out.append(' ');
                    break;
                default:
                    out.append(c);
            }
        }
        return out.toString();
    }
}
