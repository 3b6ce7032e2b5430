package com.mainframe.transpiler.symbol;

import java.math.BigDecimal;
import java.util.Locale;

import lombok.Value;

/**
 * A constant from the source: numeric literal, alphanumeric literal, figurative constant or
 * {@code ALL literal}. Figurative names are normalized to their singular form.
 */
@Value
public class LiteralValue {

    public enum Kind {
        NUMERIC,
        ALPHANUMERIC,
        FIGURATIVE,
        ALL
    }

    public static final String SPACE = "SPACE";
    public static final String ZERO = "ZERO";
    public static final String HIGH_VALUE = "HIGH-VALUE";
    public static final String LOW_VALUE = "LOW-VALUE";
    public static final String QUOTE = "QUOTE";

    Kind kind;
    String text;

    public static LiteralValue numeric(String text) {
        return new LiteralValue(Kind.NUMERIC, text);
    }

    public static LiteralValue alphanumeric(String text) {
        return new LiteralValue(Kind.ALPHANUMERIC, text);
    }

    public static LiteralValue figurative(String word) {
        String upper = word.toUpperCase(Locale.ROOT);
        switch (upper) {
            case "SPACE":
            case "SPACES":
                return new LiteralValue(Kind.FIGURATIVE, SPACE);
            case "ZERO":
            case "ZEROS":
            case "ZEROES":
                return new LiteralValue(Kind.FIGURATIVE, ZERO);
            case "HIGH-VALUE":
            case "HIGH-VALUES":
                return new LiteralValue(Kind.FIGURATIVE, HIGH_VALUE);
            case "LOW-VALUE":
            case "LOW-VALUES":
            case "NULL":
            case "NULLS":
                return new LiteralValue(Kind.FIGURATIVE, LOW_VALUE);
            case "QUOTE":
            case "QUOTES":
                return new LiteralValue(Kind.FIGURATIVE, QUOTE);
            default:
                throw new IllegalArgumentException("Not a figurative constant: " + word);
        }
    }

    /**
     * {@code ALL x}: the pattern repeated to fill the target. ALL with a figurative is the figurative itself.
     */
    public static LiteralValue all(String pattern) {
        return new LiteralValue(Kind.ALL, pattern);
    }

    public boolean isNumeric() {
        return kind == Kind.NUMERIC || (kind == Kind.FIGURATIVE && ZERO.equals(text));
    }

    public boolean isFigurative() {
        return kind == Kind.FIGURATIVE;
    }

    public BigDecimal toDecimal() {
        if (kind == Kind.NUMERIC) {
            return new BigDecimal(text);
        }
        return BigDecimal.ZERO;
    }

    /**
     * The single fill character of a figurative constant.
     */
    public char fillCharacter() {
        switch (text) {
            case SPACE:
                return ' ';
            case ZERO:
                return '0';
            case HIGH_VALUE:
                return '\u00FF';
            case LOW_VALUE:
                return '\u0000';
            case QUOTE:
                return '"';
            default:
                throw new IllegalStateException("Not a figurative constant: " + text);
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case ALPHANUMERIC:
                return "'" + text + "'";
            case ALL:
                return "ALL '" + text + "'";
            default:
                return text;
        }
    }
}
