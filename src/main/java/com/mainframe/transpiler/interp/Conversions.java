package com.mainframe.transpiler.interp;

import java.math.BigDecimal;

import com.mainframe.transpiler.ir.IrType;
import com.mainframe.transpiler.ir.Literal;
import com.mainframe.transpiler.runtime.CobolSemantics;
import com.mainframe.transpiler.symbol.LiteralValue;

/**
 * MOVE rules between interpreter values. A value is a {@link BigDecimal} (numeric), a
 * {@link String} (alphanumeric, edited or a group image) or a figurative {@link LiteralValue}
 * that takes the length of its receiver.
 */
public final class Conversions {

    private Conversions() {
    }

    /**
     * Value a field of {@code target} type holds after receiving {@code value} of {@code source} type.
     */
    public static Object move(Object value, IrType source, IrType target) {
        switch (target.getKind()) {
            case NUMERIC:
                return CobolSemantics.store(number(value), target.getIntegerDigits(), target.getFractionDigits(),
                        target.isSigned());
            case EDITED:
                if (value instanceof LiteralValue && ((LiteralValue) value).getKind() != LiteralValue.Kind.NUMERIC) {
                    return text(value, source, target.getLength());
                }
                if (target.isNumericEdited()) {
                    BigDecimal number = number(value);
                    BigDecimal stored = CobolSemantics.store(number, target.getIntegerDigits(), target.getFractionDigits(), true);
                    return CobolSemantics.alphanumeric(CobolSemantics.edit(stored, target.getPicture()), target.getLength());
                }
                return CobolSemantics.alphanumeric(
                        CobolSemantics.editText(text(value, source, 0), target.getPicture()), target.getLength());
            default:
                return text(value, source, target.getLength());
        }
    }

    /**
     * Value INITIALIZE gives a field: zero, or spaces (an edited zero for numeric-edited fields).
     */
    public static Object empty(IrType type) {
        if (type.isNumeric()) {
            return BigDecimal.ZERO.setScale(type.getFractionDigits());
        }
        if (type.getKind() == IrType.Kind.EDITED && type.isNumericEdited()) {
            return CobolSemantics.alphanumeric(CobolSemantics.edit(BigDecimal.ZERO, type.getPicture()), type.getLength());
        }
        return CobolSemantics.fill(' ', type.getLength());
    }

    public static Object move(LiteralValue literal, IrType target) {
        return move(evaluate(literal), new Literal(literal).type(), target);
    }

    /**
     * Value of a literal: numeric literals are numbers, alphanumeric literals their text, and
     * figuratives stay symbolic until they meet a receiver.
     */
    public static Object evaluate(LiteralValue literal) {
        switch (literal.getKind()) {
            case NUMERIC:
                return literal.toDecimal();
            case ALPHANUMERIC:
                return literal.getText();
            default:
                return literal;
        }
    }

    /**
     * Text of a value for an alphanumeric receiver of {@code length} characters; 0 keeps the
     * value's own length.
     */
    public static String text(Object value, IrType source, int length) {
        String text;
        if (value instanceof LiteralValue) {
            return text((LiteralValue) value, length);
        }
        if (value instanceof BigDecimal) {
            BigDecimal number = (BigDecimal) value;
            text = CobolSemantics.digits(number, integerDigits(number, source), fractionDigits(number, source));
        } else {
            text = (String) value;
        }
        return length == 0 ? text : CobolSemantics.alphanumeric(text, length);
    }

    public static String text(LiteralValue literal, int length) {
        switch (literal.getKind()) {
            case FIGURATIVE:
                return CobolSemantics.fill(literal.fillCharacter(), length == 0 ? 1 : length);
            case ALL:
                return CobolSemantics.repeat(literal.getText(), length == 0 ? literal.getText().length() : length);
            case NUMERIC:
                return text(literal.toDecimal(), new Literal(literal).type(), length);
            default:
                return length == 0 ? literal.getText() : CobolSemantics.alphanumeric(literal.getText(), length);
        }
    }

    /**
     * Numeric value of anything a numeric field can receive; text counts by its digits.
     */
    public static BigDecimal number(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof LiteralValue) {
            LiteralValue literal = (LiteralValue) value;
            if (literal.getKind() == LiteralValue.Kind.NUMERIC) {
                return literal.toDecimal();
            }
            return CobolSemantics.parseDigits(text(literal, 1));
        }
        return CobolSemantics.parseDigits((String) value);
    }

    /**
     * DISPLAY form: numeric fields show their digits with a leading '-' when negative, literals
     * as written, figuratives as one character.
     */
    public static String display(Object value, IrType type) {
        if (value instanceof BigDecimal) {
            BigDecimal number = (BigDecimal) value;
            if (type != null && type.isNumeric()) {
                return CobolSemantics.displayNumeric(number, type.getIntegerDigits(), type.getFractionDigits());
            }
            return number.toPlainString();
        }
        if (value instanceof LiteralValue) {
            LiteralValue literal = (LiteralValue) value;
            return literal.getKind() == LiteralValue.Kind.FIGURATIVE ? String.valueOf(literal.fillCharacter()) : literal.getText();
        }
        return (String) value;
    }

    private static int integerDigits(BigDecimal number, IrType source) {
        if (source != null && source.isNumeric()) {
            return source.getIntegerDigits();
        }
        return Math.max(1, number.precision() - number.scale());
    }

    private static int fractionDigits(BigDecimal number, IrType source) {
        if (source != null && source.isNumeric()) {
            return source.getFractionDigits();
        }
        return Math.max(0, number.scale());
    }
}
