package com.mainframe.transpiler.ir;

import lombok.Value;

/**
 * Value shape of an expression or field, as far as code generation needs it.
 */
@Value
public class IrType {

    public enum Kind {
        NUMERIC,
        ALPHANUMERIC,
        EDITED,
        GROUP,
        /** Figurative constant or ALL literal: takes the length of what it meets. */
        FIGURATIVE,
        /** Synthetic integer control variable. */
        CONTROL
    }

    Kind kind;
    int integerDigits;
    int fractionDigits;
    boolean signed;

    /** Display length in characters. */
    int length;

    /** Expanded picture of an edited item. */
    String picture;

    boolean numericEdited;

    public static IrType numeric(int integerDigits, int fractionDigits, boolean signed) {
        return new IrType(Kind.NUMERIC, integerDigits, fractionDigits, signed, integerDigits + fractionDigits, null, false);
    }

    public static IrType alphanumeric(int length) {
        return new IrType(Kind.ALPHANUMERIC, 0, 0, false, length, null, false);
    }

    public static IrType edited(int length, String picture, boolean numericEdited, int integerDigits, int fractionDigits) {
        return new IrType(Kind.EDITED, integerDigits, fractionDigits, false, length, picture, numericEdited);
    }

    public static IrType group(int length) {
        return new IrType(Kind.GROUP, 0, 0, false, length, null, false);
    }

    public static IrType figurative() {
        return new IrType(Kind.FIGURATIVE, 0, 0, false, 0, null, false);
    }

    public static IrType control() {
        return new IrType(Kind.CONTROL, 9, 0, true, 9, null, false);
    }

    public boolean isNumeric() {
        return kind == Kind.NUMERIC;
    }

    public boolean isControl() {
        return kind == Kind.CONTROL;
    }

    public boolean isGroup() {
        return kind == Kind.GROUP;
    }

    public boolean isFigurative() {
        return kind == Kind.FIGURATIVE;
    }

    /**
     * Alphanumeric in the wide sense: plain, edited or a group's display image.
     */
    public boolean isTextual() {
        return kind == Kind.ALPHANUMERIC || kind == Kind.EDITED || kind == Kind.GROUP;
    }
}
