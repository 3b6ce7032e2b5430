package com.mainframe.transpiler.symbol;

import lombok.Value;

/**
 * An edited picture: numeric edited (Z, *, comma, sign insertion) or alphanumeric edited (B, 0, / with X or A).
 * Numeric edited items keep the digit counts of the picture so a numeric source can be edited into them.
 */
@Value
public class AlphanumericEditedType implements DataType {
    int length;
    String picture;
    boolean numericEdited;
    int integerDigits;
    int fractionDigits;

    @Override
    public boolean isAlphanumeric() {
        return true;
    }

    @Override
    public int displayLength() {
        return length;
    }
}
