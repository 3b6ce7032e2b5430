package com.mainframe.transpiler.symbol;

import lombok.Value;

/**
 * Fixed-point decimal with explicit precision. Usage only affects storage size.
 */
@Value
public class NumericType implements DataType {
    int integerDigits;
    int fractionDigits;
    boolean signed;
    Usage usage;

    public int totalDigits() {
        return integerDigits + fractionDigits;
    }

    @Override
    public boolean isNumeric() {
        return true;
    }

    @Override
    public int displayLength() {
        return totalDigits();
    }

    /**
     * Same precision, another usage; used when comparing logical types.
     */
    public boolean samePrecision(NumericType other) {
        return integerDigits == other.integerDigits && fractionDigits == other.fractionDigits && signed == other.signed;
    }
}
