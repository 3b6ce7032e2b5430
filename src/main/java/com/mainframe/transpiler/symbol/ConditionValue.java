package com.mainframe.transpiler.symbol;

import lombok.Value;

/**
 * One value, or an inclusive {@code from THRU to} range, of a condition name.
 */
@Value
public class ConditionValue {
    LiteralValue from;
    LiteralValue to;

    public static ConditionValue single(LiteralValue value) {
        return new ConditionValue(value, null);
    }

    public boolean isRange() {
        return to != null;
    }
}
