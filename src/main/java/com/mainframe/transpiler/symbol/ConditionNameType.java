package com.mainframe.transpiler.symbol;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * Level 88: a named set of values of its parent item.
 */
@Value
public class ConditionNameType implements DataType {
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    DataItem parent;

    List<ConditionValue> values;

    @Override
    public int displayLength() {
        return 0;
    }

    /**
     * Value SET ... TO TRUE stores: the first value (or the first range's low end).
     */
    public LiteralValue trueValue() {
        return values.get(0).getFrom();
    }
}
