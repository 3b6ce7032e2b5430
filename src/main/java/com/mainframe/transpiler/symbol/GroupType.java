package com.mainframe.transpiler.symbol;

import lombok.Value;

/**
 * A group item; behaves as alphanumeric of its total size in moves and comparisons.
 */
@Value
public class GroupType implements DataType {
    int length;

    @Override
    public boolean isGroup() {
        return true;
    }

    @Override
    public boolean isAlphanumeric() {
        return true;
    }

    @Override
    public int displayLength() {
        return length;
    }
}
