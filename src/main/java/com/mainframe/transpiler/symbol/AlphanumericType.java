package com.mainframe.transpiler.symbol;

import lombok.Value;

@Value
public class AlphanumericType implements DataType {
    int length;

    @Override
    public boolean isAlphanumeric() {
        return true;
    }

    @Override
    public int displayLength() {
        return length;
    }
}
