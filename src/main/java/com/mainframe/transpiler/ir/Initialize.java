package com.mainframe.transpiler.ir;

import lombok.Value;

/**
 * Numeric fields become zero and alphanumeric fields spaces, recursively; FILLER is left alone.
 */
@Value
public class Initialize implements IrStatement {
    RecordAccess target;

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitInitialize(this);
    }
}
