package com.mainframe.transpiler.ir;

import lombok.Value;

/**
 * MOVE semantics from {@code value} into {@code target}: a field access or a control variable.
 */
@Value
public class Assign implements IrStatement {
    IrExpression target;
    IrExpression value;

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }
}
