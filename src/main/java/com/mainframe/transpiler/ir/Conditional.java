package com.mainframe.transpiler.ir;

import lombok.Value;

@Value
public class Conditional implements IrStatement {
    IrExpression condition;
    IrStatement then;

    /** Null when there is no else branch. */
    IrStatement otherwise;

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }
}
