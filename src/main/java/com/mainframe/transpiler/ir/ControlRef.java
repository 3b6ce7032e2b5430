package com.mainframe.transpiler.ir;

import lombok.Value;

@Value
public class ControlRef implements IrExpression {
    ControlVariable variable;

    @Override
    public IrType type() {
        return IrType.control();
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitControlRef(this);
    }
}
