package com.mainframe.transpiler.ir;

import java.util.List;

import lombok.Value;

@Value
public class Display implements IrStatement {
    List<IrExpression> operands;

    /** Device named by UPON, or null for the console. */
    String upon;

    boolean noAdvancing;

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitDisplay(this);
    }
}
