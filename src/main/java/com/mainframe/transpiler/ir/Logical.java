package com.mainframe.transpiler.ir;

import java.util.List;

import lombok.Value;

/**
 * AND / OR over two or more conditions, evaluated left to right with short circuit; NOT over one.
 */
@Value
public class Logical implements IrExpression {

    public enum Op {
        AND, OR, NOT
    }

    Op op;
    List<IrExpression> operands;

    public static Logical not(IrExpression operand) {
        return new Logical(Op.NOT, List.of(operand));
    }

    @Override
    public IrType type() {
        return IrType.control();
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitLogical(this);
    }
}
