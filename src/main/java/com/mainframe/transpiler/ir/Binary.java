package com.mainframe.transpiler.ir;

import lombok.Value;

/**
 * Arithmetic on two operands with full intermediate precision.
 */
@Value
public class Binary implements IrExpression {

    public enum Op {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        POWER("**");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    Op op;
    IrExpression left;
    IrExpression right;

    /** Result scale: quotients and powers are rounded to it, sums and products have it exactly. */
    int scale;

    public static Binary of(Op op, IrExpression left, IrExpression right) {
        return new Binary(op, left, right, 0);
    }

    @Override
    public IrType type() {
        if (left.type().isControl()) {
            return IrType.control();
        }
        return IrType.numeric(31, scale, true);
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
