package com.mainframe.transpiler.ir;

import lombok.Value;

/**
 * A relation. Two numeric operands compare by value; otherwise both sides compare as text, the
 * shorter padded with spaces and a numeric side taken as its unsigned digits.
 */
@Value
public class Compare implements IrExpression {

    public enum Op {
        EQ, NE, LT, GT, LE, GE;

        public boolean test(int comparison) {
            switch (this) {
                case EQ: return comparison == 0;
                case NE: return comparison != 0;
                case LT: return comparison < 0;
                case GT: return comparison > 0;
                case LE: return comparison <= 0;
                default: return comparison >= 0;
            }
        }
    }

    Op op;
    IrExpression left;
    IrExpression right;

    public boolean isNumeric() {
        IrType l = left.type();
        IrType r = right.type();
        boolean leftNumeric = l.isNumeric() || l.isControl();
        boolean rightNumeric = r.isNumeric() || r.isControl();
        return leftNumeric && rightNumeric
                || leftNumeric && isZero(right)
                || rightNumeric && isZero(left);
    }

    private static boolean isZero(IrExpression expression) {
        return expression instanceof Literal literal && literal.getValue().isFigurative() && literal.getValue().isNumeric();
    }

    @Override
    public IrType type() {
        return IrType.control();
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitCompare(this);
    }
}
