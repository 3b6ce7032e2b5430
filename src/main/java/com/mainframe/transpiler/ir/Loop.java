package com.mainframe.transpiler.ir;

import lombok.Value;

/**
 * COUNT repeats the body {@code count} times (evaluated once). WHILE tests {@code until} before
 * each iteration and POST_TEST after; both stop as soon as it holds.
 */
@Value
public class Loop implements IrStatement {

    public enum Kind {
        COUNT, WHILE, POST_TEST
    }

    Kind kind;
    IrExpression count;
    IrExpression until;
    IrStatement body;

    public static Loop times(IrExpression count, IrStatement body) {
        return new Loop(Kind.COUNT, count, null, body);
    }

    public static Loop until(boolean testAfter, IrExpression until, IrStatement body) {
        return new Loop(testAfter ? Kind.POST_TEST : Kind.WHILE, null, until, body);
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitLoop(this);
    }
}
