package com.mainframe.transpiler.ir;

import java.util.List;

import com.mainframe.transpiler.symbol.ConditionValue;

import lombok.Value;

/**
 * Condition-name and class tests on a subject.
 */
@Value
public class ConditionTest implements IrExpression {

    public enum Kind {
        /** Level-88: subject equals one of the values or lies in one of the ranges. */
        CONDITION_NAME,
        NUMERIC,
        ALPHABETIC,
        ALPHABETIC_LOWER,
        ALPHABETIC_UPPER,
        POSITIVE,
        NEGATIVE,
        ZERO
    }

    Kind kind;
    IrExpression subject;

    /** Values of a condition name; empty for class tests. */
    List<ConditionValue> values;

    @Override
    public IrType type() {
        return IrType.control();
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitConditionTest(this);
    }
}
