package com.mainframe.transpiler.ir;

import java.util.List;

import lombok.Value;

/**
 * ADD, SUBTRACT, MULTIPLY, DIVIDE or COMPUTE. Stores run in order; each scales its value to the
 * target (truncating, or half-up when rounded).
 *
 * Without a size-error guard, high-order digits that do not fit are dropped. With one, a store
 * that does not fit (or divides by zero) leaves its target unchanged, and after all stores either
 * {@code onSizeError} or {@code notOnSizeError} runs.
 */
@Value
public class Arithmetic implements IrStatement {
    String verb;
    List<ArithmeticStore> stores;
    boolean sizeErrorGuarded;
    IrStatement onSizeError;
    IrStatement notOnSizeError;

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitArithmetic(this);
    }
}
