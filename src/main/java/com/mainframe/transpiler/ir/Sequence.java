package com.mainframe.transpiler.ir;

import java.util.List;

import lombok.Value;

@Value
public class Sequence implements IrStatement {
    List<IrStatement> statements;

    public static Sequence of(IrStatement... statements) {
        return new Sequence(List.of(statements));
    }

    public static Sequence empty() {
        return new Sequence(List.of());
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitSequence(this);
    }
}
