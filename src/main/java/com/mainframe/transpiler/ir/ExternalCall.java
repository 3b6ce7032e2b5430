package com.mainframe.transpiler.ir;

import java.util.List;

import lombok.Value;

/**
 * Opaque call outside the program: {@code CALL 'PGM'}, and verbs with no lowering (SORT, MERGE,
 * EXEC, unknown verbs). Generated code hands it to an external hook.
 */
@Value
public class ExternalCall implements IrStatement {
    String name;
    List<IrExpression> arguments;

    /** Source text, kept for the generated comment. */
    String snippet;

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitExternalCall(this);
    }
}
