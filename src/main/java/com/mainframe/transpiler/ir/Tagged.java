package com.mainframe.transpiler.ir;

import java.util.List;

import lombok.Value;

/**
 * Best-effort lowering of a statement that raised edge cases; generators emit the ids, and any
 * augmentation hint recorded for them, as a comment before the statement.
 */
@Value
public class Tagged implements IrStatement {
    List<String> edgeCaseIds;
    IrStatement statement;

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitTagged(this);
    }
}
