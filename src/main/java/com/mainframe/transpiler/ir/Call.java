package com.mainframe.transpiler.ir;

import lombok.Value;

/**
 * Invokes a paragraph unit or a region unit of the same program.
 */
@Value
public class Call implements IrStatement {

    public enum Target {
        PARAGRAPH, REGION
    }

    Target target;
    String identifier;

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
