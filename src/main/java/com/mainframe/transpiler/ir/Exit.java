package com.mainframe.transpiler.ir;

/**
 * Leaves the current paragraph unit.
 */
public final class Exit implements IrStatement {
    public static final Exit INSTANCE = new Exit();

    private Exit() {
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitExit(this);
    }

    @Override
    public String toString() {
        return "Exit";
    }
}
