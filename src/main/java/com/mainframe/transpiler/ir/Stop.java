package com.mainframe.transpiler.ir;

/**
 * Ends the run: STOP RUN, GOBACK, EXIT PROGRAM.
 */
public final class Stop implements IrStatement {
    public static final Stop INSTANCE = new Stop();

    private Stop() {
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitStop(this);
    }

    @Override
    public String toString() {
        return "Stop";
    }
}
