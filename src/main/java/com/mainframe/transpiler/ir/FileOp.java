package com.mainframe.transpiler.ir;

import lombok.Builder;
import lombok.Value;

/**
 * OPEN, CLOSE, READ or WRITE against the record stream of a file.
 */
@Value
@Builder
public class FileOp implements IrStatement {

    public enum Kind {
        OPEN, CLOSE, READ, WRITE
    }

    public enum Mode {
        INPUT, OUTPUT, I_O, EXTEND
    }

    Kind kind;
    IrFile file;

    /** OPEN only. */
    Mode mode;

    /** READ: the record read into; WRITE: the record written. */
    RecordAccess record;

    /** READ ... INTO target. */
    RecordAccess into;

    /** WRITE ... FROM source. */
    IrExpression from;

    IrStatement atEnd;
    IrStatement notAtEnd;

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitFileOp(this);
    }
}
