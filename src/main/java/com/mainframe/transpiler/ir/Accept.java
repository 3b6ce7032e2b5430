package com.mainframe.transpiler.ir;

import lombok.Value;

@Value
public class Accept implements IrStatement {
    RecordAccess target;

    /** DATE, DATE YYYYMMDD, DAY, DAY YYYYDDD, DAY-OF-WEEK, TIME; null reads a line of input. */
    String from;

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitAccept(this);
    }
}
