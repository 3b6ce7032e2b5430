package com.mainframe.transpiler.ir;

import lombok.Value;

/**
 * One receiving field of an arithmetic statement and the full-precision value it receives.
 */
@Value
public class ArithmeticStore {
    RecordAccess target;
    IrExpression value;
    boolean rounded;
}
