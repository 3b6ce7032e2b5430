package com.mainframe.transpiler.ir;

public interface IrExpression extends IrNode {

    IrType type();
}
