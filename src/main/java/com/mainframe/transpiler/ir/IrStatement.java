package com.mainframe.transpiler.ir;

public interface IrStatement extends IrNode {
}
