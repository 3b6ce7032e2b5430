package com.mainframe.transpiler.ir;

/**
 * Node of the language-agnostic intermediate representation. Nodes are immutable and never refer
 * to another program.
 */
public interface IrNode {

    <R> R accept(IrVisitor<R> visitor);
}
