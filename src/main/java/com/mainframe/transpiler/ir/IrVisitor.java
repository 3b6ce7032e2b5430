package com.mainframe.transpiler.ir;

public interface IrVisitor<R> {

    R visitSequence(Sequence node);

    R visitAssign(Assign node);

    R visitArithmetic(Arithmetic node);

    R visitConditional(Conditional node);

    R visitLoop(Loop node);

    R visitCall(Call node);

    R visitExit(Exit node);

    R visitStop(Stop node);

    R visitDisplay(Display node);

    R visitAccept(Accept node);

    R visitInitialize(Initialize node);

    R visitFileOp(FileOp node);

    R visitExternalCall(ExternalCall node);

    R visitTagged(Tagged node);

    R visitLiteral(Literal node);

    R visitRecordAccess(RecordAccess node);

    R visitControlRef(ControlRef node);

    R visitBinary(Binary node);

    R visitCompare(Compare node);

    R visitLogical(Logical node);

    R visitConditionTest(ConditionTest node);
}
