package com.mainframe.transpiler.ir;

import java.util.List;

import lombok.Value;

/**
 * Reads or designates a field of the record layout. Subscripts are 1-based, one per OCCURS level
 * on the field's path, outermost first.
 */
@Value
public class RecordAccess implements IrExpression {
    IrField field;
    List<IrExpression> subscripts;

    public static RecordAccess of(IrField field) {
        return new RecordAccess(field, List.of());
    }

    @Override
    public IrType type() {
        return field.getType();
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitRecordAccess(this);
    }
}
