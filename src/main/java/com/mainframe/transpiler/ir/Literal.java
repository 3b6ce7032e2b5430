package com.mainframe.transpiler.ir;

import com.mainframe.transpiler.symbol.LiteralValue;

import lombok.Value;

@Value
public class Literal implements IrExpression {
    LiteralValue value;

    public static Literal number(long value) {
        return new Literal(LiteralValue.numeric(Long.toString(value)));
    }

    @Override
    public IrType type() {
        switch (value.getKind()) {
            case NUMERIC:
                return numericType(value.getText());
            case ALPHANUMERIC:
                return IrType.alphanumeric(value.getText().length());
            default:
                return IrType.figurative();
        }
    }

    private static IrType numericType(String text) {
        String digits = text.startsWith("-") || text.startsWith("+") ? text.substring(1) : text;
        int point = digits.indexOf('.');
        int integer = point < 0 ? digits.length() : point;
        int fraction = point < 0 ? 0 : digits.length() - point - 1;
        return IrType.numeric(Math.max(1, integer), fraction, text.startsWith("-"));
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
