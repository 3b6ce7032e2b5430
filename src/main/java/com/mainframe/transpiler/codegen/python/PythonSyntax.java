package com.mainframe.transpiler.codegen.python;

import java.math.BigDecimal;

/**
 * Python source forms of constants.
 */
final class PythonSyntax {

    private PythonSyntax() {
    }

    static String string(String value) {
        StringBuilder out = new StringBuilder(value.length() + 2).append('"');
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"':
                    out.append("\\\"");
                    break;
                case '\\':
                    out.append("\\\\");
                    break;
                default:
                    if (c < 0x20 || c > 0x7E) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
            }
        }
        return out.append('"').toString();
    }

    static String decimal(BigDecimal value) {
        return "Decimal(\"" + value.toPlainString() + "\")";
    }

    static String constant(Object value) {
        if (value instanceof BigDecimal) {
            return decimal((BigDecimal) value);
        }
        return string((String) value);
    }
}
