package com.mainframe.transpiler.codegen.java;

import java.math.BigDecimal;

/**
 * Java source forms of constants.
 */
final class JavaSyntax {

    private JavaSyntax() {
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
        return "new BigDecimal(\"" + value.toPlainString() + "\")";
    }

    static String constant(Object value) {
        if (value instanceof BigDecimal) {
            return decimal((BigDecimal) value);
        }
        return string((String) value);
    }
}
