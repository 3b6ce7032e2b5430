package com.mainframe.transpiler.naming;

/**
 * Kind of generated identifier; decides the prefix used when a COBOL name starts with a digit.
 */
public enum NameKind {
    PARAGRAPH("p_"),
    DATA("f_"),
    TYPE("T");

    private final String digitPrefix;

    NameKind(String digitPrefix) {
        this.digitPrefix = digitPrefix;
    }

    public String getDigitPrefix() {
        return digitPrefix;
    }
}
