package com.mainframe.transpiler.lexer;

/**
 * Classification of a physical source line, derived from the indicator area.
 */
public enum LineKind {
    CODE,
    COMMENT,
    CONTINUATION,
    DEBUG,
    BLANK
}
