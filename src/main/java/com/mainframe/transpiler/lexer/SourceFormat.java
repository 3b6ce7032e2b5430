package com.mainframe.transpiler.lexer;

/**
 * Reference format of a COBOL source file.
 */
public enum SourceFormat {

    /**
     * Columns 1-6 sequence area, column 7 indicator, columns 8-72 program text.
     */
    FIXED,

    /**
     * No sequence or indicator area; {@code *>} starts a comment.
     */
    FREE;

    public static final int DEFAULT_FIXED_MARGIN = 72;
}
