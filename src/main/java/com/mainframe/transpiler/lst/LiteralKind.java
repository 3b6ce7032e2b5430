package com.mainframe.transpiler.lst;

public enum LiteralKind {
    IDENTIFIER,
    NUMERIC,
    STRING,
    FIGURATIVE,
    KEYWORD,
    OPERATOR,
    PUNCTUATION,
    PICTURE
}
