package com.mainframe.transpiler.lexer;

public enum TokenType {
    WORD,
    NUMBER,
    STRING,
    PICTURE_STRING,
    PERIOD,
    LPAREN,
    RPAREN,
    OPERATOR,
    COMMENT,
    UNKNOWN,
    EOF
}
