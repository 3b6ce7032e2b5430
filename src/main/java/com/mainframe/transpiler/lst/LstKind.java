package com.mainframe.transpiler.lst;

public enum LstKind {
    DIVISION,
    SECTION,
    PARAGRAPH,
    SENTENCE,
    STATEMENT,
    CLAUSE,
    LITERAL,
    COMMENT
}
