package com.mainframe.transpiler.diagnostics;

public enum SemanticErrorKind {
    DUPLICATE_RECORD,
    UNDECLARED_REDEFINES,
    REDEFINES_LEVEL_MISMATCH,
    INVALID_DEPENDING_ON,
    INVALID_PICTURE,
    INVALID_OCCURS,
    INVALID_RENAMES,
    UNDECLARED_REFERENCE,
    AMBIGUOUS_REFERENCE,
    UNDECLARED_PARAGRAPH,
    UNDECLARED_FILE,
    TYPE_MISMATCH
}
