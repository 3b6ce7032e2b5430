package com.mainframe.transpiler.diagnostics;

import com.mainframe.transpiler.lst.SourceSpan;

import lombok.Value;

/**
 * A declaration or reference that cannot be resolved into a consistent symbol table. It blocks
 * translation of the affected record or paragraph only.
 */
@Value
public class SemanticError {
    SemanticErrorKind kind;

    /** COBOL name of the item (or paragraph) concerned. */
    String item;

    String message;
    SourceSpan span;

    public String location() {
        return span == null ? "?" : span.location();
    }
}
