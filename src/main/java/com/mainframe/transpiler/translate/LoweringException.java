package com.mainframe.transpiler.translate;

import com.mainframe.transpiler.diagnostics.SemanticError;
import com.mainframe.transpiler.diagnostics.TranspilerException;

import lombok.Getter;

/**
 * Stops lowering of the current paragraph. Carries the semantic error to report, or none when the
 * cause was already reported by an earlier stage.
 */
@Getter
class LoweringException extends TranspilerException {
    private final transient SemanticError error;

    LoweringException(SemanticError error) {
        super(error.getMessage());
        this.error = error;
    }

    LoweringException(String reason) {
        super(reason);
        this.error = null;
    }
}
