package com.mainframe.transpiler.interp;

import com.mainframe.transpiler.diagnostics.TranspilerException;

/**
 * An interpreted run that cannot continue: a blocked paragraph or an irreducible range was
 * reached, a subscript left its table, or the step budget ran out.
 */
public class InterpreterException extends TranspilerException {

    public InterpreterException(String message) {
        super(message);
    }

    public InterpreterException(String message, Throwable cause) {
        super(message, cause);
    }
}
