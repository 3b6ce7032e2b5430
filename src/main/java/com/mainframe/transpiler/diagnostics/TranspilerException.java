package com.mainframe.transpiler.diagnostics;

/**
 * Unchecked base of the exceptions raised inside a pipeline stage.
 */
public class TranspilerException extends RuntimeException {

    public TranspilerException(String message) {
        super(message);
    }

    public TranspilerException(String message, Throwable cause) {
        super(message, cause);
    }
}
