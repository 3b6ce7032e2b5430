package com.mainframe.transpiler.runtime;

import com.mainframe.transpiler.diagnostics.TranspilerException;

/**
 * An arithmetic result that cannot be stored: division by zero or an undefined power.
 */
public class SizeErrorException extends TranspilerException {

    public SizeErrorException(String message) {
        super(message);
    }
}
