package com.mainframe.transpiler.cli.exception;

import java.util.List;

import com.mainframe.transpiler.diagnostics.TranspilerException;

/**
 * Every problem found with the transpile options, reported together so one invocation lists
 * them all.
 */
public class OptionsValidationException extends TranspilerException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(errors.size() + " invalid option(s): " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    /** One message per invalid option, in the order they were checked. */
    public List<String> getErrors() {
        return errors;
    }
}
