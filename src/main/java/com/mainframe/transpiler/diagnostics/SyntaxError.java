package com.mainframe.transpiler.diagnostics;

import java.util.List;

import lombok.Value;

/**
 * A token sequence the parser could not accept.
 */
@Value
public class SyntaxError {
    String fileName;
    int line;
    int column;
    List<String> expected;
    String found;

    /** Paragraph being parsed when the error occurred, or null outside the procedure division. */
    String paragraph;

    public String getMessage() {
        String expectation = expected.size() == 1 ? expected.get(0) : "one of " + expected;
        return String.format("%s:%d:%d: expected %s but found '%s'", fileName, line, column, expectation, found);
    }
}
