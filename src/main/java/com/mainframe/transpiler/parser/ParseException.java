package com.mainframe.transpiler.parser;

import java.util.List;

import com.mainframe.transpiler.diagnostics.TranspilerException;
import com.mainframe.transpiler.lexer.CobolToken;

import lombok.Getter;

/**
 * Thrown while parsing a paragraph or data entry; caught at the paragraph boundary.
 */
@Getter
public class ParseException extends TranspilerException {
    private final transient CobolToken found;
    private final List<String> expected;

    public ParseException(CobolToken found, List<String> expected) {
        super("Expected " + expected + " but found '" + found.getText() + "' at line " + found.getLine());
        this.found = found;
        this.expected = List.copyOf(expected);
    }

    public ParseException(CobolToken found, String expected) {
        this(found, List.of(expected));
    }
}
