package com.mainframe.transpiler.lexer;

import java.util.List;

import com.mainframe.transpiler.diagnostics.SyntaxError;

import lombok.Value;

@Value
public class TokenizeResult {
    List<CobolToken> tokens;
    List<SyntaxError> errors;
}
