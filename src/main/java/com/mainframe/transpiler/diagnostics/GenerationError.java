package com.mainframe.transpiler.diagnostics;

import lombok.Value;

/**
 * A program that could not be turned into target source: a template failure, an output that
 * could not be written, or an unexpected failure inside a stage. Fatal for that program only.
 */
@Value
public class GenerationError {
    String program;
    String stage;
    String message;
}
