package com.mainframe.transpiler.flow;

import com.mainframe.transpiler.lst.SourceSpan;

import lombok.Value;

/**
 * A paragraph inside a cyclic part of a region that has more than one entry. Such a region is
 * never lowered into structured control flow.
 */
@Value
public class StructuringFailure {
    String region;
    String paragraph;
    String message;
    SourceSpan span;
}
