package com.mainframe.transpiler.lexer;

import java.util.List;

import lombok.Value;

/**
 * Source lines of a program after COPY members have been spliced in.
 */
@Value
public class ExpandedSource {
    List<SourceLine> lines;
    List<UnresolvedCopy> unresolved;
    List<String> includedMembers;
}
