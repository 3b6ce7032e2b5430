package com.mainframe.transpiler.lexer;

import lombok.Value;

/**
 * A COPY statement whose member could not be included.
 */
@Value
public class UnresolvedCopy {
    String memberName;
    String fileName;
    int line;
    String reason;
}
