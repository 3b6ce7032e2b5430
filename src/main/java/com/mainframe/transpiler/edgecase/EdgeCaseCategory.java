package com.mainframe.transpiler.edgecase;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum EdgeCaseCategory {
    ALTER_STATEMENT(Severity.BLOCKING),
    SORT_MERGE(Severity.NEEDS_AUGMENTATION),
    IRREDUCIBLE_CONTROL_FLOW(Severity.BLOCKING),
    GOTO_OUT_OF_RANGE(Severity.NEEDS_AUGMENTATION),
    MIXED_PIC_COMPUTE(Severity.NEEDS_AUGMENTATION),
    REDEFINES_VARIABLE_OCCURS(Severity.NEEDS_AUGMENTATION),
    EMBEDDED_EXEC(Severity.NEEDS_AUGMENTATION),
    UNSUPPORTED_STATEMENT(Severity.NEEDS_AUGMENTATION),
    UNRESOLVED_COPY(Severity.BLOCKING),
    EXTERNAL_CALL(Severity.INFORMATIONAL),
    ALPHANUMERIC_EDITED_TARGET(Severity.INFORMATIONAL),
    REDEFINES_ALIASING(Severity.INFORMATIONAL);

    private final Severity severity;
}
