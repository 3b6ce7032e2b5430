package com.mainframe.transpiler.lexer;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One physical line of COBOL source split into its reference-format areas.
 */
@Value
@Builder(toBuilder = true)
public class SourceLine {

    @NonNull
    String fileName;

    int number;

    @NonNull
    LineKind kind;

    char indicator;

    @NonNull
    @Builder.Default
    String sequenceArea = "";

    /**
     * Program text: columns 8 up to the right margin in fixed format, the whole line in free format.
     */
    @NonNull
    String content;

    /**
     * 1-based column of the first character of {@link #content}.
     */
    int contentColumn;

    @NonNull
    String raw;

    public boolean isCode() {
        return kind == LineKind.CODE;
    }
}
