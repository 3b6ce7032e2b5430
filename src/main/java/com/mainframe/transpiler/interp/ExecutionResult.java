package com.mainframe.transpiler.interp;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Observable outcome of an interpreted run.
 */
@Value
@Builder
public class ExecutionResult {
    /** DISPLAY output, one entry per line. */
    List<String> displayed;

    /** Records written, by file name. */
    Map<String, List<String>> written;

    /** Times each paragraph ran, by COBOL name, in program order. */
    @Singular
    Map<String, Integer> paragraphCounts;

    /** External calls the run skipped, by name. */
    @Singular
    List<String> externalCalls;

    long steps;

    /** True when the run ended on STOP RUN or GOBACK rather than falling off the end. */
    boolean stopped;

    /** Why the run failed, or null. */
    String failure;

    public boolean isSucceeded() {
        return failure == null;
    }

    public int executedParagraphs() {
        return (int) paragraphCounts.values().stream().filter(c -> c > 0).count();
    }
}
