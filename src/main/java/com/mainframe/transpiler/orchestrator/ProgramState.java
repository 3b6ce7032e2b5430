package com.mainframe.transpiler.orchestrator;

/**
 * Where a program is in the pipeline. {@code DONE} and {@code ERRORED} are final.
 */
public enum ProgramState {
    PENDING,
    PARSING,
    ANALYZING,
    STRUCTURING,
    TRANSLATING,
    AWAITING_AUGMENTATION,
    GENERATING,
    DONE,
    ERRORED;

    public boolean isFinal() {
        return this == DONE || this == ERRORED;
    }
}
