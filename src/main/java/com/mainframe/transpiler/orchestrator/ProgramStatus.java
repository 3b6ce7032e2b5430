package com.mainframe.transpiler.orchestrator;

public enum ProgramStatus {
    SUCCESS,
    SUCCESS_WITH_EDGE_CASES,
    FAILED,

    /** The run was cancelled before the program started. Counts as failed. */
    CANCELLED;

    public boolean isFailed() {
        return this == FAILED || this == CANCELLED;
    }
}
