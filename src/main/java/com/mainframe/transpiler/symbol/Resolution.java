package com.mainframe.transpiler.symbol;

import java.util.List;

import lombok.Value;

/**
 * Outcome of looking up a possibly qualified data name.
 */
@Value
public class Resolution {

    public enum Status {
        RESOLVED,
        UNDECLARED,
        AMBIGUOUS
    }

    Status status;
    DataItem item;
    List<DataItem> candidates;

    static Resolution of(List<DataItem> matches) {
        if (matches.isEmpty()) {
            return new Resolution(Status.UNDECLARED, null, List.of());
        }
        if (matches.size() > 1) {
            return new Resolution(Status.AMBIGUOUS, null, List.copyOf(matches));
        }
        return new Resolution(Status.RESOLVED, matches.get(0), List.copyOf(matches));
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }
}
