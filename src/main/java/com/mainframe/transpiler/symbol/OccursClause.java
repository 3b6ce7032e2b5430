package com.mainframe.transpiler.symbol;

import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

/**
 * OCCURS min [TO max] [DEPENDING ON item] [INDEXED BY ...].
 */
@Value
@Builder
public class OccursClause {
    int min;
    int max;
    String dependingOnName;

    /** Resolved counter item; null when fixed or when the name did not resolve. */
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    DataItem dependingOn;

    @Singular
    List<String> indexNames;

    public boolean isVariable() {
        return dependingOnName != null;
    }
}
