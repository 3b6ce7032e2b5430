package com.mainframe.transpiler.edgecase;

import com.mainframe.transpiler.lst.SourceSpan;
import com.mainframe.transpiler.lst.StatementNode;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * A construct the deterministic pipeline cannot translate faithfully, or can only approximate.
 */
@Value
@Builder(toBuilder = true)
public class EdgeCase {
    /** {@code EC-<n>}, assigned in source order. */
    String id;

    EdgeCaseCategory category;
    Severity severity;
    SourceSpan span;

    /** Enclosing paragraph; null for data division findings. */
    String paragraph;

    String message;

    /** Source text of the offending construct, submitted to augmentation. */
    String snippet;

    /** Statement the finding belongs to, when there is one. */
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    StatementNode statement;

    public boolean isBlocking() {
        return severity == Severity.BLOCKING;
    }

    public boolean needsAugmentation() {
        return severity == Severity.NEEDS_AUGMENTATION;
    }

    public String location() {
        return span == null ? "?" : span.location();
    }
}
