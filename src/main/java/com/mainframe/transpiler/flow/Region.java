package com.mainframe.transpiler.flow;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * A contiguous paragraph range entered at its head: the main program or one performed range.
 */
@Value
public class Region {
    /** {@code HEAD} or {@code HEAD..LAST}; {@code MAIN} for the main region. */
    String key;

    boolean main;
    RegionShape shape;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    List<FlowNode> members;

    /**
     * Members a SEQUENTIAL region calls: all of them, or for the main region those up to the first
     * that always terminates.
     */
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    List<FlowNode> callSequence;

    public FlowNode head() {
        return members.get(0);
    }

    public FlowNode last() {
        return members.get(members.size() - 1);
    }

    public boolean contains(FlowNode node) {
        return node.getOrdinal() >= head().getOrdinal() && node.getOrdinal() <= last().getOrdinal();
    }
}
