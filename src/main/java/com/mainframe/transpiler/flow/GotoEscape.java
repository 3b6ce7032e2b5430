package com.mainframe.transpiler.flow;

import com.mainframe.transpiler.lst.StatementNode;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * A GO TO inside a performed range whose target lies outside that range.
 */
@Value
public class GotoEscape {
    String region;
    String paragraph;
    String target;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    StatementNode statement;
}
