package com.mainframe.transpiler.ir;

import lombok.Value;

/**
 * Synthetic integer variable introduced by structuring: the pending jump target and the current
 * paragraph of each dispatch loop.
 */
@Value
public class ControlVariable {
    String identifier;
    int initialValue;
}
