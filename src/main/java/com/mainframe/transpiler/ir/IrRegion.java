package com.mainframe.transpiler.ir;

import com.mainframe.transpiler.flow.RegionShape;

import lombok.Builder;
import lombok.Value;

/**
 * Region unit: runs a paragraph range from its head, either as a call sequence or as a dispatch loop.
 */
@Value
@Builder
public class IrRegion {
    String key;
    String identifier;
    RegionShape shape;
    IrStatement body;
}
