package com.mainframe.transpiler.ir;

import lombok.Builder;
import lombok.Value;

/**
 * Paragraph unit: one method of the generated program per paragraph or section header.
 */
@Value
@Builder
public class IrParagraph {
    String cobolName;
    String identifier;
    int ordinal;
    String sectionName;
    IrStatement body;

    /** Set when the paragraph could not be lowered; the body then is empty. */
    String blockedReason;

    public boolean isBlocked() {
        return blockedReason != null;
    }
}
