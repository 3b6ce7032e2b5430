package com.mainframe.transpiler.ir;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class IrFile {
    String cobolName;
    String identifier;

    /** ASSIGN target; names the record stream. */
    String assignment;

    String organization;

    /** 01 records under the FD; a READ fills all of them. */
    @Singular
    List<IrField> records;

    int recordLength;

    /** FILE STATUS field, or null. */
    IrField status;
}
