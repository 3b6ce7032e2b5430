package com.mainframe.transpiler.ir;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Translated program: record layout, files, paragraph and region units and the control variables
 * structuring introduced. Generators read it and never change it.
 */
@Value
@Builder
public class IrProgram {
    String programId;

    /** Class or module name of the generated unit. */
    String unitName;

    /** Source path relative to its source root. */
    String sourcePath;

    @Singular
    List<IrField> records;

    @Singular
    List<IrFile> files;

    @Singular
    List<IrParagraph> paragraphs;

    @Singular
    List<IrRegion> regions;

    /** Region unit the program starts with; null when the procedure division is empty. */
    String entryRegion;

    @Singular
    List<ControlVariable> controlVariables;

    public Optional<IrParagraph> paragraph(String identifier) {
        return paragraphs.stream().filter(p -> p.getIdentifier().equals(identifier)).findFirst();
    }

    public Optional<IrRegion> region(String identifier) {
        return regions.stream().filter(r -> r.getIdentifier().equals(identifier)).findFirst();
    }
}
