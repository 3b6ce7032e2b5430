package com.mainframe.transpiler.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Data model of one generated unit as the templates see it. Every body is pre-rendered into
 * lines by the target renderer; templates only lay the unit out.
 */
@Value
@Builder
public class UnitModel {
    String unitName;
    String programId;
    String sourcePath;

    /** Record types, outermost first. */
    @Singular
    List<TypeModel> types;

    /** Member declarations of the unit: records, control variables and record streams. */
    @Singular
    List<String> fields;

    /** Statements run when the unit is constructed. */
    @Singular("constructorLine")
    List<String> constructor;

    @Singular
    List<MethodModel> paragraphs;

    @Singular
    List<MethodModel> regions;

    /** Region method the unit starts with; null for an empty procedure division. */
    String entry;
}
